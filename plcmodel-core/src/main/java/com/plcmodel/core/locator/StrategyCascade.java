package com.plcmodel.core.locator;

import com.plcmodel.core.diagnostics.DiagnosticEvent;
import com.plcmodel.core.diagnostics.DiagnosticSink;
import com.plcmodel.core.document.DocumentNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Runs locator strategies tier by tier until one result is accepted.
 *
 * <p>Tiers are tried in {@link LocatorTier} order regardless of registration order. Each
 * attempt emits a {@code STRATEGY_ATTEMPTED} event, followed by {@code SECTION_LOCATED} when
 * the acceptance predicate holds or {@code SECTION_NOT_FOUND} otherwise. Once a tier is
 * accepted, later tiers are not run.
 *
 * @param <T> type of located items
 */
public class StrategyCascade<T> {

    private static final Logger log = LoggerFactory.getLogger(StrategyCascade.class);

    private final String concern;
    private final Map<LocatorTier, LocatorStrategy<T>> strategies = new EnumMap<>(LocatorTier.class);
    private Predicate<List<T>> acceptance = items -> !items.isEmpty();

    /**
     * @param concern section name used in diagnostics, e.g. {@code application}
     */
    public StrategyCascade(String concern) {
        this.concern = Objects.requireNonNull(concern, "concern must not be null");
    }

    public StrategyCascade<T> tier(LocatorTier tier, LocatorStrategy<T> strategy) {
        strategies.put(Objects.requireNonNull(tier), Objects.requireNonNull(strategy));
        return this;
    }

    /**
     * Replaces the default acceptance rule (non-empty result).
     */
    public StrategyCascade<T> acceptWhen(Predicate<List<T>> predicate) {
        this.acceptance = Objects.requireNonNull(predicate);
        return this;
    }

    /**
     * Runs the tiers in order.
     *
     * @param root document root
     * @param sink receiver of diagnostics
     * @return accepted tier with its items, or {@link Located#none()}
     */
    public Located<T> run(DocumentNode root, DiagnosticSink sink) {
        for (Map.Entry<LocatorTier, LocatorStrategy<T>> entry : strategies.entrySet()) {
            LocatorTier tier = entry.getKey();
            sink.accept(DiagnosticEvent.strategyAttempted(concern, tier.id()));

            List<T> items = new ArrayList<>(entry.getValue().locate(root));
            if (acceptance.test(items)) {
                log.debug("Located {} via {} ({} items)", concern, tier.id(), items.size());
                sink.accept(DiagnosticEvent.sectionLocated(concern, tier.id(), items.size()));
                return new Located<>(tier, items);
            }
            log.debug("No {} found via {}", concern, tier.id());
            sink.accept(DiagnosticEvent.sectionNotFound(concern, tier.id()));
        }
        return Located.none();
    }
}

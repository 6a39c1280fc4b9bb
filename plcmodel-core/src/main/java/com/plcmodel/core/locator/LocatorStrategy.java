package com.plcmodel.core.locator;

import com.plcmodel.core.document.DocumentNode;

import java.util.List;

/**
 * One way of finding a section in an export document.
 *
 * <p>Strategies are combined by a {@link StrategyCascade}: each tier gets one strategy, and
 * the first tier whose result is accepted wins. A strategy that finds nothing returns an
 * empty list; it does not decide whether its result is good enough.
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * LocatorStrategy<DocumentNode> resources =
 *     root -> query.findAll(root, ".//resource", ".//types");
 * }</pre>
 *
 * @param <T> type of located items
 * @since 1.0.0
 */
@FunctionalInterface
public interface LocatorStrategy<T> {

    /**
     * Looks for items below the document root.
     *
     * @param root document root
     * @return located items in document order, empty if nothing found (never null)
     */
    List<T> locate(DocumentNode root);

    /**
     * Returns a strategy that never finds anything.
     *
     * @param <T> type of located items
     * @return no-op strategy
     */
    static <T> LocatorStrategy<T> none() {
        return root -> List.of();
    }
}

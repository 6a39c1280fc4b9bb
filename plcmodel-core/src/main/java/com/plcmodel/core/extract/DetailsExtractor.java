package com.plcmodel.core.extract;

import com.plcmodel.core.document.DocumentNode;
import com.plcmodel.core.document.TreeQuery;
import com.plcmodel.core.model.TypeInfo;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Extracts auxiliary details attached verbatim to every emitted type record.
 *
 * <p>Keys, in order, when present: {@code baseType}, {@code initialValue},
 * {@code description}. Composite base types (struct, enum, union bodies) are not reported
 * as a base type since their content is captured by the classifier.
 */
public class DetailsExtractor {

    public static final String KEY_BASE_TYPE = "baseType";
    public static final String KEY_INITIAL_VALUE = "initialValue";
    public static final String KEY_DESCRIPTION = "description";

    private static final Set<String> COMPOSITE_BODIES = Set.of("struct", "enum", "union", "values");

    private static final String[] BASE_TYPE_PATHS = {"./baseType"};
    private static final String[] INITIAL_VALUE_PATHS = {"./initialValue/simpleValue", "./initialValue"};
    private static final String[] DESCRIPTION_PATHS = {"./documentation/xhtml/p", "./documentation"};

    private final TreeQuery query;
    private final TypeInfoExtractor types;

    public DetailsExtractor(TreeQuery query) {
        this.query = Objects.requireNonNull(query, "query must not be null");
        this.types = new TypeInfoExtractor(query);
    }

    /**
     * Extracts details of a declaration node.
     *
     * @param node type, value or unit node
     * @return ordered details, empty if none apply
     */
    public Map<String, String> extractDetails(DocumentNode node) {
        Map<String, String> details = new LinkedHashMap<>();

        query.findFirst(node, BASE_TYPE_PATHS)
            .flatMap(this::describeBaseType)
            .ifPresent(baseType -> details.put(KEY_BASE_TYPE, baseType));

        query.findFirst(node, INITIAL_VALUE_PATHS)
            .flatMap(FieldExtractor::valueOf)
            .ifPresent(value -> details.put(KEY_INITIAL_VALUE, value));

        query.findText(node, DESCRIPTION_PATHS)
            .ifPresent(description -> details.put(KEY_DESCRIPTION, description));

        return details;
    }

    private Optional<String> describeBaseType(DocumentNode baseType) {
        boolean composite = baseType.children().stream()
            .anyMatch(child -> COMPOSITE_BODIES.contains(child.localName()));
        if (composite) {
            return Optional.empty();
        }
        TypeInfo info = types.describe(baseType);
        return TypeInfo.UNKNOWN.equals(info.name()) ? Optional.empty() : Optional.of(info.name());
    }
}

package com.plcmodel.core.extract;

import com.plcmodel.core.document.DocumentNode;
import com.plcmodel.core.document.TreeQuery;
import com.plcmodel.core.model.TypeInfo;
import com.plcmodel.core.model.VariableRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Turns {@code variable} nodes into {@link VariableRecord}s.
 *
 * <p>A node is well-formed when a name resolves; everything else is optional. The returned
 * record has no group or origin yet; callers assign them with
 * {@link VariableRecord#inGroup(String, String)}.
 *
 * @since 1.0.0
 */
public class FieldExtractor {

    private static final Logger log = LoggerFactory.getLogger(FieldExtractor.class);

    private static final String[] TYPE_PATHS = {"./type"};
    private static final String[] INITIAL_VALUE_PATHS = {"./initialValue/simpleValue", "./initialValue"};
    private static final String[] COMMENT_PATHS = {"./documentation", "./comment"};

    private final TreeQuery query;
    private final NameResolver names;
    private final TypeInfoExtractor types;

    public FieldExtractor(TreeQuery query) {
        this.query = Objects.requireNonNull(query, "query must not be null");
        this.names = new NameResolver(query);
        this.types = new TypeInfoExtractor(query);
    }

    /**
     * Extracts a variable declaration.
     *
     * @param node node believed to declare a variable
     * @return the record, or empty if the node has no resolvable name
     */
    public Optional<VariableRecord> extractVariable(DocumentNode node) {
        Optional<String> name = names.resolve(node);
        if (name.isEmpty()) {
            log.debug("Variable node without name: {}", node);
            return Optional.empty();
        }

        TypeInfo typeInfo = types.describe(query.findFirst(node, TYPE_PATHS));
        String initialValue = query.findFirst(node, INITIAL_VALUE_PATHS)
            .flatMap(FieldExtractor::valueOf)
            .orElse(null);
        String comment = query.findText(node, COMMENT_PATHS).orElse(null);

        VariableRecord variable = new VariableRecord(
            name.get(),
            typeInfo.name(),
            initialValue,
            comment,
            null,
            null,
            typeInfo
        );
        log.trace("Extracted variable {} : {}", variable.name(), variable.type());
        return Optional.of(variable);
    }

    /**
     * Reads a PLCopen value element: the {@code value} attribute, else its text.
     */
    static Optional<String> valueOf(DocumentNode valueNode) {
        Optional<String> attribute = valueNode.attribute("value");
        if (attribute.isPresent()) {
            return attribute;
        }
        String text = valueNode.text();
        return text.isEmpty() ? Optional.empty() : Optional.of(text);
    }
}

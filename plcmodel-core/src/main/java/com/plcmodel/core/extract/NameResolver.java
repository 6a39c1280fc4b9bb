package com.plcmodel.core.extract;

import com.plcmodel.core.document.DocumentNode;
import com.plcmodel.core.document.TreeQuery;

import java.util.Objects;
import java.util.Optional;

/**
 * Resolves the name of a declaration node.
 *
 * <p>The {@code name} attribute wins; a child {@code name} element is the fallback used by
 * older export shapes. Blank values count as missing.
 */
public class NameResolver {

    private static final String NAME_ATTRIBUTE = "name";
    private static final String NAME_ELEMENT_PATH = "./name";

    private final TreeQuery query;

    public NameResolver(TreeQuery query) {
        this.query = Objects.requireNonNull(query, "query must not be null");
    }

    /**
     * Resolves the declared name of a node.
     *
     * @param node declaration node
     * @return trimmed name, or empty if the node carries none
     */
    public Optional<String> resolve(DocumentNode node) {
        Optional<String> fromAttribute = node.attribute(NAME_ATTRIBUTE).map(String::trim);
        if (fromAttribute.isPresent()) {
            return fromAttribute;
        }
        return query.findText(node, NAME_ELEMENT_PATH);
    }
}

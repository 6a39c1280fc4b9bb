package com.plcmodel.core.classifier;

import com.plcmodel.core.document.DocumentNode;
import com.plcmodel.core.model.TypeDefinition;

import java.util.Optional;

/**
 * One step of the type classification cascade.
 *
 * <p>A rule inspects the structural evidence of a named type node and either claims the
 * node, returning the record it builds, or passes, returning empty. Rules are evaluated in
 * order and the first claim wins.
 */
@FunctionalInterface
public interface ClassificationRule {

    /**
     * @param node type-definition node
     * @param name resolved type name
     * @return the classified record, or empty to let the next rule decide
     */
    Optional<TypeDefinition> apply(DocumentNode node, String name);
}

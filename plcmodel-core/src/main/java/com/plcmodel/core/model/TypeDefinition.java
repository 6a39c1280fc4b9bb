package com.plcmodel.core.model;

import java.util.Map;

/**
 * Common view of a classified type definition.
 *
 * <p>Every type-definition node that carries a name ends up as exactly one implementation
 * of this interface: {@link DataTypeRecord}, {@link EnumRecord}, {@link UnionRecord} or
 * {@link StructureRecord}. The name is the identity key across all four collections.
 *
 * @since 1.0.0
 */
public interface TypeDefinition {

    /**
     * @return type name, never blank
     */
    String name();

    /**
     * @return classification result
     */
    TypeKind kind();

    /**
     * @return auxiliary details (base type, initial value, description) in insertion order
     */
    Map<String, String> details();
}

package com.plcmodel.core.model;

/**
 * Mutually exclusive kinds a type definition is classified into.
 *
 * @since 1.0.0
 */
public enum TypeKind {
    /** Enumeration with an ordered value list. */
    ENUM,
    /** Union whose members share storage; only recognised inside union blocks. */
    UNION,
    /** Structure with ordered member variables. */
    STRUCTURE,
    /** Opaque or alias data type without members or values. */
    BASIC
}

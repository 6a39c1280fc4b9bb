package com.plcmodel.core.resolver;

import com.plcmodel.core.model.TypeKind;

import java.util.Objects;

/**
 * A variable whose declared type names a user-defined type.
 *
 * @param owner collection key and owner, e.g. {@code "Structures/ST_Motor"}
 * @param variableName referencing variable or member
 * @param declaredType type as declared, wrappers included
 * @param referencedName type name after unwrapping
 * @param kind kind of the referenced definition, null if not in the model
 */
public record TypeReference(
    String owner,
    String variableName,
    String declaredType,
    String referencedName,
    TypeKind kind
) {
    public TypeReference {
        Objects.requireNonNull(owner, "owner must not be null");
        Objects.requireNonNull(variableName, "variableName must not be null");
        Objects.requireNonNull(referencedName, "referencedName must not be null");
    }

    public boolean isResolved() {
        return kind != null;
    }
}

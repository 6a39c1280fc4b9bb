package com.plcmodel.core.resolver;

import com.plcmodel.core.model.TypeKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Structure or union with its nested structures expanded.
 *
 * <p>A circular entry stands for a type already being expanded further up the chain; its
 * members are listed but its nested list stays empty.
 *
 * @param name type name
 * @param kind {@link TypeKind#STRUCTURE} or {@link TypeKind#UNION}
 * @param members members in declaration order
 * @param nested expanded nested types, one per nesting member
 * @param circular true if expansion stopped at a cycle
 */
public record ResolvedStructure(
    String name,
    TypeKind kind,
    List<ResolvedMember> members,
    List<ResolvedStructure> nested,
    boolean circular
) {
    public ResolvedStructure {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        members = members == null ? List.of() : List.copyOf(members);
        nested = nested == null ? List.of() : List.copyOf(nested);
    }

    /**
     * Flattens members of this type and its nested types, depth first.
     *
     * <p>Nested member names are prefixed with the embedding member, as in
     * {@code "start.x"}.
     *
     * @return flattened member paths
     */
    public List<String> memberPaths() {
        List<String> paths = new ArrayList<>();
        collectPaths("", paths);
        return paths;
    }

    private void collectPaths(String prefix, List<String> paths) {
        for (ResolvedMember member : members) {
            String path = prefix + member.name();
            paths.add(path);
            if (!member.isNested() || circular) {
                continue;
            }
            nested.stream()
                .filter(child -> child.name().equals(member.nestedType()))
                .findFirst()
                .ifPresent(child -> child.collectPaths(path + ".", paths));
        }
    }
}

package com.plcmodel.core.resolver;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Outcome of resolving the type references of one model.
 *
 * @param registry type index the references were resolved against
 * @param structures expanded structures and unions keyed by name, structures first
 * @param references variables that name a user-defined type, resolved or not
 * @param dependencies types each structure or union refers to, without self references;
 *     types with no dependencies are absent
 * @param circularReferences detected cycles, each as {@code "A -> B -> A"}
 */
public record TypeResolution(
    TypeRegistry registry,
    Map<String, ResolvedStructure> structures,
    List<TypeReference> references,
    Map<String, List<String>> dependencies,
    List<String> circularReferences
) {
    public TypeResolution {
        structures = structures == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(structures));
        references = references == null ? List.of() : List.copyOf(references);
        dependencies = dependencies == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(dependencies));
        circularReferences = circularReferences == null ? List.of() : List.copyOf(circularReferences);
    }

    public Optional<ResolvedStructure> structure(String name) {
        return Optional.ofNullable(structures.get(name));
    }

    public List<String> dependenciesOf(String typeName) {
        return dependencies.getOrDefault(typeName, List.of());
    }

    /**
     * Returns references to derived types the model does not define, such as library types.
     *
     * @return unresolved references in discovery order
     */
    public List<TypeReference> unresolvedReferences() {
        return references.stream().filter(reference -> !reference.isResolved()).toList();
    }

    public boolean hasCircularReferences() {
        return !circularReferences.isEmpty();
    }
}

package com.plcmodel.core.resolver;

import com.plcmodel.core.model.CanonicalModel;
import com.plcmodel.core.model.ModelCollection;
import com.plcmodel.core.model.ProgramUnitRecord;
import com.plcmodel.core.model.Routine;
import com.plcmodel.core.model.StructureRecord;
import com.plcmodel.core.model.TypeDefinition;
import com.plcmodel.core.model.TypeKind;
import com.plcmodel.core.model.UnionRecord;
import com.plcmodel.core.model.VariableRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Links declared types to their definitions over a finished model.
 *
 * <p>Runs after extraction, so every definition of the document is known regardless of the
 * order types were declared in. Three views are produced:
 * <ul>
 *   <li>references of structure and union members, global variables, program unit
 *       variables and method variables to user-defined types</li>
 *   <li>structures and unions with nested structures expanded recursively; a type that is
 *       reached again while it is being expanded is reported as a circular reference and
 *       not expanded a second time</li>
 *   <li>the dependency graph of structures and unions</li>
 * </ul>
 *
 * <p>The resolver never changes the model. Instances are not thread-safe; use one per
 * {@link #resolve(CanonicalModel)} call or call it from a single thread.
 */
public class TypeResolver {

    private static final Logger log = LoggerFactory.getLogger(TypeResolver.class);

    private TypeRegistry registry;
    private Map<String, ResolvedStructure> resolved;
    private List<String> cycles;
    private Set<String> unitNames;

    /**
     * Resolves all type references of a model.
     *
     * @param model finished model
     * @return resolution views
     */
    public TypeResolution resolve(CanonicalModel model) {
        registry = TypeRegistry.of(model);
        resolved = new HashMap<>();
        cycles = new ArrayList<>();
        unitNames = new HashSet<>();
        model.programUnits().forEach(unit -> unitNames.add(unit.name()));
        log.debug("Resolving types of {} against {} definitions", model.sourceName(), registry.size());

        Map<String, ResolvedStructure> structures = new LinkedHashMap<>();
        for (StructureRecord structure : model.structures()) {
            structures.put(structure.name(), expand(structure, new LinkedHashSet<>()));
        }
        for (UnionRecord union : model.unions()) {
            structures.put(union.name(), expand(union, new LinkedHashSet<>()));
        }

        TypeResolution resolution = new TypeResolution(
            registry, structures, references(model), dependencies(model), cycles);
        log.debug("Resolved {} structures, {} references ({} unresolved), {} cycles",
            structures.size(), resolution.references().size(),
            resolution.unresolvedReferences().size(), cycles.size());
        return resolution;
    }

    private ResolvedStructure expand(TypeDefinition type, Set<String> chain) {
        List<VariableRecord> members = membersOf(type);
        if (chain.contains(type.name())) {
            String cycle = describeCycle(chain, type.name());
            log.warn("Circular reference detected: {}", cycle);
            if (!cycles.contains(cycle)) {
                cycles.add(cycle);
            }
            return new ResolvedStructure(type.name(), type.kind(), plainMembers(members), List.of(), true);
        }
        ResolvedStructure cached = resolved.get(type.name());
        if (cached != null) {
            return cached;
        }

        chain.add(type.name());
        List<ResolvedMember> resolvedMembers = new ArrayList<>();
        List<ResolvedStructure> nested = new ArrayList<>();
        for (VariableRecord member : members) {
            Optional<TypeDefinition> target = registry.lookup(member.type()).filter(TypeResolver::hasMembers);
            if (target.isPresent()) {
                nested.add(expand(target.get(), chain));
                resolvedMembers.add(new ResolvedMember(
                    member.name(), member.type(), member.defaultValue(), target.get().name()));
            } else {
                resolvedMembers.add(new ResolvedMember(member.name(), member.type(), member.defaultValue(), null));
            }
        }
        chain.remove(type.name());

        ResolvedStructure result = new ResolvedStructure(type.name(), type.kind(), resolvedMembers, nested, false);
        resolved.put(type.name(), result);
        return result;
    }

    private static String describeCycle(Set<String> chain, String repeated) {
        List<String> path = new ArrayList<>();
        boolean inCycle = false;
        for (String name : chain) {
            inCycle = inCycle || name.equals(repeated);
            if (inCycle) {
                path.add(name);
            }
        }
        path.add(repeated);
        return String.join(" -> ", path);
    }

    private static List<ResolvedMember> plainMembers(List<VariableRecord> members) {
        return members.stream()
            .map(member -> new ResolvedMember(member.name(), member.type(), member.defaultValue(), null))
            .toList();
    }

    private List<TypeReference> references(CanonicalModel model) {
        List<TypeReference> references = new ArrayList<>();
        for (StructureRecord structure : model.structures()) {
            collect(owner(ModelCollection.STRUCTURES, structure.name()), structure.members(), references);
        }
        for (UnionRecord union : model.unions()) {
            collect(owner(ModelCollection.UNIONS, union.name()), union.members(), references);
        }
        for (VariableRecord variable : model.globalVariables()) {
            collect(owner(ModelCollection.GLOBAL_VARIABLES, variable.groupName()), List.of(variable), references);
        }
        for (ProgramUnitRecord unit : model.programUnits()) {
            collect(owner(ModelCollection.PROGRAM_UNITS, unit.name()), unit.variables(), references);
            for (Routine routine : unit.methods()) {
                collect(owner(ModelCollection.PROGRAM_UNITS, unit.name() + "." + routine.name()),
                    routine.variables(), references);
            }
        }
        return references;
    }

    private void collect(String owner, List<VariableRecord> variables, List<TypeReference> references) {
        for (VariableRecord variable : variables) {
            String name = TypeRegistry.referencedName(variable.type());
            Optional<TypeDefinition> target = registry.lookup(name);
            if (target.isPresent()) {
                references.add(new TypeReference(owner, variable.name(), variable.type(), name, target.get().kind()));
            } else if (variable.typeInfo().derivedFrom() != null && !unitNames.contains(name)) {
                // derived but not defined here, usually a library type; block instances are not types
                references.add(new TypeReference(owner, variable.name(), variable.type(), name, null));
            }
        }
    }

    private Map<String, List<String>> dependencies(CanonicalModel model) {
        Map<String, List<String>> graph = new LinkedHashMap<>();
        for (UnionRecord union : model.unions()) {
            addDependencies(graph, union.name(), union.members());
        }
        for (StructureRecord structure : model.structures()) {
            addDependencies(graph, structure.name(), structure.members());
        }
        return graph;
    }

    private void addDependencies(Map<String, List<String>> graph, String typeName, List<VariableRecord> members) {
        Set<String> targets = new LinkedHashSet<>();
        for (VariableRecord member : members) {
            registry.lookup(member.type())
                .map(TypeDefinition::name)
                .filter(name -> !name.equals(typeName))
                .ifPresent(targets::add);
        }
        if (!targets.isEmpty()) {
            graph.put(typeName, List.copyOf(targets));
        }
    }

    private static String owner(ModelCollection collection, String name) {
        return collection.key() + "/" + name;
    }

    private static boolean hasMembers(TypeDefinition type) {
        return type.kind() == TypeKind.STRUCTURE || type.kind() == TypeKind.UNION;
    }

    private static List<VariableRecord> membersOf(TypeDefinition type) {
        if (type instanceof StructureRecord structure) {
            return structure.members();
        }
        if (type instanceof UnionRecord union) {
            return union.members();
        }
        return List.of();
    }
}

package com.plcmodel.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Canonical model extracted from one export document.
 *
 * <p>Keyed collections hold at most one record per name, in discovery order. Global
 * variables are kept in discovery order without deduplication, since distinct groups may
 * reuse a simple name.
 *
 * @param sourceName name of the source document (file name or caller label)
 * @param projectInfo project-level facts
 * @param dataTypes basic data types
 * @param programUnits program units
 * @param globalVariables global variables in discovery order
 * @param enums enumerations
 * @param unions unions
 * @param structures structures
 */
public record CanonicalModel(
    String sourceName,
    ProjectInfo projectInfo,
    List<DataTypeRecord> dataTypes,
    List<ProgramUnitRecord> programUnits,
    List<VariableRecord> globalVariables,
    List<EnumRecord> enums,
    List<UnionRecord> unions,
    List<StructureRecord> structures
) {
    public CanonicalModel {
        Objects.requireNonNull(sourceName, "sourceName must not be null");
        if (projectInfo == null) {
            projectInfo = ProjectInfo.unknown();
        }
        dataTypes = dataTypes == null ? List.of() : List.copyOf(dataTypes);
        programUnits = programUnits == null ? List.of() : List.copyOf(programUnits);
        globalVariables = globalVariables == null ? List.of() : List.copyOf(globalVariables);
        enums = enums == null ? List.of() : List.copyOf(enums);
        unions = unions == null ? List.of() : List.copyOf(unions);
        structures = structures == null ? List.of() : List.copyOf(structures);
    }

    /**
     * Computes item counts for this model.
     *
     * @return summary counts
     */
    public ModelSummary summary() {
        int actions = programUnits.stream().mapToInt(unit -> unit.actions().size()).sum();
        int methods = programUnits.stream().mapToInt(unit -> unit.methods().size()).sum();
        return new ModelSummary(
            dataTypes.size(),
            programUnits.size(),
            globalVariables.size(),
            enums.size(),
            unions.size(),
            structures.size(),
            actions,
            methods
        );
    }

    /**
     * Returns true if no collection holds anything.
     *
     * @return true for an empty model
     */
    public boolean isEmpty() {
        return summary().totalItems() == 0;
    }
}

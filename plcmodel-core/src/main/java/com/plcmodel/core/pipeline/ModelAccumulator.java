package com.plcmodel.core.pipeline;

import com.plcmodel.core.diagnostics.DiagnosticEvent;
import com.plcmodel.core.diagnostics.DiagnosticSink;
import com.plcmodel.core.model.CanonicalModel;
import com.plcmodel.core.model.DataTypeRecord;
import com.plcmodel.core.model.EnumRecord;
import com.plcmodel.core.model.ModelCollection;
import com.plcmodel.core.model.ProgramUnitRecord;
import com.plcmodel.core.model.ProjectInfo;
import com.plcmodel.core.model.StructureRecord;
import com.plcmodel.core.model.TypeDefinition;
import com.plcmodel.core.model.TypeKind;
import com.plcmodel.core.model.UnionRecord;
import com.plcmodel.core.model.VariableRecord;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Collects records for one extraction run and enforces name uniqueness.
 *
 * <p>Each keyed collection keeps the first record per name. The four type collections
 * additionally share one registry of classified names, so a name emitted as a union is never
 * emitted again as a structure, enum or basic type. Global variables are appended without
 * any uniqueness check.
 */
class ModelAccumulator {

    private final DiagnosticSink sink;

    private final NamedCollection<ProgramUnitRecord> programUnits = new NamedCollection<>();
    private final List<VariableRecord> globalVariables = new ArrayList<>();
    private final NamedCollection<DataTypeRecord> dataTypes = new NamedCollection<>();
    private final NamedCollection<EnumRecord> enums = new NamedCollection<>();
    private final NamedCollection<UnionRecord> unions = new NamedCollection<>();
    private final NamedCollection<StructureRecord> structures = new NamedCollection<>();
    private final Set<String> classifiedNames = new HashSet<>();

    ModelAccumulator(DiagnosticSink sink) {
        this.sink = Objects.requireNonNull(sink, "sink must not be null");
    }

    boolean addProgramUnit(ProgramUnitRecord unit) {
        return admit(ModelCollection.PROGRAM_UNITS, unit.name(), programUnits.addIfAbsent(unit.name(), unit));
    }

    void addGlobalVariable(VariableRecord variable) {
        globalVariables.add(variable);
        sink.accept(DiagnosticEvent.recordAccepted(ModelCollection.GLOBAL_VARIABLES.key(), variable.name()));
    }

    /**
     * Returns true if the name is already held by any of the four type collections.
     */
    boolean isClassified(String name) {
        return classifiedNames.contains(name);
    }

    /**
     * Adds a classified type unless its name has been classified before.
     *
     * @param type classified type
     * @return true if added
     */
    boolean addType(TypeDefinition type) {
        ModelCollection collection = collectionOf(type.kind());
        if (!classifiedNames.add(type.name())) {
            return admit(collection, type.name(), false);
        }

        boolean added;
        if (type instanceof UnionRecord union) {
            added = unions.addIfAbsent(union.name(), union);
        } else if (type instanceof EnumRecord enumRecord) {
            added = enums.addIfAbsent(enumRecord.name(), enumRecord);
        } else if (type instanceof StructureRecord structure) {
            added = structures.addIfAbsent(structure.name(), structure);
        } else if (type instanceof DataTypeRecord dataType) {
            added = dataTypes.addIfAbsent(dataType.name(), dataType);
        } else {
            throw new IllegalArgumentException("Unsupported type definition: " + type.getClass().getName());
        }
        return admit(collection, type.name(), added);
    }

    /**
     * Emits one count event per collection.
     */
    void reportCounts() {
        count(ModelCollection.DATA_TYPES, dataTypes.size());
        count(ModelCollection.PROGRAM_UNITS, programUnits.size());
        count(ModelCollection.GLOBAL_VARIABLES, globalVariables.size());
        count(ModelCollection.ENUMS, enums.size());
        count(ModelCollection.UNIONS, unions.size());
        count(ModelCollection.STRUCTURES, structures.size());
    }

    CanonicalModel toModel(String sourceName, ProjectInfo projectInfo) {
        return new CanonicalModel(
            sourceName,
            projectInfo,
            dataTypes.values(),
            programUnits.values(),
            globalVariables,
            enums.values(),
            unions.values(),
            structures.values()
        );
    }

    static ModelCollection collectionOf(TypeKind kind) {
        return switch (kind) {
            case ENUM -> ModelCollection.ENUMS;
            case UNION -> ModelCollection.UNIONS;
            case STRUCTURE -> ModelCollection.STRUCTURES;
            case BASIC -> ModelCollection.DATA_TYPES;
        };
    }

    private boolean admit(ModelCollection collection, String name, boolean added) {
        if (added) {
            sink.accept(DiagnosticEvent.recordAccepted(collection.key(), name));
        } else {
            sink.accept(DiagnosticEvent.duplicateIgnored(collection.key(), name));
        }
        return added;
    }

    private void count(ModelCollection collection, int size) {
        sink.accept(DiagnosticEvent.collectionCount(collection.key(), size));
    }
}

package com.plcmodel.core.extract;

import com.plcmodel.core.document.DocumentNode;
import com.plcmodel.core.document.TreeQuery;
import com.plcmodel.core.model.ProgramUnitRecord;
import com.plcmodel.core.model.Routine;
import com.plcmodel.core.model.TypeInfo;
import com.plcmodel.core.model.VariableRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Extracts program organization units (functions, function blocks, programs).
 *
 * <p>Interface variables are read from the declaring sections of {@code interface}
 * ({@code inputVars}, {@code outputVars}, {@code inOutVars}, {@code localVars}, ...). Each
 * variable's group is the section's element name; variables placed directly under
 * {@code interface} are grouped as {@code interface}. Bodies are read as structured text.
 *
 * <p>Actions and methods share the POU content model, so the same reading applies to them.
 *
 * @since 1.0.0
 */
public class ProgramUnitExtractor {

    private static final Logger log = LoggerFactory.getLogger(ProgramUnitExtractor.class);

    static final String ORIGIN_INTERFACE = "interface";
    static final String UNKNOWN_ACTION = "Unknown Action";
    static final String UNKNOWN_METHOD = "Unknown Method";

    private static final String INTERFACE = "interface";
    private static final String VARIABLE = "variable";
    private static final String[] BODY_PATHS = {"./body/ST", "./implementation/ST"};
    private static final String[] DESCRIPTION_PATHS = {"./documentation/xhtml/p", "./documentation"};
    private static final String[] RETURN_TYPE_PATHS = {"./interface/returnType"};
    private static final String[] ACTION_PATHS = {"./actions/action", ".//action"};
    private static final String[] METHOD_PATHS = {".//method", ".//Method"};

    private final TreeQuery query;
    private final NameResolver names;
    private final FieldExtractor fields;
    private final TypeInfoExtractor types;

    public ProgramUnitExtractor(TreeQuery query) {
        this.query = Objects.requireNonNull(query, "query must not be null");
        this.names = new NameResolver(query);
        this.fields = new FieldExtractor(query);
        this.types = new TypeInfoExtractor(query);
    }

    /**
     * Extracts a program unit.
     *
     * @param pouNode {@code pou} node
     * @return the unit, or empty if no name resolves
     */
    public Optional<ProgramUnitRecord> extract(DocumentNode pouNode) {
        Optional<String> name = names.resolve(pouNode);
        if (name.isEmpty()) {
            log.debug("POU node without name: {}", pouNode);
            return Optional.empty();
        }

        List<Routine> actions = extractRoutines(pouNode, ACTION_PATHS, Routine.KIND_ACTION, UNKNOWN_ACTION);
        List<Routine> methods = extractRoutines(pouNode, METHOD_PATHS, Routine.KIND_METHOD, UNKNOWN_METHOD);

        ProgramUnitRecord unit = new ProgramUnitRecord(
            name.get(),
            pouNode.attribute("pouType").orElse(null),
            returnType(pouNode),
            interfaceVariables(pouNode),
            query.findText(pouNode, BODY_PATHS).orElse(null),
            query.findText(pouNode, DESCRIPTION_PATHS).orElse(null),
            actions,
            methods
        );
        log.debug("Extracted POU {} ({}) with {} actions, {} methods",
            unit.name(), unit.pouType(), actions.size(), methods.size());
        return Optional.of(unit);
    }

    private List<Routine> extractRoutines(DocumentNode pouNode, String[] paths, String kind, String fallbackName) {
        List<Routine> routines = new ArrayList<>();
        for (DocumentNode node : query.findAll(pouNode, paths)) {
            String name = names.resolve(node).orElse(fallbackName);
            routines.add(new Routine(
                name,
                kind,
                returnType(node),
                interfaceVariables(node),
                query.findText(node, BODY_PATHS).orElse(null),
                query.findText(node, DESCRIPTION_PATHS).orElse(null)
            ));
        }
        return routines;
    }

    private String returnType(DocumentNode node) {
        return query.findFirst(node, RETURN_TYPE_PATHS)
            .map(types::describe)
            .map(TypeInfo::name)
            .orElse(null);
    }

    private List<VariableRecord> interfaceVariables(DocumentNode node) {
        Optional<DocumentNode> iface = node.child(INTERFACE);
        if (iface.isEmpty()) {
            return List.of();
        }

        List<VariableRecord> variables = new ArrayList<>();
        for (DocumentNode section : iface.get().children()) {
            if (VARIABLE.equals(section.localName())) {
                fields.extractVariable(section)
                    .map(variable -> variable.inGroup(INTERFACE, ORIGIN_INTERFACE))
                    .ifPresent(variables::add);
                continue;
            }
            for (DocumentNode candidate : section.children()) {
                if (!VARIABLE.equals(candidate.localName())) {
                    continue;
                }
                fields.extractVariable(candidate)
                    .map(variable -> variable.inGroup(section.localName(), ORIGIN_INTERFACE))
                    .ifPresent(variables::add);
            }
        }
        return variables;
    }
}

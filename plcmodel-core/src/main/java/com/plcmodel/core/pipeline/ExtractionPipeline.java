package com.plcmodel.core.pipeline;

import com.plcmodel.core.classifier.EntityClassifier;
import com.plcmodel.core.config.ExtractorConfig;
import com.plcmodel.core.diagnostics.DiagnosticEvent;
import com.plcmodel.core.diagnostics.DiagnosticSink;
import com.plcmodel.core.document.DocumentNode;
import com.plcmodel.core.document.StructuralFailureException;
import com.plcmodel.core.document.TreeQuery;
import com.plcmodel.core.extract.FieldExtractor;
import com.plcmodel.core.extract.NameResolver;
import com.plcmodel.core.extract.ProgramUnitExtractor;
import com.plcmodel.core.extract.TaskExtractor;
import com.plcmodel.core.locator.Located;
import com.plcmodel.core.locator.SectionPaths;
import com.plcmodel.core.locator.StructureLocator;
import com.plcmodel.core.locator.VariableGroup;
import com.plcmodel.core.model.CanonicalModel;
import com.plcmodel.core.model.ExportType;
import com.plcmodel.core.model.ModelCollection;
import com.plcmodel.core.model.ProgramUnitRecord;
import com.plcmodel.core.model.ProjectInfo;
import com.plcmodel.core.model.TaskRecord;
import com.plcmodel.core.model.UnionRecord;
import com.plcmodel.core.model.VariableRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Converts an export document into a {@link CanonicalModel}.
 *
 * <p>Phases, in order:
 * <ol>
 *   <li>Locate application content, extract its POUs and queue its data-type nodes.</li>
 *   <li>Locate global variable groups and append their variables in document order.</li>
 *   <li>Classify unions declared under the union block.</li>
 *   <li>Classify the queued data-type nodes, then every other reachable data-type node.</li>
 *   <li>Read project facts and declared tasks, then assemble the model.</li>
 * </ol>
 *
 * <p>A name classified in any type collection is never classified again, so a union wins over
 * a structure-shaped node with the same name. Missing sections and rejected records are
 * reported to the {@link DiagnosticSink}; only a missing root or a failing tree query aborts
 * the run with a {@link StructuralFailureException}.
 *
 * <p>Instances are stateless and may be reused; each call builds its own query state.
 *
 * @since 1.0.0
 */
public class ExtractionPipeline {

    private static final Logger log = LoggerFactory.getLogger(ExtractionPipeline.class);

    static final String DEFAULT_SOURCE_NAME = "document";

    private static final String NO_NAME = "no resolvable name";

    private final ExtractorConfig config;

    public ExtractionPipeline(ExtractorConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    public ExtractionPipeline() {
        this(ExtractorConfig.defaults());
    }

    /**
     * Extracts the model without collecting diagnostics.
     *
     * @param root document root
     * @return canonical model
     * @throws StructuralFailureException if the root is missing or traversal fails
     */
    public CanonicalModel extract(DocumentNode root) {
        return extract(root, DEFAULT_SOURCE_NAME, DiagnosticSink.discarding());
    }

    /**
     * Extracts the model.
     *
     * @param root document root
     * @param sourceName label of the source document
     * @param sink receiver of diagnostics
     * @return canonical model
     * @throws StructuralFailureException if the root is missing or traversal fails
     */
    public CanonicalModel extract(DocumentNode root, String sourceName, DiagnosticSink sink) {
        if (root == null) {
            throw new StructuralFailureException("Document has no root element");
        }
        Objects.requireNonNull(sink, "sink must not be null");
        log.info("Extracting model from {} (root <{}>)", sourceName, root.localName());

        TreeQuery query = new TreeQuery();
        Run run = new Run(query, sink);

        List<DocumentNode> queued = run.extractApplicationContent(root);
        run.extractGlobalVariables(root);
        run.classifyUnions(root);
        run.classifyDataTypes(queued, run.locator.locateDataTypeNodes(root));

        ProjectInfo projectInfo = projectInfo(root, query);
        run.accumulator.reportCounts();

        CanonicalModel model = run.accumulator.toModel(sourceName, projectInfo);
        log.info("Extracted {} items from {} ({})",
            model.summary().totalItems(), sourceName, projectInfo.exportType().id());
        return model;
    }

    static ProjectInfo projectInfo(DocumentNode root, TreeQuery query) {
        Optional<DocumentNode> resource = query.findFirst(root, SectionPaths.RESOURCE);
        ExportType exportType = switch (root.localName()) {
            case "project" -> ExportType.PROJECT;
            case "library" -> ExportType.LIBRARY;
            case "application" -> ExportType.APPLICATION;
            default -> resource.isPresent() ? ExportType.RESOURCE_BASED : ExportType.UNKNOWN;
        };
        String configurationName = query.findFirst(root, SectionPaths.CONFIGURATION)
            .flatMap(configuration -> configuration.attribute("name"))
            .orElse(null);
        String resourceName = resource.flatMap(node -> node.attribute("name")).orElse(null);
        List<TaskRecord> tasks = new TaskExtractor(query).extractTasks(root);
        return new ProjectInfo(exportType, configurationName, resourceName, tasks);
    }

    /**
     * State of a single extraction run.
     */
    private final class Run {

        private final DiagnosticSink sink;
        private final StructureLocator locator;
        private final EntityClassifier classifier;
        private final ProgramUnitExtractor programUnits;
        private final FieldExtractor fields;
        private final NameResolver names;
        private final ModelAccumulator accumulator;

        private Run(TreeQuery query, DiagnosticSink sink) {
            this.sink = sink;
            this.locator = new StructureLocator(query, config.namespaces(), sink);
            this.classifier = new EntityClassifier(query, config.classification(), sink);
            this.programUnits = new ProgramUnitExtractor(query);
            this.fields = new FieldExtractor(query);
            this.names = new NameResolver(query);
            this.accumulator = new ModelAccumulator(sink);
        }

        private List<DocumentNode> extractApplicationContent(DocumentNode root) {
            Located<DocumentNode> application = locator.locateApplicationSubtrees(root);
            if (!application.isFound()) {
                log.warn("No application content found in any tier");
                return List.of();
            }

            for (DocumentNode pouNode : locator.programUnitNodesIn(application.items())) {
                Optional<ProgramUnitRecord> unit = programUnits.extract(pouNode);
                if (unit.isPresent()) {
                    accumulator.addProgramUnit(unit.get());
                } else {
                    reject(ModelCollection.PROGRAM_UNITS, pouNode, NO_NAME);
                }
            }
            return locator.dataTypeNodesIn(application.items());
        }

        private void extractGlobalVariables(DocumentNode root) {
            Located<VariableGroup> groups = locator.locateGlobalVariableGroups(root);
            if (!groups.isFound()) {
                log.debug("No global variables found in any tier");
                return;
            }

            String origin = groups.tier().id();
            for (VariableGroup group : groups.items()) {
                for (DocumentNode variableNode : group.variables()) {
                    Optional<VariableRecord> variable = fields.extractVariable(variableNode);
                    if (variable.isPresent()) {
                        accumulator.addGlobalVariable(variable.get().inGroup(group.name(), origin));
                    } else {
                        reject(ModelCollection.GLOBAL_VARIABLES, variableNode, NO_NAME);
                    }
                }
            }
        }

        private void classifyUnions(DocumentNode root) {
            for (DocumentNode container : locator.locateUnionContainers(root)) {
                Optional<UnionRecord> union = classifier.classifyUnion(container);
                union.ifPresent(accumulator::addType);
            }
        }

        private void classifyDataTypes(List<DocumentNode> queued, List<DocumentNode> reachable) {
            Set<DocumentNode> nodes = new LinkedHashSet<>(queued);
            nodes.addAll(reachable);

            for (DocumentNode node : nodes) {
                Optional<String> name = names.resolve(node);
                if (name.isPresent() && accumulator.isClassified(name.get())) {
                    log.debug("Type {} already classified, skipping {}", name.get(), node);
                    sink.accept(DiagnosticEvent.duplicateIgnored(ModelCollection.DATA_TYPES.key(), name.get()));
                    continue;
                }
                classifier.classify(node).ifPresent(accumulator::addType);
            }
        }

        private void reject(ModelCollection collection, DocumentNode node, String reason) {
            log.debug("Rejected {} node {}: {}", collection.key(), node, reason);
            sink.accept(DiagnosticEvent.recordRejected(collection.key(), node.toString(), reason));
        }
    }
}

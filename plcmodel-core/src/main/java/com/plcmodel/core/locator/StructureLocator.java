package com.plcmodel.core.locator;

import com.plcmodel.core.config.ExtractorConfig;
import com.plcmodel.core.diagnostics.DiagnosticSink;
import com.plcmodel.core.document.DocumentNode;
import com.plcmodel.core.document.TreeQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Finds the sections of an export whose position varies between producing tools.
 *
 * <p>Application content and global variables are each located by an independent
 * {@link StrategyCascade} over three tiers:
 * <ol>
 *   <li>{@link LocatorTier#NAMESPACED_BLOCK}: inside the vendor application block</li>
 *   <li>{@link LocatorTier#RESOURCE_SCAN}: inside resource-like nodes anywhere</li>
 *   <li>{@link LocatorTier#FLAT_SCAN}: anywhere in the document</li>
 * </ol>
 *
 * <p>Application tiers count as found only when their subtrees contain at least one data
 * type or POU node. Data-type discovery for classification is not a cascade:
 * {@link #locateDataTypeNodes(DocumentNode)} returns every data-type node any tier reaches.
 *
 * @since 1.0.0
 */
public class StructureLocator {

    private static final Logger log = LoggerFactory.getLogger(StructureLocator.class);

    public static final String CONCERN_APPLICATION = "application";
    public static final String CONCERN_GLOBAL_VARIABLES = "global-variables";

    static final String DEFAULT_GROUP_NAME = "Global Variables";

    private final TreeQuery query;
    private final String applicationBlock;
    private final String unionBlock;
    private final DiagnosticSink sink;

    public StructureLocator(TreeQuery query, ExtractorConfig.NamespaceConfig namespaces, DiagnosticSink sink) {
        this.query = Objects.requireNonNull(query, "query must not be null");
        Objects.requireNonNull(namespaces, "namespaces must not be null");
        this.applicationBlock = SectionPaths.dataBlock(namespaces.application());
        this.unionBlock = SectionPaths.dataBlock(namespaces.union());
        this.sink = Objects.requireNonNull(sink, "sink must not be null");
    }

    /**
     * Locates the subtrees holding application content (data types and POUs).
     *
     * @param root document root
     * @return accepted tier and its subtrees, or none
     */
    public Located<DocumentNode> locateApplicationSubtrees(DocumentNode root) {
        return new StrategyCascade<DocumentNode>(CONCERN_APPLICATION)
            .tier(LocatorTier.NAMESPACED_BLOCK, this::blockSubtrees)
            .tier(LocatorTier.RESOURCE_SCAN, this::resourceSubtrees)
            .tier(LocatorTier.FLAT_SCAN, document -> List.of(document))
            .acceptWhen(this::holdsApplicationContent)
            .run(root, sink);
    }

    /**
     * Locates global variable groups.
     *
     * @param root document root
     * @return accepted tier and its groups in document order, or none
     */
    public Located<VariableGroup> locateGlobalVariableGroups(DocumentNode root) {
        return new StrategyCascade<VariableGroup>(CONCERN_GLOBAL_VARIABLES)
            .tier(LocatorTier.NAMESPACED_BLOCK,
                document -> groupsIn(query.findAll(document, applicationBlock)))
            .tier(LocatorTier.RESOURCE_SCAN,
                document -> groupsIn(query.findAll(document, SectionPaths.RESOURCE, SectionPaths.TYPES)))
            .tier(LocatorTier.FLAT_SCAN,
                document -> groupsIn(List.of(document)))
            .run(root, sink);
    }

    /**
     * Returns every data-type node reachable by any tier: tier order first, then document
     * order, each node once.
     *
     * @param root document root
     * @return data-type nodes
     */
    public List<DocumentNode> locateDataTypeNodes(DocumentNode root) {
        Set<DocumentNode> nodes = new LinkedHashSet<>();
        nodes.addAll(dataTypeNodesIn(blockSubtrees(root)));
        nodes.addAll(dataTypeNodesIn(resourceSubtrees(root)));
        nodes.addAll(dataTypeNodesIn(List.of(root)));
        log.debug("Found {} reachable data-type nodes", nodes.size());
        return new ArrayList<>(nodes);
    }

    /**
     * Returns the union containers declared under union blocks, in document order.
     *
     * @param root document root
     * @return {@code union} / {@code Union} elements
     */
    public List<DocumentNode> locateUnionContainers(DocumentNode root) {
        Set<DocumentNode> containers = new LinkedHashSet<>();
        for (DocumentNode block : query.findAll(root, unionBlock)) {
            containers.addAll(query.findAll(block, SectionPaths.UNION));
            containers.addAll(query.findAll(block, SectionPaths.UNION_CAPITALIZED));
        }
        log.debug("Found {} union containers", containers.size());
        return new ArrayList<>(containers);
    }

    /**
     * Returns the data-type nodes inside the given subtrees, each once.
     */
    public List<DocumentNode> dataTypeNodesIn(List<DocumentNode> subtrees) {
        return distinctIn(subtrees, SectionPaths.DATA_TYPE);
    }

    /**
     * Returns the POU nodes inside the given subtrees, each once.
     */
    public List<DocumentNode> programUnitNodesIn(List<DocumentNode> subtrees) {
        return distinctIn(subtrees, SectionPaths.POU);
    }

    private List<DocumentNode> blockSubtrees(DocumentNode root) {
        List<DocumentNode> subtrees = new ArrayList<>();
        for (DocumentNode block : query.findAll(root, applicationBlock)) {
            List<DocumentNode> inner = query.findAll(block, SectionPaths.RESOURCE, SectionPaths.TYPES);
            if (inner.isEmpty()) {
                subtrees.add(block);
            } else {
                subtrees.addAll(inner);
            }
        }
        return subtrees;
    }

    private List<DocumentNode> resourceSubtrees(DocumentNode root) {
        return query.findAll(root, SectionPaths.RESOURCE, SectionPaths.TYPES);
    }

    private boolean holdsApplicationContent(List<DocumentNode> subtrees) {
        return subtrees.stream()
            .anyMatch(subtree -> query.exists(subtree, SectionPaths.DATA_TYPE, SectionPaths.POU));
    }

    private List<VariableGroup> groupsIn(List<DocumentNode> scopes) {
        List<VariableGroup> groups = new ArrayList<>();
        for (DocumentNode globalVars : distinctIn(scopes, SectionPaths.GLOBAL_VARS)) {
            groups.add(new VariableGroup(
                groupName(globalVars),
                query.findAll(globalVars, SectionPaths.VARIABLE)
            ));
        }
        return groups;
    }

    private String groupName(DocumentNode globalVars) {
        Optional<String> declared = globalVars.attribute("name");
        if (declared.isPresent()) {
            return declared.get();
        }
        return globalVars.ancestor("resource")
            .flatMap(resource -> resource.attribute("name"))
            .map(resourceName -> DEFAULT_GROUP_NAME + " - " + resourceName)
            .orElse(DEFAULT_GROUP_NAME);
    }

    private List<DocumentNode> distinctIn(List<DocumentNode> scopes, String path) {
        Set<DocumentNode> nodes = new LinkedHashSet<>();
        for (DocumentNode scope : scopes) {
            nodes.addAll(query.findAll(scope, path));
        }
        return new ArrayList<>(nodes);
    }
}

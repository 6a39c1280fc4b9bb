package com.plcmodel.core.classifier;

import com.plcmodel.core.config.ExtractorConfig;
import com.plcmodel.core.diagnostics.DiagnosticEvent;
import com.plcmodel.core.diagnostics.DiagnosticSink;
import com.plcmodel.core.document.DocumentNode;
import com.plcmodel.core.document.TreeQuery;
import com.plcmodel.core.extract.DetailsExtractor;
import com.plcmodel.core.extract.FieldExtractor;
import com.plcmodel.core.extract.NameResolver;
import com.plcmodel.core.extract.TypeInfoExtractor;
import com.plcmodel.core.model.DataTypeRecord;
import com.plcmodel.core.model.EnumRecord;
import com.plcmodel.core.model.EnumValue;
import com.plcmodel.core.model.ModelCollection;
import com.plcmodel.core.model.StructureRecord;
import com.plcmodel.core.model.TypeDefinition;
import com.plcmodel.core.model.TypeInfo;
import com.plcmodel.core.model.UnionRecord;
import com.plcmodel.core.model.VariableRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Classifies type-definition nodes from structural evidence.
 *
 * <p>Exports carry no discriminator telling an enumeration from a structure, so the kind is
 * decided by an ordered rule list where the first matching rule wins:
 * <ol>
 *   <li>value-list evidence ({@code values}, {@code enumValue} or {@code enum}) → enum</li>
 *   <li>member {@code variable} descendants → structure</li>
 *   <li>anything else → basic type</li>
 * </ol>
 *
 * <p>A node whose name cannot be resolved is rejected before any rule runs. In strict mode
 * ({@code classification.strictBasicTypes}) the basic rule only claims nodes that declare a
 * {@code baseType}; other nodes are rejected.
 *
 * <p>Enum values pick up the per-value comments of the data type's
 * {@code enumvaluedocumentation} block as their {@code description} detail.
 *
 * <p>Unions are not part of the cascade: containers found under the union block are
 * classified with {@link #classifyUnion(DocumentNode)}.
 *
 * @since 1.0.0
 */
public class EntityClassifier {

    private static final Logger log = LoggerFactory.getLogger(EntityClassifier.class);

    static final String ORIGIN_MEMBER = "member";
    static final String VALUE_NAME_PREFIX = "Value_";

    private static final String[] ENUM_EVIDENCE_PATHS = {".//values", ".//enumValue", ".//enum"};
    private static final String[] ENUM_VALUE_PATHS = {".//values/value", ".//enumValue", ".//enum/value"};
    private static final String[] ENUM_BASE_TYPE_PATHS = {".//enum/baseType"};
    private static final String[] VALUE_DOCUMENTATION_PATHS = {
        "./addData/data[contains(@name, 'enumvaluedocumentation')]/EnumValueDocumentation/EnumValue"
    };
    private static final String[] VALUE_DOCUMENTATION_NAME_PATHS = {"./Name"};
    private static final String[] VALUE_DOCUMENTATION_TEXT_PATHS = {"./Documentation/xhtml", "./Documentation"};
    private static final String[] MEMBER_PATHS = {".//variable"};
    private static final String[] BASE_TYPE_PATHS = {"./baseType"};
    private static final String DATA_TYPE = "dataType";

    private final TreeQuery query;
    private final NameResolver names;
    private final FieldExtractor fields;
    private final DetailsExtractor details;
    private final TypeInfoExtractor types;
    private final DiagnosticSink sink;
    private final List<ClassificationRule> rules;

    public EntityClassifier(TreeQuery query, ExtractorConfig.ClassificationConfig config, DiagnosticSink sink) {
        this.query = Objects.requireNonNull(query, "query must not be null");
        this.sink = Objects.requireNonNull(sink, "sink must not be null");
        this.names = new NameResolver(query);
        this.fields = new FieldExtractor(query);
        this.details = new DetailsExtractor(query);
        this.types = new TypeInfoExtractor(query);
        ClassificationRule basic = config.strictBasicTypes() ? this::strictBasicRule : this::basicRule;
        this.rules = List.<ClassificationRule>of(this::enumRule, this::structureRule, basic);
    }

    /**
     * Classifies a data-type node as enum, structure or basic type.
     *
     * @param node type-definition node
     * @return the classified record, or empty if the node was rejected
     */
    public Optional<TypeDefinition> classify(DocumentNode node) {
        Optional<String> name = names.resolve(node);
        if (name.isEmpty()) {
            reject(ModelCollection.DATA_TYPES, node, "no resolvable name");
            return Optional.empty();
        }

        for (ClassificationRule rule : rules) {
            Optional<TypeDefinition> classified = rule.apply(node, name.get());
            if (classified.isPresent()) {
                log.trace("Classified {} as {}", name.get(), classified.get().kind());
                return classified;
            }
        }

        reject(ModelCollection.DATA_TYPES, node, "no baseType declared for " + name.get());
        return Optional.empty();
    }

    /**
     * Classifies a union container found under a union block.
     *
     * <p>The name comes from the container, else from the enclosing {@code dataType}. Members
     * come from the container's variables, else from the enclosing data type's variables.
     *
     * @param container {@code union} or {@code Union} element
     * @return the union, or empty if no name resolves
     */
    public Optional<UnionRecord> classifyUnion(DocumentNode container) {
        Optional<DocumentNode> enclosing = container.ancestor(DATA_TYPE);
        Optional<String> name = names.resolve(container)
            .or(() -> enclosing.flatMap(names::resolve));
        if (name.isEmpty()) {
            reject(ModelCollection.UNIONS, container, "no resolvable name");
            return Optional.empty();
        }

        List<DocumentNode> memberNodes = query.findAll(container, MEMBER_PATHS);
        if (memberNodes.isEmpty() && enclosing.isPresent()) {
            memberNodes = query.findAll(enclosing.get(), MEMBER_PATHS);
        }

        DocumentNode detailSource = enclosing.orElse(container);
        return Optional.of(new UnionRecord(
            name.get(),
            members(memberNodes, name.get()),
            details.extractDetails(detailSource)
        ));
    }

    private Optional<TypeDefinition> enumRule(DocumentNode node, String name) {
        if (!query.exists(node, ENUM_EVIDENCE_PATHS)) {
            return Optional.empty();
        }

        Map<String, String> documentation = valueDocumentation(node);
        List<EnumValue> values = new ArrayList<>();
        for (DocumentNode valueNode : query.findAll(node, ENUM_VALUE_PATHS)) {
            String valueName = names.resolve(valueNode).orElse(VALUE_NAME_PREFIX + values.size());
            Map<String, String> valueDetails = details.extractDetails(valueNode);
            String documented = documentation.get(valueName);
            if (documented != null) {
                valueDetails.put(DetailsExtractor.KEY_DESCRIPTION, documented);
            }
            values.add(new EnumValue(valueName, valueNode.attribute("value").orElse(""), valueDetails));
        }

        String baseType = query.findFirst(node, ENUM_BASE_TYPE_PATHS)
            .map(types::describe)
            .map(TypeInfo::name)
            .filter(type -> !TypeInfo.UNKNOWN.equals(type))
            .orElse(null);

        return Optional.of(new EnumRecord(name, baseType, values, details.extractDetails(node)));
    }

    /**
     * Reads per-value comments that CODESYS keeps in an {@code enumvaluedocumentation} block of
     * the data type, keyed by value name.
     */
    private Map<String, String> valueDocumentation(DocumentNode node) {
        Map<String, String> documentation = new HashMap<>();
        for (DocumentNode entry : query.findAll(node, VALUE_DOCUMENTATION_PATHS)) {
            Optional<String> valueName = query.findText(entry, VALUE_DOCUMENTATION_NAME_PATHS);
            Optional<String> text = query.findText(entry, VALUE_DOCUMENTATION_TEXT_PATHS);
            if (valueName.isPresent() && text.isPresent()) {
                documentation.put(valueName.get(), text.get());
            }
        }
        return documentation;
    }

    private Optional<TypeDefinition> structureRule(DocumentNode node, String name) {
        List<DocumentNode> memberNodes = query.findAll(node, MEMBER_PATHS);
        if (memberNodes.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new StructureRecord(name, members(memberNodes, name), details.extractDetails(node)));
    }

    private Optional<TypeDefinition> basicRule(DocumentNode node, String name) {
        return Optional.of(new DataTypeRecord(name, details.extractDetails(node)));
    }

    private Optional<TypeDefinition> strictBasicRule(DocumentNode node, String name) {
        if (!query.exists(node, BASE_TYPE_PATHS)) {
            return Optional.empty();
        }
        return basicRule(node, name);
    }

    private List<VariableRecord> members(List<DocumentNode> memberNodes, String owner) {
        List<VariableRecord> members = new ArrayList<>();
        for (DocumentNode memberNode : memberNodes) {
            Optional<VariableRecord> member = fields.extractVariable(memberNode);
            if (member.isPresent()) {
                members.add(member.get().inGroup(owner, ORIGIN_MEMBER));
            } else {
                log.debug("Skipping unnamed member of {}", owner);
            }
        }
        return members;
    }

    private void reject(ModelCollection collection, DocumentNode node, String reason) {
        sink.accept(DiagnosticEvent.recordRejected(collection.key(), node.toString(), reason));
    }
}

package com.plcmodel.core.output;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.plcmodel.core.config.ExtractorConfig;
import com.plcmodel.core.model.CanonicalModel;
import com.plcmodel.core.model.ModelCollection;
import com.plcmodel.core.model.ModelSummary;
import com.plcmodel.core.model.ProjectInfo;
import com.plcmodel.core.resolver.TypeReference;
import com.plcmodel.core.resolver.TypeResolution;
import com.plcmodel.core.resolver.TypeResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Renders a {@link CanonicalModel} as JSON.
 *
 * <p>Layout:
 * <pre>{@code
 * {
 *   "sourceFile": "project.xml",
 *   "exportType": "project",
 *   "projectInfo": { "exportType": "project", "configurationName": "PLC", "resourceName": "Application", "tasks": [...] },
 *   "DataTypes": [...], "POUs": [...], "GlobalVariables": [...],
 *   "Enums": [...], "Unions": [...], "Structures": [...],
 *   "typeResolution": { "dependencies": { "ST_Line": ["ST_Point"] }, "circularReferences": [...], "unresolvedTypes": [...] },
 *   "summary": { "data_types_count": 0, ..., "total_items": 0 }
 * }
 * }</pre>
 *
 * <p>Records are serialized by their components; null values are kept so every record of
 * a collection has the same keys.
 *
 * @since 1.0.0
 */
public class ModelJsonWriter {

    private static final Logger log = LoggerFactory.getLogger(ModelJsonWriter.class);

    private final ObjectMapper mapper;
    private final TypeResolver resolver = new TypeResolver();

    public ModelJsonWriter(ExtractorConfig.OutputConfig output) {
        this(output.prettyPrint());
    }

    public ModelJsonWriter(boolean prettyPrint) {
        this.mapper = new ObjectMapper();
        if (prettyPrint) {
            mapper.enable(SerializationFeature.INDENT_OUTPUT);
        }
    }

    /**
     * Builds the JSON tree of a model.
     *
     * @param model canonical model
     * @return JSON object
     */
    public ObjectNode toTree(CanonicalModel model) {
        ObjectNode root = mapper.createObjectNode();
        root.put("sourceFile", model.sourceName());
        root.put("exportType", model.projectInfo().exportType().id());
        root.set("projectInfo", projectInfo(model.projectInfo()));

        root.set(ModelCollection.DATA_TYPES.key(), mapper.valueToTree(model.dataTypes()));
        root.set(ModelCollection.PROGRAM_UNITS.key(), mapper.valueToTree(model.programUnits()));
        root.set(ModelCollection.GLOBAL_VARIABLES.key(), mapper.valueToTree(model.globalVariables()));
        root.set(ModelCollection.ENUMS.key(), mapper.valueToTree(model.enums()));
        root.set(ModelCollection.UNIONS.key(), mapper.valueToTree(model.unions()));
        root.set(ModelCollection.STRUCTURES.key(), mapper.valueToTree(model.structures()));

        root.set("typeResolution", typeResolution(resolver.resolve(model)));
        root.set("summary", summary(model.summary()));
        return root;
    }

    /**
     * Renders a model as a JSON string.
     *
     * @param model canonical model
     * @return JSON text
     */
    public String write(CanonicalModel model) {
        try {
            return mapper.writeValueAsString(toTree(model));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize model of " + model.sourceName(), e);
        }
    }

    /**
     * Writes a model to a file, creating parent directories as needed.
     *
     * @param model canonical model
     * @param target output file
     * @throws IOException if the file cannot be written
     */
    public void write(CanonicalModel model, Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        String json = write(model);
        Files.writeString(target, json);
        log.info("Wrote model of {} to {} ({} bytes)", model.sourceName(), target, json.length());
    }

    private ObjectNode projectInfo(ProjectInfo info) {
        ObjectNode node = mapper.createObjectNode();
        node.put("exportType", info.exportType().id());
        node.put("configurationName", info.configurationName());
        node.put("resourceName", info.resourceName());
        node.set("tasks", mapper.valueToTree(info.tasks()));
        return node;
    }

    private ObjectNode typeResolution(TypeResolution resolution) {
        ObjectNode node = mapper.createObjectNode();
        node.set("dependencies", mapper.valueToTree(resolution.dependencies()));
        node.set("circularReferences", mapper.valueToTree(resolution.circularReferences()));
        ArrayNode unresolved = node.putArray("unresolvedTypes");
        for (TypeReference reference : resolution.unresolvedReferences()) {
            unresolved.addObject()
                .put("owner", reference.owner())
                .put("variable", reference.variableName())
                .put("type", reference.referencedName());
        }
        return node;
    }

    private ObjectNode summary(ModelSummary summary) {
        ObjectNode node = mapper.createObjectNode();
        node.put("data_types_count", summary.dataTypes());
        node.put("pous_count", summary.programUnits());
        node.put("global_vars_count", summary.globalVariables());
        node.put("enums_count", summary.enums());
        node.put("unions_count", summary.unions());
        node.put("structures_count", summary.structures());
        node.put("actions_count", summary.actions());
        node.put("methods_count", summary.methods());
        node.put("total_items", summary.totalItems());
        return node;
    }
}

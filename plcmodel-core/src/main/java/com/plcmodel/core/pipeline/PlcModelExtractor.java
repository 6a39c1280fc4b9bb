package com.plcmodel.core.pipeline;

import com.plcmodel.core.config.ExtractorConfig;
import com.plcmodel.core.diagnostics.DiagnosticLog;
import com.plcmodel.core.document.DocumentLoader;
import com.plcmodel.core.document.DocumentNode;
import com.plcmodel.core.model.CanonicalModel;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Entry point: loads an export and runs the {@link ExtractionPipeline} over it.
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * PlcModelExtractor extractor = new PlcModelExtractor(ConfigLoader.load(configPath));
 * ExtractionResult result = extractor.extract(Path.of("project.xml"));
 * result.model().structures().forEach(s -> System.out.println(s.name()));
 * }</pre>
 *
 * @since 1.0.0
 */
public class PlcModelExtractor {

    private final DocumentLoader loader;
    private final ExtractionPipeline pipeline;

    public PlcModelExtractor(ExtractorConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        this.loader = new DocumentLoader();
        this.pipeline = new ExtractionPipeline(config);
    }

    public PlcModelExtractor() {
        this(ExtractorConfig.defaults());
    }

    /**
     * Extracts the model of an export file.
     *
     * @param file export file
     * @return model and diagnostics
     * @throws IOException if the file cannot be read
     * @throws com.plcmodel.core.document.StructuralFailureException if the file is not well-formed
     */
    public ExtractionResult extract(Path file) throws IOException {
        DocumentNode root = loader.load(file);
        Path fileName = file.getFileName();
        return run(root, fileName == null ? file.toString() : fileName.toString());
    }

    /**
     * Extracts the model of an export given as a string.
     *
     * @param xml document text
     * @param sourceName label for the document
     * @return model and diagnostics
     */
    public ExtractionResult extract(String xml, String sourceName) {
        return run(loader.parse(xml), sourceName);
    }

    private ExtractionResult run(DocumentNode root, String sourceName) {
        DiagnosticLog diagnostics = new DiagnosticLog();
        CanonicalModel model = pipeline.extract(root, sourceName, diagnostics);
        return new ExtractionResult(model, diagnostics.events(), diagnostics.statistics());
    }
}

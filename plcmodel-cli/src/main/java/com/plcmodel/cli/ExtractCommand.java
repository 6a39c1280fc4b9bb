package com.plcmodel.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.plcmodel.core.config.ConfigLoader;
import com.plcmodel.core.config.ExtractorConfig;
import com.plcmodel.core.model.CanonicalModel;
import com.plcmodel.core.model.ModelSummary;
import com.plcmodel.core.output.ModelJsonWriter;
import com.plcmodel.core.pipeline.ExtractionResult;
import com.plcmodel.core.pipeline.PlcModelExtractor;
import com.plcmodel.core.resolver.TypeResolver;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Callable;

/**
 * Command to extract the canonical model of an export.
 *
 * <p>Steps:
 * <ol>
 *   <li>Load configuration</li>
 *   <li>Parse the export and run the extraction pipeline</li>
 *   <li>Print the model summary</li>
 *   <li>Write the model as JSON to the output file, or to stdout</li>
 * </ol>
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Print JSON to stdout
 * plcmodel extract project.xml
 *
 * # Write compact JSON to a file
 * plcmodel extract project.xml -o model.json --compact
 *
 * # Extract without writing anything
 * plcmodel extract project.xml --dry-run
 * }</pre>
 */
@Command(
    name = "extract",
    description = "Extract the canonical model of a PLCopen XML export",
    mixinStandardHelpOptions = true
)
public class ExtractCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ExtractCommand.class);

    @Parameters(
        index = "0",
        description = "PLCopen XML export file"
    )
    private Path exportFile;

    @Option(
        names = {"-o", "--output"},
        description = "Output JSON file (default: stdout)"
    )
    private Path outputFile;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: plcmodel.yaml)"
    )
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_CONFIG_FILE);

    @Option(
        names = {"--compact"},
        description = "Write JSON without indentation (overrides config)"
    )
    private boolean compact;

    @Option(
        names = {"--dry-run"},
        description = "Extract and print the summary but don't write output"
    )
    private boolean dryRun;

    @Override
    public Integer call() {
        try {
            log.info("Starting extraction of: {}", exportFile.toAbsolutePath());
            ExtractorConfig config = ConfigLoader.load(configPath);

            ExtractionResult result = new PlcModelExtractor(config).extract(exportFile);
            CanonicalModel model = result.model();

            if (!result.hasFindings()) {
                System.err.println("! No data types, POUs or global variables found in " + result.sourceName());
            }
            for (String cycle : new TypeResolver().resolve(model).circularReferences()) {
                System.err.println("! Circular type reference: " + cycle);
            }

            if (dryRun || outputFile != null) {
                printSummary(model);
                if (result.statistics().hasRejections()) {
                    System.err.println("! " + result.statistics().recordsRejected()
                        + " nodes rejected (run 'plcmodel diagnose' for details)");
                }
            }

            if (dryRun) {
                System.out.println();
                System.out.println("Dry-run mode: Skipping output");
                return 0;
            }

            ModelJsonWriter writer = compact ? new ModelJsonWriter(false) : new ModelJsonWriter(config.output());
            if (outputFile == null) {
                System.out.println(writer.write(model));
            } else {
                writer.write(model, outputFile);
                System.out.println("✓ Wrote model to: " + outputFile.toAbsolutePath());
            }
            return 0;

        } catch (Exception e) {
            log.error("Extraction failed", e);
            System.err.println("✗ Extraction failed: " + e.getMessage());
            return 1;
        }
    }

    private void printSummary(CanonicalModel model) {
        ModelSummary summary = model.summary();
        System.out.println("Model of " + model.sourceName()
            + " (" + model.projectInfo().exportType().id() + "):");
        System.out.println("  Data types:       " + summary.dataTypes());
        System.out.println("  POUs:             " + summary.programUnits()
            + " (" + summary.actions() + " actions, " + summary.methods() + " methods)");
        System.out.println("  Global variables: " + summary.globalVariables());
        System.out.println("  Enums:            " + summary.enums());
        System.out.println("  Unions:           " + summary.unions());
        System.out.println("  Structures:       " + summary.structures());
        System.out.println("  Total items:      " + summary.totalItems());
    }
}

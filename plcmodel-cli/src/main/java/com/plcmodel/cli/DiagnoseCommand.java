package com.plcmodel.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.plcmodel.core.config.ConfigLoader;
import com.plcmodel.core.config.ExtractorConfig;
import com.plcmodel.core.diagnostics.DiagnosticEvent;
import com.plcmodel.core.diagnostics.DiagnosticType;
import com.plcmodel.core.diagnostics.ExtractionStatistics;
import com.plcmodel.core.pipeline.ExtractionResult;
import com.plcmodel.core.pipeline.PlcModelExtractor;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * Command to show how an export was located and classified.
 *
 * <p>Prints every diagnostic event of the extraction run (strategy tiers tried, sections
 * found, records accepted, rejected or ignored as duplicates) followed by the statistics.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * plcmodel diagnose project.xml
 *
 * # Only rejections, missing sections and duplicates
 * plcmodel diagnose project.xml --problems
 * }</pre>
 */
@Command(
    name = "diagnose",
    description = "Show locator and classifier diagnostics for a PLCopen XML export",
    mixinStandardHelpOptions = true
)
public class DiagnoseCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(DiagnoseCommand.class);

    private static final Set<DiagnosticType> PROBLEMS = EnumSet.of(
        DiagnosticType.SECTION_NOT_FOUND,
        DiagnosticType.RECORD_REJECTED,
        DiagnosticType.DUPLICATE_IGNORED
    );

    @Parameters(
        index = "0",
        description = "PLCopen XML export file"
    )
    private Path exportFile;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: plcmodel.yaml)"
    )
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_CONFIG_FILE);

    @Option(
        names = {"--problems"},
        description = "Only show missing sections, rejected records and duplicates"
    )
    private boolean problemsOnly;

    @Override
    public Integer call() {
        try {
            log.info("Diagnosing: {}", exportFile.toAbsolutePath());
            ExtractorConfig config = ConfigLoader.load(configPath);
            ExtractionResult result = new PlcModelExtractor(config).extract(exportFile);

            System.out.println("Diagnostics for " + result.sourceName() + ":");
            for (DiagnosticEvent event : result.events()) {
                if (!problemsOnly || PROBLEMS.contains(event.type())) {
                    System.out.println("  " + event.format());
                }
            }

            ExtractionStatistics statistics = result.statistics();
            System.out.println();
            System.out.println(statistics.getSummary());
            for (Map.Entry<String, Integer> entry : statistics.rejectionCounts().entrySet()) {
                System.out.println("  Rejected in " + entry.getKey() + ": " + entry.getValue());
            }
            return 0;

        } catch (Exception e) {
            log.error("Diagnosis failed", e);
            System.err.println("✗ Diagnosis failed: " + e.getMessage());
            return 1;
        }
    }
}

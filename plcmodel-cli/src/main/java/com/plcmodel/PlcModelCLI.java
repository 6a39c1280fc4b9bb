package com.plcmodel;

import com.plcmodel.cli.DiagnoseCommand;
import com.plcmodel.cli.ExtractCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ch.qos.logback.classic.Level;

/**
 * Main CLI entry point for the PLC model extractor.
 *
 * <p>Reads PLCopen XML exports and turns them into a canonical JSON model of data types,
 * program units, global variables, enumerations, unions and structures.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code extract} - Extract the model of an export and write it as JSON</li>
 *   <li>{@code diagnose} - Show how the sections of an export were located and classified</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 *   <li>{@code --help} - Show help information</li>
 *   <li>{@code --version} - Show version information</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Extract to a file
 * plcmodel extract project.xml -o project.json
 *
 * # Show locator and classifier decisions
 * plcmodel -v diagnose project.xml
 * }</pre>
 */
@Command(
    name = "plcmodel",
    mixinStandardHelpOptions = true,
    version = "PLC Model Extractor 1.0.0-SNAPSHOT",
    description = "Extracts a canonical model from PLCopen XML exports",
    subcommands = {
        ExtractCommand.class,
        DiagnoseCommand.class
    }
)
public class PlcModelCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(PlcModelCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }

        System.out.println("PLC Model Extractor");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'plcmodel --help' to see available commands");
        System.out.println("Use 'plcmodel <command> --help' for command-specific help");
    }

    /**
     * Configures logging level based on global options.
     */
    void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Logging configured (verbose={}, quiet={})", verbose, quiet);
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Creates the command line, applying the global logging options before any command runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        PlcModelCLI cli = new PlcModelCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}

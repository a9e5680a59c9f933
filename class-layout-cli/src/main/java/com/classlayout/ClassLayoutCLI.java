package com.classlayout;

import com.classlayout.cli.LayoutCommand;
import com.classlayout.cli.ValidateCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ch.qos.logback.classic.Level;

/**
 * Main CLI entry point for ClassLayout.
 *
 * <p>ClassLayout computes hierarchical (Sugiyama) layouts for parsed class diagrams and
 * writes the positioned boxes and edges for a drawing back end.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code layout} - Lay out a class diagram and render the result</li>
 *   <li>{@code validate} - Report how a diagram would be normalised before layout</li>
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
 * # Lay out a diagram with default settings
 * classlayout layout animals.json
 *
 * # Write to a custom directory and also print a summary
 * classlayout layout animals.json -o out -r filesystem,console
 *
 * # Check a diagram for undeclared or duplicate classifiers
 * classlayout -v validate animals.json
 * }</pre>
 */
@Command(
    name = "classlayout",
    mixinStandardHelpOptions = true,
    version = "ClassLayout 1.0.0-SNAPSHOT",
    description = "Hierarchical layout engine for UML class diagrams",
    subcommands = {
        LayoutCommand.class,
        ValidateCommand.class
    }
)
public class ClassLayoutCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(ClassLayoutCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        configureLogging();

        if (quiet) {
            return; // Suppress banner in quiet mode
        }

        System.out.println("ClassLayout - Hierarchical Class Diagram Layout");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'classlayout --help' to see available commands");
        System.out.println("Use 'classlayout <command> --help' for command-specific help");
    }

    /**
     * Configures logging level based on global options.
     *
     * <p>Subcommands call this before doing any work, since picocli only runs the root
     * command when no subcommand is given.
     */
    public void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Root log level set to {}", root.getLevel());
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = new CommandLine(new ClassLayoutCLI()).execute(args);
        System.exit(exitCode);
    }
}

package com.pagesmith;

import com.pagesmith.cli.BuildCommand;
import com.pagesmith.cli.CheckCommand;
import com.pagesmith.cli.ListCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ch.qos.logback.classic.Level;

/**
 * Main CLI entry point for Pagesmith.
 *
 * <p>Pagesmith turns a directory of Markdown/text sources with YAML headers into
 * HTML pages using Mustache templates.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code build} - Build every page of a site</li>
 *   <li>{@code check} - Validate page headers without writing output</li>
 *   <li>{@code list} - List available body renderers</li>
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
 * # Build the site in the current directory
 * pagesmith build
 *
 * # Build another site into ./public using four threads
 * pagesmith -v build ~/blog -o public -j 4
 *
 * # List available renderers
 * pagesmith list renderers
 * }</pre>
 */
@Command(
    name = "pagesmith",
    mixinStandardHelpOptions = true,
    version = "Pagesmith 1.0.0-SNAPSHOT",
    description = "Static site page generator",
    subcommands = {
        BuildCommand.class,
        CheckCommand.class,
        ListCommand.class
    }
)
public class PagesmithCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(PagesmithCLI.class);

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

        System.out.println("Pagesmith - Static site page generator");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'pagesmith --help' to see available commands");
        System.out.println("Use 'pagesmith <command> --help' for command-specific help");
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

    /**
     * Returns whether verbose mode is enabled.
     *
     * @return true if verbose mode is enabled
     */
    public boolean isVerbose() {
        return verbose;
    }

    /**
     * Returns whether quiet mode is enabled.
     *
     * @return true if quiet mode is enabled
     */
    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Creates the command line with logging applied before any subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        PagesmithCLI cli = new PagesmithCLI();
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

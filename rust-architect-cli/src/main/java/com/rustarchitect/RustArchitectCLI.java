package com.rustarchitect;

import com.rustarchitect.cli.AnalyzeCommand;
import com.rustarchitect.cli.CompareCommand;
import com.rustarchitect.cli.ListCommand;
import com.rustarchitect.cli.PatternsCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ch.qos.logback.classic.Level;

/**
 * Main CLI entry point for RustArchitect.
 *
 * <p>RustArchitect recovers architecture knowledge from Rust source trees: entities,
 * relationships, layers, design patterns, architecture styles and a semantic index.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code analyze} - Analyse a project and write reports</li>
 *   <li>{@code patterns} - Print detected patterns and styles</li>
 *   <li>{@code compare} - Compare patterns across several projects</li>
 *   <li>{@code list} - List report generators or bundled catalogs</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Analyse the current directory
 * rustarchitect analyze
 *
 * # Print patterns of a crate with debug logging
 * rustarchitect -v patterns ../tokio
 *
 * # Compare two projects
 * rustarchitect compare ../tokio ../axum -o matrix.md
 * }</pre>
 */
@Command(
    name = "rustarchitect",
    mixinStandardHelpOptions = true,
    version = "RustArchitect 1.0.0-SNAPSHOT",
    description = "Architecture knowledge recovery for Rust source trees",
    subcommands = {
        AnalyzeCommand.class,
        PatternsCommand.class,
        CompareCommand.class,
        ListCommand.class
    }
)
public class RustArchitectCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(RustArchitectCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }

        System.out.println("RustArchitect - Architecture Knowledge Recovery for Rust");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'rustarchitect --help' to see available commands");
        System.out.println("Use 'rustarchitect <command> --help' for command-specific help");
    }

    /**
     * Configures the log level from the global options, then runs the last parsed command.
     *
     * @param parseResult parsed command line
     * @return exit code of the executed command
     */
    private int executionStrategy(CommandLine.ParseResult parseResult) {
        configureLogging();
        return new CommandLine.RunLast().execute(parseResult);
    }

    /**
     * Configures logging level based on global options.
     */
    private void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Log level set to {}", root.getLevel());
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Creates the configured command line, shared by {@link #main} and tests.
     *
     * @return command line with the logging execution strategy installed
     */
    public static CommandLine commandLine() {
        RustArchitectCLI cli = new RustArchitectCLI();
        return new CommandLine(cli).setExecutionStrategy(cli::executionStrategy);
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

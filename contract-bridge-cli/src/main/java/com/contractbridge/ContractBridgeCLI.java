package com.contractbridge;

import ch.qos.logback.classic.Level;
import com.contractbridge.cli.AddDependencyCommand;
import com.contractbridge.cli.BreakingCommand;
import com.contractbridge.cli.ExtractCommand;
import com.contractbridge.cli.InitCommand;
import com.contractbridge.cli.RecordConsumersCommand;
import com.contractbridge.cli.RemoveDependencyCommand;
import com.contractbridge.cli.StatusCommand;
import com.contractbridge.cli.SyncCommand;
import com.contractbridge.cli.ValidateCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;

/**
 * Main CLI entry point for Contract Bridge.
 *
 * <p>Contract Bridge keeps API providers and their consumers aligned: providers extract a
 * contract from their controllers, consumers sync it and check their outbound calls
 * against it.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code init} - Create the bridge configuration</li>
 *   <li>{@code add-dependency} / {@code remove-dependency} - Manage provider dependencies</li>
 *   <li>{@code sync} - Fetch provider contracts</li>
 *   <li>{@code validate} - Detect drift between local API calls and cached contracts</li>
 *   <li>{@code status} - Show configured dependencies and their caches</li>
 *   <li>{@code extract} - Extract this repository's provided contract</li>
 *   <li>{@code breaking} - Compare two contract versions for breaking changes</li>
 *   <li>{@code record-consumers} - Mark contract endpoints with a consumer's expectations</li>
 * </ul>
 *
 * <p><b>Exit codes:</b> {@code 0} success, {@code 1} failed sync, drift or breaking
 * errors, {@code 2} configuration error.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * contract-bridge init --role consumer
 * contract-bridge add-dependency user-service --git-url https://github.com/acme/user-service.git
 * contract-bridge sync
 * contract-bridge -v validate
 * }</pre>
 */
@Command(
    name = "contract-bridge",
    mixinStandardHelpOptions = true,
    version = "Contract Bridge 1.0.0-SNAPSHOT",
    description = "Keeps API providers and consumers aligned on a shared contract",
    subcommands = {
        InitCommand.class,
        AddDependencyCommand.class,
        RemoveDependencyCommand.class,
        SyncCommand.class,
        ValidateCommand.class,
        StatusCommand.class,
        ExtractCommand.class,
        BreakingCommand.class,
        RecordConsumersCommand.class
    }
)
public class ContractBridgeCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(ContractBridgeCLI.class);

    @Spec
    private CommandLine.Model.CommandSpec spec;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }

        PrintWriter out = spec.commandLine().getOut();
        out.println("Contract Bridge - API contract sync and drift detection");
        out.println("Version: 1.0.0-SNAPSHOT");
        out.println();
        out.println("Use 'contract-bridge --help' to see available commands");
        out.println("Use 'contract-bridge <command> --help' for command-specific help");
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

    /**
     * Creates the command line with logging configured before any subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        ContractBridgeCLI cli = new ContractBridgeCLI();
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

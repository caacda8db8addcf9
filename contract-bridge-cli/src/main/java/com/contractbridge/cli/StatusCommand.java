package com.contractbridge.cli;

import com.contractbridge.core.config.BridgeConfig;
import com.contractbridge.core.io.ContractParseException;
import com.contractbridge.core.io.ContractStore;
import com.contractbridge.core.model.Contract;
import com.contractbridge.core.model.Dependency;
import picocli.CommandLine.Command;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Command to show the configured dependencies and the state of their caches.
 */
@Command(
    name = "status",
    description = "Show bridge configuration and cached contracts",
    mixinStandardHelpOptions = true
)
public class StatusCommand extends BridgeCommand {

    @Override
    protected int execute() {
        BridgeConfig config = loadConfig();
        if (!config.exists()) {
            out().println("Not initialized. Run 'contract-bridge init' first.");
            return ExitCodes.CONFIG_ERROR;
        }

        out().println("Role: " + config.getRole());
        out().println("Repository: " + config.getRepoId());
        config.getProvides().ifPresent(provides -> out().println("Provides: " + provides.contractFile()));
        config.getFetchTimeout().ifPresent(timeout -> out().println("Fetch timeout: " + timeout.toSeconds() + "s"));
        out().println();

        if (config.listDependencies().isEmpty()) {
            out().println("No dependencies configured.");
            return ExitCodes.OK;
        }

        out().println("Dependencies:");
        config.getDependencies().forEach((name, dependency) -> out().println("  " + name + ": " + describeCache(config, dependency)));
        return ExitCodes.OK;
    }

    private String describeCache(BridgeConfig config, Dependency dependency) {
        if (dependency.localCache() == null) {
            return "no cache location";
        }
        Path cache = config.resolve(dependency.localCache());
        if (!Files.exists(cache)) {
            return "not synced";
        }
        try {
            Contract contract = ContractStore.load(cache);
            return contract.endpoints().size() + " endpoints, updated " + contract.lastUpdated();
        } catch (ContractParseException e) {
            return "unreadable cache (" + e.getMessage() + ")";
        }
    }
}

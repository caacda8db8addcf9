package com.contractbridge.cli;

import com.contractbridge.core.config.BridgeConfig;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * Command to unregister a dependency and delete its cached contract.
 */
@Command(
    name = "remove-dependency",
    description = "Remove a provider dependency and its cached contract",
    mixinStandardHelpOptions = true
)
public class RemoveDependencyCommand extends BridgeCommand {

    @Parameters(index = "0", description = "Dependency name")
    private String name;

    @Override
    protected int execute() {
        BridgeConfig config = loadConfig();
        if (config.getDependency(name).isEmpty()) {
            err().println("✗ Dependency '" + name + "' not found in configuration");
            return ExitCodes.CONFIG_ERROR;
        }

        config.removeDependency(name);
        out().println("✓ Removed dependency " + name);
        return ExitCodes.OK;
    }
}

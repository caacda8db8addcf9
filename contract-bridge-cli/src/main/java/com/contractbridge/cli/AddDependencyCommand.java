package com.contractbridge.cli;

import com.contractbridge.core.config.BridgeConfig;
import com.contractbridge.core.config.ProvidesConfig;
import com.contractbridge.core.model.Dependency;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Command to register a provider this repository consumes.
 */
@Command(
    name = "add-dependency",
    description = "Register a provider dependency",
    mixinStandardHelpOptions = true
)
public class AddDependencyCommand extends BridgeCommand {

    @Parameters(index = "0", description = "Dependency name")
    private String name;

    @Option(names = {"--git-url"}, description = "Git URL of the provider repository")
    private String gitUrl;

    @Option(names = {"--contract-path"}, description = "Contract location in the provider repository (default: ${DEFAULT-VALUE})",
        defaultValue = ProvidesConfig.DEFAULT_CONTRACT_FILE)
    private String contractPath;

    @Option(names = {"--local-cache"}, description = "Cache location in this repository (default: .bridge/contracts/<name>-api.yaml)")
    private String localCache;

    @Option(names = {"--sync-method"}, description = "git, http or s3 (default: ${DEFAULT-VALUE})", defaultValue = Dependency.SYNC_GIT)
    private String syncMethod;

    @Option(names = {"--type"}, description = "API type (default: ${DEFAULT-VALUE})", defaultValue = Dependency.DEFAULT_TYPE)
    private String type;

    @Override
    protected int execute() {
        BridgeConfig config = loadConfig();
        Dependency dependency = new Dependency(
            name,
            type,
            syncMethod,
            gitUrl,
            contractPath,
            localCache != null ? localCache : BridgeConfig.defaultCachePath(name),
            Boolean.TRUE
        );

        if (Dependency.SYNC_GIT.equals(syncMethod) && (gitUrl == null || gitUrl.isBlank())) {
            err().println("✗ Dependency " + name + ": git_url is required for git sync method");
            return ExitCodes.CONFIG_ERROR;
        }

        boolean replaced = config.getDependency(name).isPresent();
        config.addDependency(dependency);
        out().println((replaced ? "✓ Updated dependency " : "✓ Added dependency ") + name);
        out().println("  Cache: " + dependency.localCache());
        out().println("  Run 'contract-bridge sync " + name + "' to fetch its contract");
        return ExitCodes.OK;
    }
}

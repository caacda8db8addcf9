package com.contractbridge.cli;

import com.contractbridge.core.config.BridgeConfig;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;

/**
 * Command to create the bridge configuration of a repository.
 */
@Command(
    name = "init",
    description = "Create .bridge/settings/bridge.json",
    mixinStandardHelpOptions = true
)
public class InitCommand extends BridgeCommand {

    @Option(names = {"--role"}, description = "consumer, provider or both (default: ${DEFAULT-VALUE})", defaultValue = "consumer")
    private String role;

    @Option(names = {"--repo-id"}, description = "Repository identifier (default: directory name)")
    private String repoId;

    @Option(names = {"-f", "--force"}, description = "Overwrite an existing configuration")
    private boolean force;

    @Override
    protected int execute() {
        Path root = repoRoot();
        BridgeConfig existing = BridgeConfig.load(root);
        if (existing.exists() && !force) {
            err().println("✗ Configuration already exists: " + existing.getConfigPath());
            err().println("  Use --force to overwrite it");
            return ExitCodes.CONFIG_ERROR;
        }

        BridgeConfig config = BridgeConfig.createDefault(root, role);
        Path fileName = root.getFileName();
        config.setRepoId(repoId != null ? repoId : fileName == null ? "" : fileName.toString());

        var errors = config.validate();
        if (!errors.isEmpty()) {
            errors.forEach(error -> err().println("✗ " + error));
            return ExitCodes.CONFIG_ERROR;
        }

        config.save();
        log.info("Initialized bridge configuration at {}", config.getConfigPath());
        out().println("✓ Created " + config.getConfigPath());
        out().println("  Role: " + config.getRole());
        config.getProvides().ifPresent(provides ->
            out().println("  Provides: " + provides.contractFile() + " from " + provides.extractFrom()));
        return ExitCodes.OK;
    }
}

package com.contractbridge.cli;

import com.contractbridge.core.config.BridgeConfig;
import com.contractbridge.core.config.ProvidesConfig;
import com.contractbridge.core.extractor.JavaContractExtractor;
import com.contractbridge.core.model.Contract;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;

/**
 * Command to extract the contract this repository provides.
 */
@Command(
    name = "extract",
    description = "Extract the provided API contract from Java sources",
    mixinStandardHelpOptions = true
)
public class ExtractCommand extends BridgeCommand {

    @Option(names = {"-g", "--glob"}, description = "Source glob(s), overriding provides.extract_from")
    private List<String> globs;

    @Override
    protected int execute() throws Exception {
        BridgeConfig config = loadConfig();
        if (BridgeConfig.ROLE_CONSUMER.equals(config.getRole()) && config.getProvides().isEmpty()) {
            out().println("Repository role is consumer; extracting with default provider settings");
        }
        if (globs != null && !globs.isEmpty()) {
            ProvidesConfig current = config.getProvides().orElseGet(ProvidesConfig::defaults);
            config.setProvides(new ProvidesConfig(current.contractFile(), globs, current.autoUpdate()));
        }

        Contract contract = JavaContractExtractor.extractAndSave(config);
        String contractFile = config.getProvides().orElseGet(ProvidesConfig::defaults).contractFile();
        out().println("✓ Extracted " + contract.endpoints().size() + " endpoints and "
            + contract.models().size() + " models to " + contractFile);
        return ExitCodes.OK;
    }
}

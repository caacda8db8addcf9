package com.contractbridge.cli;

import com.contractbridge.core.breaking.BreakingChangeDetector;
import com.contractbridge.core.model.Contract;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Command to copy a consumer's recorded expectations into a provider contract.
 *
 * <p>Run in the consumer repository after {@code sync}: every endpoint of the given
 * contract that the consumer calls gets the consumer added to its {@code consumers} list.
 */
@Command(
    name = "record-consumers",
    description = "Add a consumer to the contract endpoints it calls",
    mixinStandardHelpOptions = true
)
public class RecordConsumersCommand extends BridgeCommand {

    @Parameters(index = "0", description = "Provider contract file to update")
    private Path contractFile;

    @Option(names = {"--consumer"}, required = true, description = "Consumer identifier")
    private String consumer;

    @Option(names = {"--dependency"}, required = true, description = "Dependency whose recorded expectations are used")
    private String dependency;

    @Override
    protected int execute() throws Exception {
        BreakingChangeDetector detector = new BreakingChangeDetector(repoRoot());
        Map<String, List<String>> expectations = detector.loadConsumerExpectations(dependency);
        if (expectations.isEmpty()) {
            out().println("No recorded expectations for " + dependency + ". Run 'contract-bridge sync' first.");
            return ExitCodes.OK;
        }

        Contract updated = detector.updateContractWithConsumers(repoRoot().resolve(contractFile), consumer, expectations);
        long marked = updated.endpoints().stream().filter(endpoint -> endpoint.consumers().contains(consumer)).count();
        out().println("✓ Recorded " + consumer + " on " + marked + " endpoint(s)");
        return ExitCodes.OK;
    }
}

package com.contractbridge.cli;

import com.contractbridge.core.breaking.BreakingChangeDetector;
import com.contractbridge.core.io.ContractStore;
import com.contractbridge.core.model.BreakingChange;
import com.contractbridge.core.model.Contract;
import com.contractbridge.core.model.Severity;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Command to compare two versions of a provider contract.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * git show HEAD~1:.bridge/contracts/provided-api.yaml > /tmp/old.yaml
 * contract-bridge breaking /tmp/old.yaml .bridge/contracts/provided-api.yaml
 * }</pre>
 */
@Command(
    name = "breaking",
    description = "Detect breaking changes between two contract versions",
    mixinStandardHelpOptions = true
)
public class BreakingCommand extends BridgeCommand {

    @Parameters(index = "0", description = "Previous contract")
    private Path oldContract;

    @Parameters(index = "1", description = "New contract")
    private Path newContract;

    @Option(names = {"--show-unused"}, description = "Also list endpoints without consumers")
    private boolean showUnused;

    @Override
    protected int execute() throws Exception {
        Contract previous = ContractStore.load(repoRoot().resolve(oldContract));
        Contract current = ContractStore.load(repoRoot().resolve(newContract));

        List<BreakingChange> changes = new BreakingChangeDetector(repoRoot()).detectBreakingChanges(previous, current);
        List<BreakingChange> shown = changes.stream()
            .filter(change -> showUnused || change.severity() != Severity.INFO)
            .toList();

        if (shown.isEmpty()) {
            out().println("✓ No breaking changes detected");
        }
        for (BreakingChange change : shown) {
            out().println("[" + change.severity().value().toUpperCase(Locale.ROOT) + "] " + change.method() + " " + change.endpoint());
            out().println("  Type: " + change.type().value());
            out().println("  Message: " + change.message());
            if (!change.affectedConsumers().isEmpty()) {
                out().println("  Affected Consumers: " + String.join(", ", change.affectedConsumers()));
            }
            out().println("  Suggestion: " + change.suggestion());
        }

        boolean hasErrors = changes.stream().anyMatch(change -> change.severity() == Severity.ERROR);
        return hasErrors ? ExitCodes.FAILURE : ExitCodes.OK;
    }
}

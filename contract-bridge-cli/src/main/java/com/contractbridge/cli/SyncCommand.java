package com.contractbridge.cli;

import com.contractbridge.core.config.BridgeConfig;
import com.contractbridge.core.model.SyncResult;
import com.contractbridge.core.sync.GitContractFetcher;
import com.contractbridge.core.sync.SyncEngine;
import com.contractbridge.core.sync.SyncProgressListener;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.List;

/**
 * Command to fetch provider contracts into the local cache.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Sync every dependency (up to 5 in parallel)
 * contract-bridge sync
 *
 * # Sync one dependency
 * contract-bridge sync user-service
 * }</pre>
 */
@Command(
    name = "sync",
    description = "Fetch provider contracts",
    mixinStandardHelpOptions = true
)
public class SyncCommand extends BridgeCommand {

    @Parameters(index = "0", arity = "0..1", description = "Dependency to sync (default: all)")
    private String dependency;

    @Override
    protected int execute() {
        BridgeConfig config = loadConfig();
        SyncProgressListener progress = (name, status) -> log.info("{}: {}", name, status.value());
        SyncEngine engine = new SyncEngine(config, new GitContractFetcher(), progress);

        List<SyncResult> results;
        if (dependency != null) {
            results = List.of(engine.syncDependency(dependency));
        } else {
            if (config.listDependencies().isEmpty()) {
                out().println("No dependencies configured. Use 'contract-bridge add-dependency' first.");
                return ExitCodes.OK;
            }
            results = engine.syncAll();
        }

        results.forEach(this::print);
        long failed = results.stream().filter(result -> !result.success()).count();
        out().println();
        out().println("Synced " + (results.size() - failed) + " of " + results.size() + " dependencies");
        return failed > 0 ? ExitCodes.FAILURE : ExitCodes.OK;
    }

    private void print(SyncResult result) {
        if (!result.success()) {
            out().println("✗ " + result.dependencyName());
            result.errors().forEach(error -> out().println("  Error: " + error));
            return;
        }

        String marker = result.isStale() ? "⚠ " : "✓ ";
        out().println(marker + result.dependencyName() + " (" + result.endpointCount() + " endpoints)");
        if (result.changes().isEmpty()) {
            out().println("  No changes");
        }
        result.changes().forEach(change -> out().println("  " + change));
    }
}

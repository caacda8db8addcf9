package com.contractbridge.cli;

import com.contractbridge.core.config.BridgeConfig;
import com.contractbridge.core.drift.DriftDetector;
import com.contractbridge.core.model.DriftIssue;
import com.contractbridge.core.model.DriftReport;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.Locale;

/**
 * Command to validate the configuration and detect drift against cached contracts.
 */
@Command(
    name = "validate",
    description = "Validate configuration and detect API drift",
    mixinStandardHelpOptions = true
)
public class ValidateCommand extends BridgeCommand {

    @Parameters(index = "0", arity = "0..1", description = "Dependency to check (default: all)")
    private String dependency;

    @Override
    protected int execute() {
        BridgeConfig config = loadConfig();
        List<String> configErrors = config.validate();
        if (!configErrors.isEmpty()) {
            out().println("✗ Configuration is invalid:");
            configErrors.forEach(error -> out().println("  - " + error));
            return ExitCodes.CONFIG_ERROR;
        }

        DriftDetector detector = new DriftDetector(config);
        List<DriftReport> reports = dependency != null
            ? List.of(DriftReport.of(dependency, detector.detectDrift(dependency)))
            : detector.validateAll();

        if (reports.isEmpty()) {
            out().println("✓ Configuration is valid. No dependencies to check.");
            return ExitCodes.OK;
        }

        reports.forEach(this::print);
        boolean hasErrors = reports.stream().anyMatch(report -> report.errors() > 0);
        return hasErrors ? ExitCodes.FAILURE : ExitCodes.OK;
    }

    private void print(DriftReport report) {
        out().println((report.success() ? "✓ " : "✗ ") + report.message());
        int index = 1;
        for (DriftIssue issue : report.issues()) {
            out().println("  " + index++ + ". [" + issue.severity().value().toUpperCase(Locale.ROOT) + "] " + issue.type().value());
            if (!issue.method().isEmpty()) {
                out().println("     Endpoint: " + issue.method() + " " + issue.endpoint());
                out().println("     Location: " + issue.location());
            }
            out().println("     Message: " + issue.message());
            out().println("     Suggestion: " + issue.suggestion());
        }
    }
}

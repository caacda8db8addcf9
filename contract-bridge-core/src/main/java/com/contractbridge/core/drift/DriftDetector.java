package com.contractbridge.core.drift;

import com.contractbridge.core.config.BridgeConfig;
import com.contractbridge.core.io.ContractParseException;
import com.contractbridge.core.io.ContractStore;
import com.contractbridge.core.model.ApiCall;
import com.contractbridge.core.model.Contract;
import com.contractbridge.core.model.Dependency;
import com.contractbridge.core.model.DriftIssue;
import com.contractbridge.core.model.DriftIssueType;
import com.contractbridge.core.model.DriftReport;
import com.contractbridge.core.model.Endpoint;
import com.contractbridge.core.model.Severity;
import com.contractbridge.core.scanner.CallSiteScanner;
import com.contractbridge.core.scanner.ContractIndex;
import com.contractbridge.core.scanner.PathNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Checks the outbound API calls of this repository against cached provider contracts.
 *
 * <p>Every call site that does not match an endpoint of the contract (same method, same
 * normalized path) becomes a {@link DriftIssueType#MISSING_ENDPOINT} error with a
 * suggestion. Problems with the dependency itself (not registered, no cache, unreadable
 * cache) are reported as a single issue and stop the check for that dependency.
 */
public class DriftDetector {

    private static final Logger log = LoggerFactory.getLogger(DriftDetector.class);

    private final BridgeConfig config;
    private final Path repoRoot;

    public DriftDetector(BridgeConfig config) {
        this(config, config.getRepoRoot());
    }

    public DriftDetector(BridgeConfig config, Path repoRoot) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.repoRoot = Objects.requireNonNull(repoRoot, "repoRoot must not be null");
    }

    /**
     * Detects drift against one dependency.
     *
     * @param dependencyName registered dependency name
     * @return issues, empty when every call site matches the contract
     */
    public List<DriftIssue> detectDrift(String dependencyName) {
        Optional<Dependency> dependency = config.getDependency(dependencyName);
        if (dependency.isEmpty()) {
            return List.of(DriftIssue.precondition(DriftIssueType.CONFIGURATION_ERROR,
                "Dependency '" + dependencyName + "' not found in configuration",
                "Add the dependency using 'contract-bridge add-dependency'"));
        }

        String localCache = dependency.get().localCache();
        if (localCache == null || localCache.isBlank()) {
            return List.of(DriftIssue.precondition(DriftIssueType.CONFIGURATION_ERROR,
                "Dependency " + dependencyName + ": local_cache is required",
                "Set local_cache for the dependency in .bridge/settings/bridge.json"));
        }
        Path cachePath = repoRoot.resolve(localCache);
        if (!Files.isRegularFile(cachePath)) {
            return List.of(DriftIssue.precondition(DriftIssueType.MISSING_CONTRACT,
                "Contract file not found: " + localCache,
                "Run 'contract-bridge sync' to fetch the contract"));
        }

        Contract contract;
        try {
            contract = ContractStore.load(cachePath);
        } catch (ContractParseException e) {
            return List.of(DriftIssue.precondition(DriftIssueType.INVALID_CONTRACT,
                "Failed to load contract: " + e.getMessage(),
                "Check contract file format or re-sync"));
        }

        List<ApiCall> calls = new CallSiteScanner(repoRoot).scan();
        ContractIndex index = new ContractIndex(contract);
        List<DriftIssue> issues = new ArrayList<>();
        for (ApiCall call : calls) {
            if (index.match(call).isEmpty()) {
                issues.add(missingEndpoint(call, contract));
            }
        }
        log.debug("Checked {} call(s) against {}: {} issue(s)", calls.size(), dependencyName, issues.size());
        return issues;
    }

    /**
     * Detects drift against every registered dependency.
     *
     * @return dependency name to issues, in registration order
     */
    public Map<String, List<DriftIssue>> detectAllDrift() {
        Map<String, List<DriftIssue>> results = new LinkedHashMap<>();
        for (String name : config.listDependencies()) {
            results.put(name, detectDrift(name));
        }
        return results;
    }

    /**
     * Detects drift against every registered dependency and summarizes the outcome.
     *
     * @return one report per dependency, in registration order
     */
    public List<DriftReport> validateAll() {
        List<DriftReport> reports = new ArrayList<>();
        detectAllDrift().forEach((name, issues) -> reports.add(DriftReport.of(name, issues)));
        return reports;
    }

    private DriftIssue missingEndpoint(ApiCall call, Contract contract) {
        return new DriftIssue(
            DriftIssueType.MISSING_ENDPOINT,
            Severity.ERROR,
            call.path(),
            call.method().name(),
            call.location(),
            "API call to " + call.method() + " " + call.path() + " does not match any endpoint in contract",
            suggestionFor(call, contract));
    }

    /**
     * Suggests a fix for an unmatched call, trying in order: endpoints with a similar
     * path (same segment count, at most one differing segment), an endpoint with the same
     * path but another method, and finally a generic hint.
     */
    String suggestionFor(ApiCall call, Contract contract) {
        String[] callSegments = segments(call.path());
        List<String> similar = new ArrayList<>();
        for (Endpoint endpoint : contract.endpoints()) {
            String[] endpointSegments = segments(endpoint.path());
            if (endpointSegments.length != callSegments.length) {
                continue;
            }
            int matches = 0;
            for (int i = 0; i < callSegments.length; i++) {
                if (callSegments[i].equals(endpointSegments[i]) || endpointSegments[i].contains("{")) {
                    matches++;
                }
            }
            if (matches >= callSegments.length - 1) {
                similar.add(endpoint.key().toString());
            }
        }
        if (!similar.isEmpty()) {
            return "Did you mean one of these endpoints? " + String.join(", ", similar);
        }

        String normalizedCall = PathNormalizer.normalize(call.path());
        for (Endpoint endpoint : contract.endpoints()) {
            if (PathNormalizer.normalize(endpoint.path()).equals(normalizedCall)) {
                return "Endpoint path exists but method is " + endpoint.method() + ", not " + call.method();
            }
        }

        return "Either sync the latest contract or remove this API call";
    }

    private static String[] segments(String path) {
        String trimmed = path;
        while (trimmed.startsWith("/")) {
            trimmed = trimmed.substring(1);
        }
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed.split("/", -1);
    }
}

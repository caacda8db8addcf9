package com.contractbridge.core.breaking;

import com.contractbridge.core.config.BridgeConfig;
import com.contractbridge.core.io.ContractParseException;
import com.contractbridge.core.io.ContractStore;
import com.contractbridge.core.io.ExpectationsStore;
import com.contractbridge.core.model.BreakingChange;
import com.contractbridge.core.model.BreakingChangeType;
import com.contractbridge.core.model.Contract;
import com.contractbridge.core.model.Endpoint;
import com.contractbridge.core.model.EndpointKey;
import com.contractbridge.core.model.Expectation;
import com.contractbridge.core.model.Severity;
import com.contractbridge.core.scanner.PathNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Tells a provider how a new version of its contract affects recorded consumers.
 *
 * <p>Reported, in this order:
 * <ol>
 *   <li>{@code endpoint_removed} (error) for removed endpoints that have consumers,</li>
 *   <li>{@code endpoint_modified} (warning) for changed endpoints that have consumers,</li>
 *   <li>{@code unused_endpoint} (info) for endpoints of the new contract without consumers.</li>
 * </ol>
 * Endpoints are compared on their published shape: extraction timestamp, consumers and
 * provenance (source file, handler name) are ignored.
 */
public class BreakingChangeDetector {

    private static final Logger log = LoggerFactory.getLogger(BreakingChangeDetector.class);

    private final Path repoRoot;

    public BreakingChangeDetector(Path repoRoot) {
        this.repoRoot = Objects.requireNonNull(repoRoot, "repoRoot must not be null");
    }

    /**
     * Compares two versions of a provider contract.
     *
     * @param oldContract previous version
     * @param newContract new version
     * @return breaking changes, removals first, then modifications, then unused endpoints
     */
    public List<BreakingChange> detectBreakingChanges(Contract oldContract, Contract newContract) {
        Map<EndpointKey, Endpoint> oldEndpoints = oldContract.endpointsByKey();
        Map<EndpointKey, Endpoint> newEndpoints = newContract.endpointsByKey();
        List<BreakingChange> removed = new ArrayList<>();
        List<BreakingChange> modified = new ArrayList<>();

        oldEndpoints.forEach((key, oldEndpoint) -> {
            if (oldEndpoint.consumers().isEmpty()) {
                return;
            }
            Endpoint newEndpoint = newEndpoints.get(key);
            String consumers = String.join(", ", oldEndpoint.consumers());
            if (newEndpoint == null) {
                removed.add(new BreakingChange(
                    BreakingChangeType.ENDPOINT_REMOVED,
                    Severity.ERROR,
                    oldEndpoint.path(),
                    oldEndpoint.method().name(),
                    "Endpoint " + key + " was removed but has active consumers",
                    oldEndpoint.consumers(),
                    "Consider deprecating instead of removing, or notify consumers: " + consumers));
            } else if (!oldEndpoint.sameContractShape(newEndpoint)) {
                modified.add(new BreakingChange(
                    BreakingChangeType.ENDPOINT_MODIFIED,
                    Severity.WARNING,
                    oldEndpoint.path(),
                    oldEndpoint.method().name(),
                    "Endpoint " + key + " was modified and has active consumers",
                    oldEndpoint.consumers(),
                    "Verify changes are backward compatible, or notify consumers: " + consumers));
            }
        });

        List<BreakingChange> changes = new ArrayList<>(removed);
        changes.addAll(modified);
        changes.addAll(unusedEndpoints(newContract));
        return changes;
    }

    private List<BreakingChange> unusedEndpoints(Contract contract) {
        return contract.endpoints().stream()
            .filter(endpoint -> endpoint.consumers().isEmpty())
            .map(endpoint -> new BreakingChange(
                BreakingChangeType.UNUSED_ENDPOINT,
                Severity.INFO,
                endpoint.path(),
                endpoint.method().name(),
                "Endpoint " + endpoint.key() + " has no recorded consumers",
                List.of(),
                "This endpoint may be safe to remove or deprecate"))
            .toList();
    }

    /**
     * Loads the expectations a consumer recorded for a dependency.
     *
     * @param dependencyName dependency name
     * @return endpoint key ({@code METHOD /path}) to usage locations; empty when the
     *     expectations file is missing or unreadable
     */
    public Map<String, List<String>> loadConsumerExpectations(String dependencyName) {
        Path file = repoRoot.resolve(BridgeConfig.expectationsPath(dependencyName));
        Map<String, List<String>> expectations = new LinkedHashMap<>();
        ExpectationsStore.load(file).ifPresent(document -> {
            for (Expectation expectation : document.expectations()) {
                if (expectation.endpoint() != null) {
                    expectations.put(expectation.endpoint(), expectation.usageLocations());
                }
            }
        });
        return expectations;
    }

    /**
     * Records a consumer on every endpoint of a contract file that the consumer's
     * expectations refer to, and saves the contract.
     *
     * <p>Expectation keys are compared after path normalization, so {@code GET /users/{}}
     * marks {@code GET /users/{id}}.
     *
     * @param contractFile provider contract
     * @param consumerName consumer identifier
     * @param expectations endpoint key to usage locations
     * @return the updated contract
     * @throws ContractParseException if the contract cannot be read
     * @throws IOException if the contract cannot be written
     */
    public Contract updateContractWithConsumers(Path contractFile, String consumerName,
                                                Map<String, List<String>> expectations)
            throws ContractParseException, IOException {
        Contract contract = ContractStore.load(contractFile);
        Set<EndpointKey> expected = expectations.keySet().stream()
            .map(EndpointKey::parse)
            .flatMap(Optional::stream)
            .map(key -> PathNormalizer.key(key.method(), key.path()))
            .collect(Collectors.toSet());

        List<Endpoint> updated = contract.endpoints().stream()
            .map(endpoint -> expected.contains(PathNormalizer.key(endpoint.method(), endpoint.path()))
                ? endpoint.withConsumer(consumerName)
                : endpoint)
            .toList();

        Contract result = contract.withEndpoints(updated);
        ContractStore.save(contractFile, result);
        log.debug("Recorded consumer {} on contract {}", consumerName, contractFile);
        return result;
    }
}

package com.contractbridge.core.sync;

import com.contractbridge.core.io.ExpectationsStore;
import com.contractbridge.core.model.ApiCall;
import com.contractbridge.core.model.ConsumerExpectations;
import com.contractbridge.core.model.Contract;
import com.contractbridge.core.model.Endpoint;
import com.contractbridge.core.model.Expectation;
import com.contractbridge.core.scanner.CallSiteScanner;
import com.contractbridge.core.scanner.ContractIndex;
import com.contractbridge.core.util.Timestamps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Records which endpoints of a provider contract the local code base calls.
 *
 * <p>Call sites are matched against the contract; one expectation is written per matched
 * endpoint, keyed by the endpoint's {@code METHOD path} as published in the contract,
 * with every matching call-site location.
 */
public class ConsumerExpectationsRecorder {

    private static final Logger log = LoggerFactory.getLogger(ConsumerExpectationsRecorder.class);

    private final Path repoRoot;

    public ConsumerExpectationsRecorder(Path repoRoot) {
        this.repoRoot = repoRoot;
    }

    /**
     * Computes the expectations of this repository against a contract.
     *
     * @param dependencyName dependency the contract belongs to
     * @param contract provider contract
     * @return expectations document
     */
    public ConsumerExpectations collect(String dependencyName, Contract contract) {
        ContractIndex index = new ContractIndex(contract);
        Map<String, Set<String>> locationsByEndpoint = new LinkedHashMap<>();

        // One scanner per call: the parser is not shared between sync workers
        for (ApiCall call : new CallSiteScanner(repoRoot).scan()) {
            Optional<Endpoint> endpoint = index.match(call);
            endpoint.ifPresent(matched -> locationsByEndpoint
                .computeIfAbsent(matched.key().toString(), key -> new LinkedHashSet<>())
                .add(call.location()));
        }

        List<Expectation> expectations = new ArrayList<>();
        locationsByEndpoint.forEach((endpoint, locations) ->
            expectations.add(new Expectation(endpoint, Expectation.STATUS_USING, new ArrayList<>(locations))));
        return new ConsumerExpectations(dependencyName, Timestamps.now(), expectations);
    }

    /**
     * Computes and writes the expectations of this repository against a contract.
     *
     * @param dependencyName dependency the contract belongs to
     * @param contract provider contract
     * @param target expectations file
     * @return the written document
     * @throws IOException if the file cannot be written
     */
    public ConsumerExpectations record(String dependencyName, Contract contract, Path target) throws IOException {
        ConsumerExpectations expectations = collect(dependencyName, contract);
        ExpectationsStore.save(target, expectations);
        log.debug("Recorded {} expectation(s) for {}", expectations.expectations().size(), dependencyName);
        return expectations;
    }
}

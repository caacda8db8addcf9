package com.contractbridge.core.scanner;

import com.contractbridge.core.model.ApiCall;
import com.contractbridge.core.model.Contract;
import com.contractbridge.core.model.Endpoint;
import com.contractbridge.core.model.EndpointKey;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Looks up contract endpoints by normalized (method, path).
 *
 * <p>A call matches an endpoint when the methods are equal and both paths are equal after
 * {@link PathNormalizer#normalize normalization}.
 */
public final class ContractIndex {

    private final Map<EndpointKey, Endpoint> byNormalizedKey = new LinkedHashMap<>();

    public ContractIndex(Contract contract) {
        for (Endpoint endpoint : contract.endpoints()) {
            byNormalizedKey.putIfAbsent(PathNormalizer.key(endpoint.method(), endpoint.path()), endpoint);
        }
    }

    public Optional<Endpoint> match(ApiCall call) {
        return Optional.ofNullable(byNormalizedKey.get(PathNormalizer.key(call.method(), call.path())));
    }
}

package com.contractbridge.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Endpoint-level differences between two versions of a contract. Never persisted.
 *
 * <p>Endpoints are paired by (method, path). A pair is modified when the endpoints differ
 * in anything but their extraction timestamp and consumer list.
 *
 * @param added endpoints only in the new contract
 * @param removed endpoints only in the old contract
 * @param modified new versions of endpoints whose content changed
 */
public record ContractDiff(
    List<Endpoint> added,
    List<Endpoint> removed,
    List<Endpoint> modified
) {
    public ContractDiff {
        added = added == null ? List.of() : List.copyOf(added);
        removed = removed == null ? List.of() : List.copyOf(removed);
        modified = modified == null ? List.of() : List.copyOf(modified);
    }

    /**
     * Compares two contracts. Without a previous contract every endpoint counts as added.
     *
     * @param previous previous contract, or null on first sync
     * @param current new contract
     * @return differences
     */
    public static ContractDiff between(Contract previous, Contract current) {
        if (previous == null) {
            return new ContractDiff(current.endpoints(), List.of(), List.of());
        }

        Map<EndpointKey, Endpoint> oldEndpoints = previous.endpointsByKey();
        Map<EndpointKey, Endpoint> newEndpoints = current.endpointsByKey();
        List<Endpoint> added = new ArrayList<>();
        List<Endpoint> removed = new ArrayList<>();
        List<Endpoint> modified = new ArrayList<>();

        newEndpoints.forEach((key, endpoint) -> {
            Endpoint old = oldEndpoints.get(key);
            if (old == null) {
                added.add(endpoint);
            } else if (!old.sameExtractedShape(endpoint)) {
                modified.add(endpoint);
            }
        });
        oldEndpoints.forEach((key, endpoint) -> {
            if (!newEndpoints.containsKey(key)) {
                removed.add(endpoint);
            }
        });

        return new ContractDiff(added, removed, modified);
    }

    public boolean hasChanges() {
        return !added.isEmpty() || !removed.isEmpty() || !modified.isEmpty();
    }

    /**
     * Human-readable change lines: additions, then removals, then modifications.
     *
     * @return lines such as {@code Added: GET /users}
     */
    public List<String> changeDescriptions() {
        List<String> changes = new ArrayList<>();
        added.forEach(endpoint -> changes.add("Added: " + endpoint.key()));
        removed.forEach(endpoint -> changes.add("Removed: " + endpoint.key()));
        modified.forEach(endpoint -> changes.add("Modified: " + endpoint.key()));
        return changes;
    }
}

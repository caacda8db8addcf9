package com.contractbridge.core.extractor;

import com.contractbridge.core.model.Contract;

import java.util.List;

/**
 * Produces a provider contract from source code.
 */
public interface ContractExtractor {

    /**
     * Extracts a contract from the files matching the given globs.
     *
     * <p>Globs are relative to the repository root. Files that cannot be parsed are
     * skipped.
     *
     * @param globs glob patterns, e.g. {@code src/main/java/**}{@code /*.java}
     * @return extracted contract
     */
    Contract extract(List<String> globs);
}

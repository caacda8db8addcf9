package com.contractbridge.core.sync;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

/**
 * Retrieves a snapshot of a provider repository.
 */
public interface ContractFetcher {

    /**
     * Fetches the latest revision of a remote repository into {@code destination}.
     *
     * @param remoteUrl repository URL
     * @param destination directory to create; must not exist yet
     * @param timeout maximum time to wait, or empty to wait indefinitely
     * @throws FetchException if the repository cannot be fetched in time
     */
    void fetch(String remoteUrl, Path destination, Optional<Duration> timeout) throws FetchException;
}

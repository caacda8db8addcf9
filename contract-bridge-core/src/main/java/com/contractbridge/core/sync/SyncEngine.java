package com.contractbridge.core.sync;

import com.contractbridge.core.config.BridgeConfig;
import com.contractbridge.core.io.ContractParseException;
import com.contractbridge.core.io.ContractStore;
import com.contractbridge.core.model.Contract;
import com.contractbridge.core.model.ContractDiff;
import com.contractbridge.core.model.Dependency;
import com.contractbridge.core.model.SyncResult;
import com.contractbridge.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fetches provider contracts into the local cache.
 *
 * <p>For a git dependency the provider repository is shallow-cloned into a private
 * temporary workspace, the contract is parsed and diffed against the cached copy, the
 * consumer expectations are recorded and the cache is replaced atomically. When the
 * fetch itself fails, a readable cached contract is used instead and the result is a
 * success with warning.
 *
 * <p>{@link #syncAll()} runs at most {@value #MAX_CONCURRENT_SYNCS} syncs in parallel. A
 * failing dependency never affects the others.
 */
public class SyncEngine {

    /** Upper bound on concurrently running syncs. */
    public static final int MAX_CONCURRENT_SYNCS = 5;

    private static final Logger log = LoggerFactory.getLogger(SyncEngine.class);
    private static final String WORKSPACE_PREFIX = "contract-bridge-";

    private final BridgeConfig config;
    private final ContractFetcher fetcher;
    private final SyncProgressListener listener;
    private final ConsumerExpectationsRecorder expectationsRecorder;

    public SyncEngine(BridgeConfig config) {
        this(config, new GitContractFetcher(), SyncProgressListener.NONE);
    }

    public SyncEngine(BridgeConfig config, ContractFetcher fetcher, SyncProgressListener listener) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher must not be null");
        this.listener = listener == null ? SyncProgressListener.NONE : listener;
        this.expectationsRecorder = new ConsumerExpectationsRecorder(config.getRepoRoot());
    }

    /**
     * Syncs a single dependency.
     *
     * @param dependencyName registered dependency name
     * @return sync result; never throws for per-dependency problems
     */
    public SyncResult syncDependency(String dependencyName) {
        Optional<Dependency> dependency = config.getDependency(dependencyName);
        if (dependency.isEmpty()) {
            return SyncResult.failed(dependencyName,
                "Dependency '" + dependencyName + "' not found in configuration");
        }

        String syncMethod = String.valueOf(dependency.get().syncMethod());
        return switch (syncMethod) {
            case Dependency.SYNC_GIT -> syncViaGit(dependencyName, dependency.get());
            case Dependency.SYNC_HTTP -> SyncResult.failed(dependencyName, "HTTP sync not yet implemented");
            case Dependency.SYNC_S3 -> SyncResult.failed(dependencyName, "Cloud sync not yet implemented");
            default -> SyncResult.failed(dependencyName, "Unsupported sync method: " + syncMethod);
        };
    }

    /**
     * Syncs every registered dependency.
     *
     * <p>Each dependency reports {@link SyncStatus#STARTING} and then
     * {@link SyncStatus#COMPLETED} or {@link SyncStatus#FAILED} to the progress listener.
     *
     * @return one result per dependency, ordered by dependency name
     */
    public List<SyncResult> syncAll() {
        List<String> names = config.listDependencies();
        if (names.isEmpty()) {
            return List.of();
        }

        int workers = Math.min(names.size(), MAX_CONCURRENT_SYNCS);
        log.debug("Syncing {} dependencies with {} worker(s)", names.size(), workers);
        ExecutorService executor = Executors.newFixedThreadPool(workers, new SyncThreadFactory());
        List<SyncResult> results = new ArrayList<>();
        try {
            List<Future<SyncResult>> futures = new ArrayList<>();
            for (String name : names) {
                futures.add(executor.submit(() -> syncWithProgress(name)));
            }
            for (int i = 0; i < names.size(); i++) {
                results.add(awaitResult(names.get(i), futures.get(i)));
            }
        } finally {
            executor.shutdown();
        }

        results.sort(Comparator.comparing(SyncResult::dependencyName));
        return results;
    }

    private SyncResult awaitResult(String name, Future<SyncResult> future) {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Unexpected error while syncing {}", name, cause);
            return SyncResult.failed(name, "Unexpected error during sync: " + cause.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return SyncResult.failed(name, "Unexpected error during sync: interrupted");
        }
    }

    private SyncResult syncWithProgress(String name) {
        notify(name, SyncStatus.STARTING);
        SyncResult result = null;
        try {
            result = syncDependency(name);
        } catch (RuntimeException e) {
            log.error("Unexpected error while syncing {}", name, e);
            result = SyncResult.failed(name, "Unexpected error during sync: " + e.getMessage());
        } finally {
            // An Error leaves result unset and still propagates to awaitResult
            notify(name, result != null && result.success() ? SyncStatus.COMPLETED : SyncStatus.FAILED);
        }
        return result;
    }

    private void notify(String name, SyncStatus status) {
        try {
            listener.onProgress(name, status);
        } catch (RuntimeException e) {
            log.warn("Progress listener failed for {} ({}): {}", name, status.value(), e.getMessage());
        }
    }

    // ==================== Git ====================

    private SyncResult syncViaGit(String name, Dependency dependency) {
        if (isBlank(dependency.localCache()) || isBlank(dependency.contractPath())) {
            return SyncResult.failed(name, "Dependency " + name + ": contract_path and local_cache are required");
        }
        if (isBlank(dependency.gitUrl())) {
            return SyncResult.failed(name, "Dependency " + name + ": git_url is required for git sync method");
        }
        Path cachePath = config.resolve(dependency.localCache());

        try (TemporaryWorkspace workspace = TemporaryWorkspace.create(WORKSPACE_PREFIX)) {
            Path checkout = workspace.resolve("repo");
            try {
                fetcher.fetch(dependency.gitUrl(), checkout, config.getFetchTimeout());
            } catch (FetchException e) {
                log.warn("Fetching {} failed: {}", name, e.getMessage());
                return offlineFallback(name, cachePath, e.getMessage());
            }

            Path contractSource = checkout.resolve(dependency.contractPath());
            if (!Files.isRegularFile(contractSource)) {
                return SyncResult.failed(name, "Contract file not found: " + dependency.contractPath());
            }

            Contract contract;
            try {
                contract = ContractStore.load(contractSource);
            } catch (ContractParseException e) {
                return SyncResult.failed(name,
                    "Failed to parse contract " + dependency.contractPath() + ": " + e.getMessage());
            }

            Contract previous = loadPrevious(cachePath);
            ContractDiff diff = ContractDiff.between(previous, contract);

            expectationsRecorder.record(name, contract, config.expectationsFile(name));
            FileUtils.writeAtomically(cachePath, Files.readString(contractSource, StandardCharsets.UTF_8));

            log.info("Synced {}: {} endpoint(s), {} change(s)", name, contract.endpoints().size(),
                diff.changeDescriptions().size());
            return SyncResult.synced(name, diff.changeDescriptions(), contract.endpoints().size(), cachePath.toString());
        } catch (IOException e) {
            log.warn("Sync of {} failed: {}", name, e.getMessage());
            return offlineFallback(name, cachePath, "Sync failed: " + e.getMessage());
        }
    }

    private Contract loadPrevious(Path cachePath) {
        if (!Files.exists(cachePath)) {
            return null;
        }
        try {
            return ContractStore.load(cachePath);
        } catch (ContractParseException e) {
            log.debug("Ignoring unreadable cached contract {}: {}", cachePath, e.getMessage());
            return null;
        }
    }

    private SyncResult offlineFallback(String name, Path cachePath, String error) {
        if (!Files.exists(cachePath)) {
            return SyncResult.failed(name, error, "No cached contract available");
        }
        try {
            Contract cached = ContractStore.load(cachePath);
            return SyncResult.offline(name, "Using cached contract (sync failed: " + error + ")", error,
                cached.endpoints().size(), cachePath.toString());
        } catch (ContractParseException e) {
            return SyncResult.failed(name, error, "Failed to load cached contract: " + e.getMessage());
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static final class SyncThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, "contract-sync-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}

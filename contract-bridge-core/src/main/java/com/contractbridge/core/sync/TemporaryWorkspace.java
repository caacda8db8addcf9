package com.contractbridge.core.sync;

import com.contractbridge.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * A private temporary directory that is deleted when the workspace is closed.
 *
 * <pre>{@code
 * try (TemporaryWorkspace workspace = TemporaryWorkspace.create("contract-bridge-")) {
 *     fetcher.fetch(url, workspace.resolve("repo"), timeout);
 *     ...
 * }
 * }</pre>
 *
 * <p>Cleanup is best effort: a directory that cannot be removed is logged and left behind.
 */
public final class TemporaryWorkspace implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TemporaryWorkspace.class);

    private final Path directory;

    private TemporaryWorkspace(Path directory) {
        this.directory = directory;
    }

    public static TemporaryWorkspace create(String prefix) throws IOException {
        return new TemporaryWorkspace(Files.createTempDirectory(prefix));
    }

    public Path directory() {
        return directory;
    }

    public Path resolve(String other) {
        return directory.resolve(other);
    }

    @Override
    public void close() {
        try {
            FileUtils.deleteRecursively(directory);
        } catch (IOException e) {
            log.warn("Failed to delete temporary workspace {}: {}", directory, e.getMessage());
        }
    }
}

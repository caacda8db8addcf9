package com.contractbridge.core.sync;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Fetches provider repositories with a shallow {@code git clone --depth 1}.
 *
 * <p>Requires a {@code git} executable on the {@code PATH}. Output of the clone is
 * written to {@code <destination>.log} and quoted in the failure message.
 */
public class GitContractFetcher implements ContractFetcher {

    private static final Logger log = LoggerFactory.getLogger(GitContractFetcher.class);
    private static final int MAX_OUTPUT_IN_MESSAGE = 500;

    private final String gitExecutable;

    public GitContractFetcher() {
        this("git");
    }

    public GitContractFetcher(String gitExecutable) {
        this.gitExecutable = gitExecutable;
    }

    @Override
    public void fetch(String remoteUrl, Path destination, Optional<Duration> timeout) throws FetchException {
        if (remoteUrl == null || remoteUrl.isBlank()) {
            throw new FetchException("Git operation failed: no repository URL given");
        }
        List<String> command = List.of(gitExecutable, "clone", "--depth", "1", "--quiet", remoteUrl, destination.toString());
        Path outputLog = destination.resolveSibling(destination.getFileName() + ".log");
        log.debug("Running: {}", String.join(" ", command));

        Process process;
        try {
            process = new ProcessBuilder(command)
                .redirectErrorStream(true)
                .redirectOutput(outputLog.toFile())
                .start();
        } catch (IOException | RuntimeException e) {
            throw new FetchException("Git operation failed: could not start git: " + e.getMessage(), e);
        }

        try {
            if (timeout.isPresent()) {
                if (!process.waitFor(timeout.get().toMillis(), TimeUnit.MILLISECONDS)) {
                    process.destroyForcibly();
                    throw new FetchException("Git operation timed out after " + timeout.get().toSeconds()
                        + "s: git clone " + remoteUrl);
                }
            } else {
                process.waitFor();
            }
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new FetchException("Git operation interrupted: git clone " + remoteUrl, e);
        }

        int exitCode = process.exitValue();
        if (exitCode != 0) {
            throw new FetchException("Git operation failed: git clone " + remoteUrl
                + " (exit code " + exitCode + "): " + readOutput(outputLog));
        }
    }

    private String readOutput(Path outputLog) {
        try {
            String output = Files.readString(outputLog, StandardCharsets.UTF_8).trim();
            return output.length() > MAX_OUTPUT_IN_MESSAGE ? output.substring(0, MAX_OUTPUT_IN_MESSAGE) + "..." : output;
        } catch (IOException e) {
            log.debug("Cannot read git output {}: {}", outputLog, e.getMessage());
            return "<no output>";
        }
    }
}

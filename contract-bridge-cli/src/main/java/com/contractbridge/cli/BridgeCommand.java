package com.contractbridge.cli;

import com.contractbridge.core.config.BridgeConfig;
import com.contractbridge.core.config.BridgeConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Base class for commands operating on a repository.
 *
 * <p>Configuration errors are reported with exit code {@link ExitCodes#CONFIG_ERROR};
 * any other unexpected exception with {@link ExitCodes#FAILURE}.
 */
abstract class BridgeCommand implements Callable<Integer> {

    protected final Logger log = LoggerFactory.getLogger(getClass());

    @Spec
    protected CommandSpec spec;

    @Option(
        names = {"-r", "--repo"},
        description = "Repository root (default: current directory)",
        defaultValue = "."
    )
    protected Path repoRoot;

    @Override
    public Integer call() {
        try {
            return execute();
        } catch (BridgeConfigException e) {
            log.debug("Configuration error", e);
            err().println("✗ Configuration error: " + e.getMessage());
            return ExitCodes.CONFIG_ERROR;
        } catch (Exception e) {
            log.error("{} failed", spec.name(), e);
            err().println("✗ " + spec.name() + " failed: " + e.getMessage());
            return ExitCodes.FAILURE;
        }
    }

    protected abstract int execute() throws Exception;

    protected Path repoRoot() {
        return repoRoot.toAbsolutePath().normalize();
    }

    protected BridgeConfig loadConfig() {
        return BridgeConfig.load(repoRoot());
    }

    protected PrintWriter out() {
        return spec.commandLine().getOut();
    }

    protected PrintWriter err() {
        return spec.commandLine().getErr();
    }
}

package com.contractbridge.core.io;

import com.contractbridge.core.model.ConsumerExpectations;
import com.contractbridge.core.util.FileUtils;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Reads and writes consumer expectation documents in YAML.
 */
public final class ExpectationsStore {

    private static final Logger log = LoggerFactory.getLogger(ExpectationsStore.class);
    private static final ObjectMapper YAML_MAPPER = YamlSupport.newMapper();

    private ExpectationsStore() {
        // Utility class
    }

    /**
     * Loads an expectations document.
     *
     * @param file expectations file
     * @return the document, or empty if the file does not exist or cannot be parsed
     */
    public static Optional<ConsumerExpectations> load(Path file) {
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(YAML_MAPPER.readValue(file.toFile(), ConsumerExpectations.class));
        } catch (IOException e) {
            log.warn("Failed to read consumer expectations {}: {}", file, ContractStore.describe(e));
            return Optional.empty();
        }
    }

    /**
     * Writes an expectations document atomically.
     *
     * @param file target file
     * @param expectations document to write
     * @throws IOException if writing fails
     */
    public static void save(Path file, ConsumerExpectations expectations) throws IOException {
        FileUtils.writeAtomically(file, YAML_MAPPER.writeValueAsString(expectations));
        log.debug("Wrote {} expectation(s) to: {}", expectations.expectations().size(), file);
    }
}

package com.contractbridge.core.io;

import com.contractbridge.core.model.Contract;
import com.contractbridge.core.util.FileUtils;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads and writes contract documents in YAML.
 *
 * <p>See {@link Contract} for the document layout.
 *
 * <p>{@code last_updated} is kept as a string and round-trips unchanged.
 */
public final class ContractStore {

    private static final Logger log = LoggerFactory.getLogger(ContractStore.class);
    private static final ObjectMapper YAML_MAPPER = YamlSupport.newMapper();

    private ContractStore() {
        // Utility class
    }

    /**
     * Loads a contract from a YAML file.
     *
     * @param file contract file
     * @return parsed contract
     * @throws ContractParseException if the file is missing, unreadable or not a valid contract
     */
    public static Contract load(Path file) throws ContractParseException {
        if (!Files.isRegularFile(file)) {
            throw new ContractParseException("Contract file not found: " + file);
        }
        try {
            log.debug("Loading contract from: {}", file);
            Contract contract = YAML_MAPPER.readValue(file.toFile(), Contract.class);
            if (contract == null) {
                throw new ContractParseException("Contract file is empty: " + file);
            }
            return contract;
        } catch (IOException e) {
            throw new ContractParseException(describe(e), e);
        }
    }

    /**
     * Writes a contract atomically, creating parent directories as needed.
     *
     * @param file target file
     * @param contract contract to write
     * @throws IOException if writing fails
     */
    public static void save(Path file, Contract contract) throws IOException {
        FileUtils.writeAtomically(file, toYaml(contract));
        log.debug("Wrote contract with {} endpoint(s) to: {}", contract.endpoints().size(), file);
    }

    /**
     * Serializes a contract to YAML.
     *
     * @param contract contract
     * @return YAML document
     * @throws IOException if serialization fails
     */
    public static String toYaml(Contract contract) throws IOException {
        return YAML_MAPPER.writeValueAsString(contract);
    }

    static String describe(IOException e) {
        if (e instanceof JsonProcessingException jpe) {
            return jpe.getOriginalMessage();
        }
        return e.getClass().getSimpleName() + ": " + e.getMessage();
    }
}

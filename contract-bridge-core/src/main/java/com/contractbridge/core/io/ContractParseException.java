package com.contractbridge.core.io;

/**
 * Thrown when a contract document cannot be read or does not describe a valid contract.
 */
public class ContractParseException extends Exception {

    public ContractParseException(String message) {
        super(message);
    }

    public ContractParseException(String message, Throwable cause) {
        super(message, cause);
    }
}

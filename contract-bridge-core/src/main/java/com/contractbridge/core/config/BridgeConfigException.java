package com.contractbridge.core.config;

/**
 * Thrown when the dependency registry cannot be read or written.
 */
public class BridgeConfigException extends RuntimeException {

    public BridgeConfigException(String message) {
        super(message);
    }

    public BridgeConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}

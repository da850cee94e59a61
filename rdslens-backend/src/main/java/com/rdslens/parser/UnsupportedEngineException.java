package com.rdslens.parser;

/**
 * Thrown when slow query extraction is requested for an engine without a log parser.
 */
public class UnsupportedEngineException extends RuntimeException {

    /**
     * Create a new exception.
     *
     * @param engine raw engine string reported by the control plane
     */
    public UnsupportedEngineException(String engine) {
        super("Unsupported database engine: " + engine);
    }
}

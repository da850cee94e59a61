package com.rdslens.cloud;

/**
 * Thrown when the control plane does not know the requested instance identifier.
 */
public class InstanceNotFoundException extends RuntimeException {
    /**
     * Create a new exception.
     *
     * @param identifier instance identifier
     */
    public InstanceNotFoundException(String identifier) {
        super("RDS instance not found: " + identifier);
    }
}

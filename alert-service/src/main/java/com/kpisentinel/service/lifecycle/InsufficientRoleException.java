package com.kpisentinel.service.lifecycle;

/**
 * Thrown when the caller's role is unknown or too low for the operation.
 */
public class InsufficientRoleException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public InsufficientRoleException(String message) {
        super(message);
    }
}

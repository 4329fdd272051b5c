package com.zzf.localagent.exception;

/**
 * Rejected input: unknown repository root, bad branch name, context not initialised.
 * Nothing has been mutated when this is thrown.
 */
public class ValidationException extends LocalAgentException {

    public static final String CODE = "VALIDATION_ERROR";

    public ValidationException(String message) {
        super(CODE, message);
    }
}

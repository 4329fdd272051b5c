package com.zzf.localagent.exception;

/**
 * Base runtime exception of the agent control plane. Every failure surfaced to a caller
 * carries a stable error code next to its message.
 */
public class LocalAgentException extends RuntimeException {

    private final String errorCode;

    public LocalAgentException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public LocalAgentException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}

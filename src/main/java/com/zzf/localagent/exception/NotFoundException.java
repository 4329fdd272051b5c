package com.zzf.localagent.exception;

public class NotFoundException extends LocalAgentException {

    public static final String CODE = "NOT_FOUND";

    public NotFoundException(String message) {
        super(CODE, message);
    }
}

package com.zzf.localagent.exception;

import java.io.IOException;

public class StorageException extends LocalAgentException {

    public static final String CODE = "STORAGE_ERROR";

    public StorageException(String message, IOException cause) {
        super(CODE, message, cause);
    }
}

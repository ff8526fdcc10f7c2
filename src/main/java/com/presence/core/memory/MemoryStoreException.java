package com.presence.core.memory;

public class MemoryStoreException extends RuntimeException {

    public MemoryStoreException(String message) {
        super(message);
    }

    public MemoryStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}

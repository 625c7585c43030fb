package com.barka.mcp.core.connection;

public class StoreConnectionException extends RuntimeException {

    public StoreConnectionException(String message) {
        super(message);
    }

    public StoreConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}

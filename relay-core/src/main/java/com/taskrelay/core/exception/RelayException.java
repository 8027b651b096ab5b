package com.taskrelay.core.exception;

/**
 * Base exception for all relay errors.
 */
public class RelayException extends RuntimeException {
    
    private final String errorCode;
    
    public RelayException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    
    public RelayException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
    
    public String getErrorCode() {
        return errorCode;
    }
}

package com.taskrelay.core.exception;

import java.util.List;

/**
 * Thrown when a board request is malformed or its preconditions do not hold.
 */
public class BoardValidationException extends RelayException {
    
    public static final String ERROR_CODE = "BOARD_VALIDATION_FAILED";
    
    private final List<String> validationErrors;
    
    public BoardValidationException(String message) {
        super(ERROR_CODE, message);
        this.validationErrors = List.of(message);
    }
    
    public BoardValidationException(List<String> errors) {
        super(ERROR_CODE, "Board validation failed: " + String.join(", ", errors));
        this.validationErrors = List.copyOf(errors);
    }
    
    public List<String> getValidationErrors() {
        return validationErrors;
    }
}

package com.flowauto;

import com.flowauto.validate.ValidationError;

import java.util.List;

/**
 * Thrown when a graph cannot be read or compiled. Carries every problem found,
 * not only the first.
 */
public class TranspilerException extends RuntimeException {

    private final List<ValidationError> errors;

    public TranspilerException(String message, List<ValidationError> errors) {
        super(message + (errors.isEmpty() ? "" : ": " + errors));
        this.errors = List.copyOf(errors);
    }

    public TranspilerException(String message, Throwable cause) {
        super(message, cause);
        this.errors = List.of();
    }

    public List<ValidationError> getErrors() {
        return errors;
    }
}

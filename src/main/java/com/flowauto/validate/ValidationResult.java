package com.flowauto.validate;

import java.util.ArrayList;
import java.util.List;

/**
 * All problems found by one validation pass. Empty means valid.
 */
public record ValidationResult(List<ValidationError> errors) {

    public static final ValidationResult VALID = new ValidationResult(List.of());

    public ValidationResult {
        errors = List.copyOf(errors);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public boolean has(ValidationError.Code code) {
        for (ValidationError e : errors)
            if (e.code() == code)
                return true;
        return false;
    }

    public List<String> messages() {
        List<String> out = new ArrayList<>(errors.size());
        for (ValidationError e : errors)
            out.add(e.toString());
        return out;
    }
}

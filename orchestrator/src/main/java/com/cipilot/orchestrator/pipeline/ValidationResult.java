package com.cipilot.orchestrator.pipeline;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of validating one artifact file. Valid until the first error is added.
 */
public class ValidationResult {

    private final List<String> errors = new ArrayList<>();

    public static ValidationResult ok() {
        return new ValidationResult();
    }

    public static ValidationResult failed(String error) {
        ValidationResult result = new ValidationResult();
        result.addError(error);
        return result;
    }

    public void addError(String error) {
        errors.add(error);
    }

    public boolean isValid()          { return errors.isEmpty(); }
    public List<String> getErrors()   { return List.copyOf(errors); }

    @Override
    public String toString() {
        return isValid() ? "valid" : String.join("; ", errors);
    }
}

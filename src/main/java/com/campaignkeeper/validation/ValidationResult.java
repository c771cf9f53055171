package com.campaignkeeper.validation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class ValidationResult {
    private final List<String> errors;

    private ValidationResult(List<String> errors) {
        if (errors == null || errors.isEmpty()) {
            this.errors = Collections.emptyList();
        } else {
            this.errors = Collections.unmodifiableList(new ArrayList<>(errors));
        }
    }

    public static ValidationResult ok() {
        return new ValidationResult(Collections.emptyList());
    }

    public static ValidationResult of(List<String> errors) {
        return new ValidationResult(errors);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public List<String> getErrors() {
        return errors;
    }

    /**
     * Throws {@link ContentValidationException} carrying every error when invalid.
     */
    public void throwIfInvalid() {
        if (!isValid()) {
            throw new ContentValidationException(errors);
        }
    }
}

package com.campaignkeeper.validation;

import java.util.Collections;
import java.util.List;

/**
 * A rejected request: bad ids, missing campaign, schema violations, cycles.
 * Raised before anything is written.
 */
public class ContentValidationException extends IllegalArgumentException {

    private final List<String> details;

    public ContentValidationException(String message) {
        super(message);
        this.details = Collections.singletonList(message);
    }

    public ContentValidationException(List<String> details) {
        super(details.size() == 1 ? details.get(0) : "Validation failed");
        this.details = List.copyOf(details);
    }

    public List<String> getDetails() {
        return details;
    }
}

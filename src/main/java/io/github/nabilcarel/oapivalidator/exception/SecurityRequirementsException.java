package io.github.nabilcarel.oapivalidator.exception;

import java.util.Collections;
import java.util.List;

/**
 * No alternative of a security requirement list was satisfied.
 */
public class SecurityRequirementsException extends RuntimeException {
    private final List<String> errors;

    public SecurityRequirementsException(List<String> errors) {
        super("security requirements failed: " + String.join(" | ", errors));
        this.errors = Collections.unmodifiableList(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}

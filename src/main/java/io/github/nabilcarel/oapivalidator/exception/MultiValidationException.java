package io.github.nabilcarel.oapivalidator.exception;

import java.util.Collections;
import java.util.List;

public class MultiValidationException extends RuntimeException {
    private final List<String> errors;

    public MultiValidationException(List<String> errors) {
        super(String.join(" | ", errors));
        this.errors = Collections.unmodifiableList(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}

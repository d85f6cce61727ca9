package io.github.nabilcarel.oapivalidator.exception;

import java.util.Collections;
import java.util.List;

/**
 * The request does not conform to the operation's parameters or body schema. The message has one
 * violation per line.
 */
public class RequestConformanceException extends RuntimeException {
    private final List<String> violations;

    public RequestConformanceException(List<String> violations) {
        super(String.join("\n", violations));
        this.violations = Collections.unmodifiableList(violations);
    }

    public List<String> getViolations() {
        return violations;
    }

    public String getFirstLine() {
        String message = getMessage();
        int newline = message.indexOf('\n');
        return newline < 0 ? message : message.substring(0, newline);
    }
}

package io.github.nabilcarel.oapivalidator.exception;

import lombok.Getter;

/**
 * Thrown by an {@link io.github.nabilcarel.oapivalidator.service.AuthenticationFunction} when a
 * security scheme is not satisfied.
 */
@Getter
public class AuthenticationException extends RuntimeException {
    private final String securitySchemeName;

    public AuthenticationException(String message, String securitySchemeName) {
        super(message);
        this.securitySchemeName = securitySchemeName;
    }

    public AuthenticationException(String message, String securitySchemeName, Throwable cause) {
        super(message, cause);
        this.securitySchemeName = securitySchemeName;
    }
}

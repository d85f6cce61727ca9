package io.github.nabilcarel.oapivalidator.service;

import io.github.nabilcarel.oapivalidator.model.request.AuthenticationInput;

/**
 * Verifies one security scheme of a security requirement for the current request.
 * Implementations signal failure by throwing
 * {@link io.github.nabilcarel.oapivalidator.exception.AuthenticationException}.
 */
@FunctionalInterface
public interface AuthenticationFunction {
    void authenticate(AuthenticationInput input);
}

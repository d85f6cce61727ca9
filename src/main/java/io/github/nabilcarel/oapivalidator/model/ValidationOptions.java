package io.github.nabilcarel.oapivalidator.model;

import io.github.nabilcarel.oapivalidator.service.AuthenticationFunction;
import io.github.nabilcarel.oapivalidator.service.CredentialPresenceAuthenticationFunction;
import lombok.Builder;
import lombok.Getter;

/**
 * Immutable settings shared by every request the filter validates.
 */
@Getter
@Builder(toBuilder = true)
public final class ValidationOptions {

    /**
     * Collect every violation instead of stopping at the first one. Failures are then reported
     * as a single aggregate with status 500.
     */
    private final boolean multiError;

    /**
     * Verifies a single security scheme of a security requirement.
     */
    @Builder.Default
    private final AuthenticationFunction authenticationFunction = new CredentialPresenceAuthenticationFunction();

    /**
     * Skip request body validation. The body is not buffered either.
     */
    private final boolean excludeRequestBody;

    /**
     * Passed to the validation engine. Responses are not validated by the filter.
     */
    private final boolean excludeResponseBody;

    @Builder.Default
    private final ErrorResponseContentType errorResponseContentType = ErrorResponseContentType.PLAIN;

    public static ValidationOptions defaults() {
        return ValidationOptions.builder().build();
    }
}

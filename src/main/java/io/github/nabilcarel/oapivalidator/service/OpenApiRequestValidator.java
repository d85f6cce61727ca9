package io.github.nabilcarel.oapivalidator.service;

import io.github.nabilcarel.oapivalidator.model.request.RequestValidationInput;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import java.util.List;

public interface OpenApiRequestValidator {

    /**
     * Validates security, parameters, headers and body of a routed request.
     *
     * @throws io.github.nabilcarel.oapivalidator.exception.SecurityRequirementsException
     * @throws io.github.nabilcarel.oapivalidator.exception.RequestConformanceException
     * @throws io.github.nabilcarel.oapivalidator.exception.MultiValidationException when errors
     *         are collected instead of failing fast
     */
    void validateRequest(RequestValidationInput input);

    /**
     * Passes when any one of the requirements is satisfied. An empty list always passes.
     *
     * @throws io.github.nabilcarel.oapivalidator.exception.SecurityRequirementsException
     */
    void validateSecurityRequirements(RequestValidationInput input, List<SecurityRequirement> requirements);
}

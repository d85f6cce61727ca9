package io.github.nabilcarel.oapivalidator.service;

import io.github.nabilcarel.oapivalidator.model.ValidationError;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Optional;

public interface RequestValidationService {

    /**
     * @return the reason to reject the request, or empty when it may reach the next handler
     */
    Optional<ValidationError> validateRequest(HttpServletRequest request);
}

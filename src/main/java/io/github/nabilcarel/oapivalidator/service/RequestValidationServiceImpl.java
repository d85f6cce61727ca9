package io.github.nabilcarel.oapivalidator.service;

import io.github.nabilcarel.oapivalidator.exception.MultiValidationException;
import io.github.nabilcarel.oapivalidator.exception.RequestConformanceException;
import io.github.nabilcarel.oapivalidator.exception.RouteNotFoundException;
import io.github.nabilcarel.oapivalidator.exception.SecurityRequirementsException;
import io.github.nabilcarel.oapivalidator.model.ErrorKind;
import io.github.nabilcarel.oapivalidator.model.RouteMatch;
import io.github.nabilcarel.oapivalidator.model.ValidationError;
import io.github.nabilcarel.oapivalidator.model.ValidationOptions;
import io.github.nabilcarel.oapivalidator.model.request.CachedBodyRequestWrapper;
import io.github.nabilcarel.oapivalidator.model.request.RequestValidationInput;
import io.github.nabilcarel.oapivalidator.util.RequestPaths;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@RequiredArgsConstructor
@Slf4j
public class RequestValidationServiceImpl implements RequestValidationService {
    static final String VALIDATION_FAILED_PREFIX = "error validating route: ";

    private final OpenApiRouter router;
    private final OpenApiRequestValidator validator;
    private final ValidationOptions options;

    @Override
    public Optional<ValidationError> validateRequest(HttpServletRequest request) {
        RouteMatch match;
        RequestValidationInput input;
        try {
            match = router.findRoute(request);
            input = createInput(request, match);
        } catch (RouteNotFoundException e) {
            return reject(ErrorKind.ROUTE_NOT_FOUND, e.getMessage());
        } catch (RequestConformanceException e) {
            return reject(ErrorKind.REQUEST_CONFORMANCE_FAILED, e.getFirstLine());
        }

        // Security goes first unless every error is being collected
        if (!options.isMultiError()) {
            try {
                validator.validateSecurityRequirements(input, match.getRoute().getEffectiveSecurity());
            } catch (SecurityRequirementsException e) {
                return reject(ErrorKind.SECURITY_REQUIREMENT_FAILED, e.getMessage());
            } catch (RuntimeException e) {
                return unexpectedFailure(match, e);
            }
        }

        try {
            validator.validateRequest(input);
        } catch (RequestConformanceException e) {
            return reject(ErrorKind.REQUEST_CONFORMANCE_FAILED, e.getFirstLine());
        } catch (SecurityRequirementsException e) {
            return reject(ErrorKind.SECURITY_REQUIREMENT_FAILED, e.getMessage());
        } catch (MultiValidationException e) {
            return reject(ErrorKind.VALIDATION_FAILED, VALIDATION_FAILED_PREFIX + e.getMessage());
        } catch (RuntimeException e) {
            return unexpectedFailure(match, e);
        }

        return Optional.empty();
    }

    private RequestValidationInput createInput(HttpServletRequest request, RouteMatch match) {
        String body = null;
        boolean bodySkipped = false;
        if (request instanceof CachedBodyRequestWrapper) {
            CachedBodyRequestWrapper wrapper = (CachedBodyRequestWrapper) request;
            bodySkipped = !wrapper.isBodyAvailable();
            if (wrapper.hasBody()) {
                body = wrapper.getBody();
            }
        }

        return RequestValidationInput.builder()
                .request(request)
                .path(RequestPaths.pathWithinApplication(request))
                .route(match.getRoute())
                .pathParams(match.getPathParams())
                .queryParams(RequestPaths.queryParams(request))
                .body(body)
                .bodySkipped(bodySkipped)
                .options(options)
                .build();
    }

    private Optional<ValidationError> unexpectedFailure(RouteMatch match, RuntimeException e) {
        log.warn("Unexpected failure while validating {}", match.getRoute(), e);
        return reject(ErrorKind.VALIDATION_FAILED, VALIDATION_FAILED_PREFIX + e.getMessage());
    }

    private Optional<ValidationError> reject(ErrorKind kind, String message) {
        return Optional.of(new ValidationError(kind, message));
    }
}

package io.github.nabilcarel.oapivalidator.config.filter;

import io.github.nabilcarel.oapivalidator.model.OpenApiSpecification;
import io.github.nabilcarel.oapivalidator.model.ValidationError;
import io.github.nabilcarel.oapivalidator.model.ValidationOptions;
import io.github.nabilcarel.oapivalidator.model.request.CachedBodyRequestWrapper;
import io.github.nabilcarel.oapivalidator.service.AntPathOpenApiRouter;
import io.github.nabilcarel.oapivalidator.service.OpenApiRequestValidatorImpl;
import io.github.nabilcarel.oapivalidator.service.RequestValidationService;
import io.github.nabilcarel.oapivalidator.service.RequestValidationServiceImpl;
import io.github.nabilcarel.oapivalidator.writer.ErrorResponseWriter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Validates each request against an OpenAPI specification. Conforming requests continue down the
 * chain untouched; anything else is answered with 400, 401 or 500 and never reaches the handler.
 */
@RequiredArgsConstructor
@Slf4j
public class OapiRequestValidatorFilter extends OncePerRequestFilter {
    private final RequestValidationService requestValidationService;
    private final ErrorResponseWriter errorResponseWriter;
    private final ValidationOptions options;

    public static OapiRequestValidatorFilter create(OpenApiSpecification specification) {
        return create(specification, ValidationOptions.defaults());
    }

    public static OapiRequestValidatorFilter create(OpenApiSpecification specification, ValidationOptions options) {
        RequestValidationService service = new RequestValidationServiceImpl(
                new AntPathOpenApiRouter(specification),
                new OpenApiRequestValidatorImpl(specification, options),
                options);
        return new OapiRequestValidatorFilter(
                service, new ErrorResponseWriter(options.getErrorResponseContentType()), options);
    }

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {
        HttpServletRequest validatedRequest = options.isExcludeRequestBody()
                ? request
                : new CachedBodyRequestWrapper(request);

        Optional<ValidationError> error = requestValidationService.validateRequest(validatedRequest);

        if (error.isPresent()) {
            log.debug("Rejected {} {} with status {}: {}", request.getMethod(), request.getRequestURI(),
                    error.get().getStatus().value(), error.get().getMessage());
            errorResponseWriter.write(response, error.get());
            return;
        }

        filterChain.doFilter(validatedRequest, response);
    }
}

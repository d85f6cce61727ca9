package io.github.nabilcarel.oapivalidator.service;

import com.atlassian.oai.validator.OpenApiInteractionValidator;
import com.atlassian.oai.validator.model.Request;
import com.atlassian.oai.validator.model.SimpleRequest;
import com.atlassian.oai.validator.report.LevelResolver;
import com.atlassian.oai.validator.report.ValidationReport;
import io.github.nabilcarel.oapivalidator.exception.AuthenticationException;
import io.github.nabilcarel.oapivalidator.exception.MultiValidationException;
import io.github.nabilcarel.oapivalidator.exception.OpenApiSpecLoadException;
import io.github.nabilcarel.oapivalidator.exception.RequestConformanceException;
import io.github.nabilcarel.oapivalidator.exception.SecurityRequirementsException;
import io.github.nabilcarel.oapivalidator.model.OpenApiSpecification;
import io.github.nabilcarel.oapivalidator.model.ValidationOptions;
import io.github.nabilcarel.oapivalidator.model.request.AuthenticationInput;
import io.github.nabilcarel.oapivalidator.model.request.RequestValidationInput;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.parameters.Parameter;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import jakarta.servlet.http.HttpServletRequest;
import java.util.*;
import lombok.extern.slf4j.Slf4j;

/**
 * Evaluates security requirements through the configured {@link AuthenticationFunction} and
 * delegates parameter and body conformance to the swagger-request-validator engine.
 */
@Slf4j
public class OpenApiRequestValidatorImpl implements OpenApiRequestValidator {
    static final String SECURITY_MESSAGES = "validation.request.security";
    static final String REQUEST_BODY_MESSAGES = "validation.request.body";
    static final String RESPONSE_BODY_MESSAGES = "validation.response.body";

    private final OpenApiInteractionValidator interactionValidator;
    private final ValidationOptions options;

    public OpenApiRequestValidatorImpl(OpenApiSpecification specification, ValidationOptions options) {
        this.options = options;
        try {
            this.interactionValidator = OpenApiInteractionValidator
                    .createForInlineApiSpecification(specification.getContent())
                    .withLevelResolver(createLevelResolver(options))
                    .build();
        } catch (RuntimeException e) {
            throw new OpenApiSpecLoadException(
                    "Failed to create request validator for " + specification.getLocation() + ": " + e.getMessage(),
                    specification.getLocation(), e);
        }
    }

    @Override
    public void validateRequest(RequestValidationInput input) {
        List<String> errors = new ArrayList<>();

        try {
            validateSecurityRequirements(input, input.getRoute().getEffectiveSecurity());
        } catch (SecurityRequirementsException e) {
            if (!options.isMultiError()) {
                throw e;
            }
            errors.add(e.getMessage());
        }

        ValidationReport report = interactionValidator.validateRequest(toInteractionRequest(input));
        List<String> violations = collectViolations(report, input.isBodySkipped());

        if (options.isMultiError()) {
            errors.addAll(violations);
            if (!errors.isEmpty()) {
                throw new MultiValidationException(errors);
            }
            return;
        }

        if (!violations.isEmpty()) {
            throw new RequestConformanceException(violations);
        }
    }

    @Override
    public void validateSecurityRequirements(RequestValidationInput input, List<SecurityRequirement> requirements) {
        if (requirements == null || requirements.isEmpty()) {
            return;
        }

        Map<String, SecurityScheme> securitySchemes = getSecuritySchemes(input.getRoute().getSpec());
        List<String> errors = new ArrayList<>();

        for (SecurityRequirement requirement : requirements) {
            try {
                validateSecurityRequirement(input, requirement, securitySchemes);
                return;
            } catch (AuthenticationException e) {
                errors.add(e.getMessage());
            }
        }

        throw new SecurityRequirementsException(errors);
    }

    private void validateSecurityRequirement(RequestValidationInput input,
                                             SecurityRequirement requirement,
                                             Map<String, SecurityScheme> securitySchemes) {
        // Sorted for a stable error message
        for (Map.Entry<String, List<String>> entry : new TreeMap<>(requirement).entrySet()) {
            String schemeName = entry.getKey();
            SecurityScheme securityScheme = securitySchemes.get(schemeName);

            if (securityScheme == null) {
                throw new AuthenticationException(
                        "security scheme \"" + schemeName + "\" is not declared", schemeName);
            }

            options.getAuthenticationFunction().authenticate(AuthenticationInput.builder()
                    .validationInput(input)
                    .securitySchemeName(schemeName)
                    .securityScheme(securityScheme)
                    .scopes(entry.getValue() != null ? entry.getValue() : List.of())
                    .build());
        }
    }

    private Map<String, SecurityScheme> getSecuritySchemes(OpenAPI openApi) {
        if (openApi.getComponents() == null || openApi.getComponents().getSecuritySchemes() == null) {
            return Map.of();
        }
        return openApi.getComponents().getSecuritySchemes();
    }

    private Request toInteractionRequest(RequestValidationInput input) {
        HttpServletRequest request = input.getRequest();
        SimpleRequest.Builder builder = new SimpleRequest.Builder(
                input.getRoute().getMethod().name(), input.getPath());

        Enumeration<String> headerNames = request.getHeaderNames();
        if (headerNames != null) {
            for (String name : Collections.list(headerNames)) {
                builder.withHeader(name, Collections.list(request.getHeaders(name)).toArray(new String[0]));
            }
        }

        input.getQueryParams().forEach((name, values) ->
                builder.withQueryParam(name, values.toArray(new String[0])));

        if (input.getBody() != null && !input.getBody().isEmpty()) {
            builder.withBody(input.getBody());
        }

        return builder.build();
    }

    private List<String> collectViolations(ValidationReport report, boolean bodySkipped) {
        List<String> violations = new ArrayList<>();

        for (ValidationReport.Message message : report.getMessages()) {
            if (message.getLevel() != ValidationReport.Level.ERROR
                    || (bodySkipped && message.getKey().startsWith(REQUEST_BODY_MESSAGES))) {
                log.debug("Ignoring {} message {}: {}", message.getLevel(), message.getKey(), message.getMessage());
                continue;
            }
            violations.add(describe(message));
            violations.addAll(message.getAdditionalInfo());
        }

        return violations;
    }

    // Schema messages about a parameter do not name it
    private String describe(ValidationReport.Message message) {
        Optional<Parameter> parameter = message.getContext().flatMap(ValidationReport.MessageContext::getParameter);
        if (parameter.isEmpty() || message.getMessage().contains("'" + parameter.get().getName() + "'")) {
            return message.getMessage();
        }
        return parameter.get().getIn() + " parameter \"" + parameter.get().getName() + "\": " + message.getMessage();
    }

    private static LevelResolver createLevelResolver(ValidationOptions options) {
        LevelResolver.Builder levels = LevelResolver.create()
                .withLevel(SECURITY_MESSAGES, ValidationReport.Level.IGNORE);

        if (options.isExcludeRequestBody()) {
            levels.withLevel(REQUEST_BODY_MESSAGES, ValidationReport.Level.IGNORE);
        }
        if (options.isExcludeResponseBody()) {
            levels.withLevel(RESPONSE_BODY_MESSAGES, ValidationReport.Level.IGNORE);
        }

        return levels.build();
    }
}

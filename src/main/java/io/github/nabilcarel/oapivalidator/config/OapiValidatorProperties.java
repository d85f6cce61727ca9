package io.github.nabilcarel.oapivalidator.config;

import io.github.nabilcarel.oapivalidator.model.ErrorResponseContentType;
import io.github.nabilcarel.oapivalidator.model.ValidationOptions;
import io.github.nabilcarel.oapivalidator.service.AuthenticationFunction;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.core.Ordered;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "oapi.validator")
@Validated
@Getter
@Setter
public class OapiValidatorProperties {

    /**
     * Enable request validation.
     */
    private boolean enabled = true;

    /**
     * Location of the OpenAPI 3 document, e.g. classpath:openapi.yaml.
     */
    @NotBlank
    private String specLocation;

    /**
     * Servlet URL patterns the validation filter is mapped to.
     */
    @NotEmpty
    private List<String> urlPatterns = new ArrayList<>(List.of("/*"));

    /**
     * Order of the validation filter in the servlet filter chain.
     */
    private int filterOrder = Ordered.LOWEST_PRECEDENCE - 1;

    /**
     * Report every violation at once. Failures are then answered with 500.
     */
    private boolean multiError = false;

    private boolean excludeRequestBody = false;

    private boolean excludeResponseBody = false;

    /**
     * Format of the body of rejected requests: plain, json or xml.
     */
    @NotNull
    private ErrorResponseContentType errorResponseContentType = ErrorResponseContentType.PLAIN;

    public ValidationOptions toValidationOptions(AuthenticationFunction authenticationFunction) {
        return ValidationOptions.builder()
                .multiError(multiError)
                .excludeRequestBody(excludeRequestBody)
                .excludeResponseBody(excludeResponseBody)
                .errorResponseContentType(errorResponseContentType)
                .authenticationFunction(authenticationFunction)
                .build();
    }
}

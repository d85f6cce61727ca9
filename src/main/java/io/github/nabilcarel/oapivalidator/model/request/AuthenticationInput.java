package io.github.nabilcarel.oapivalidator.model.request;

import io.swagger.v3.oas.models.security.SecurityScheme;
import java.util.List;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class AuthenticationInput {
    private final RequestValidationInput validationInput;
    private final String securitySchemeName;
    private final SecurityScheme securityScheme;
    private final List<String> scopes;
}

package io.github.nabilcarel.oapivalidator.model;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.Operation;
import io.swagger.v3.oas.models.PathItem;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import java.util.List;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class Route {
    private final String path;
    private final PathItem.HttpMethod method;
    private final Operation operation;
    private final OpenAPI spec;

    /**
     * Security requirements that apply to this route. An operation without a {@code security}
     * entry inherits the document's requirements; an explicitly empty list disables security.
     */
    public List<SecurityRequirement> getEffectiveSecurity() {
        if (operation.getSecurity() != null) {
            return operation.getSecurity();
        }
        return spec.getSecurity() != null ? spec.getSecurity() : List.of();
    }

    @Override
    public String toString() {
        return method + " " + path;
    }
}

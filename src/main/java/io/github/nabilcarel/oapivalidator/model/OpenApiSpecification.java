package io.github.nabilcarel.oapivalidator.model;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.PathItem;
import java.util.List;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * A parsed OpenAPI document together with its source text. Loaded once and only read afterwards.
 */
@Getter
@RequiredArgsConstructor
public final class OpenApiSpecification {
    private final OpenAPI openApi;
    private final String content;
    private final String location;

    public String getTitle() {
        return openApi.getInfo() != null ? openApi.getInfo().getTitle() : null;
    }

    public String getVersion() {
        return openApi.getInfo() != null ? openApi.getInfo().getVersion() : null;
    }

    public int getOperationCount() {
        if (openApi.getPaths() == null) {
            return 0;
        }
        return openApi.getPaths().values().stream()
                .map(PathItem::readOperations)
                .mapToInt(List::size)
                .sum();
    }
}

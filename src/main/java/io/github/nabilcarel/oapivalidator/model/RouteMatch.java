package io.github.nabilcarel.oapivalidator.model;

import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class RouteMatch {
    private final Route route;
    private final Map<String, String> pathParams;
}

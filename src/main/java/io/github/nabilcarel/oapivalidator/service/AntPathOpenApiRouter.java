package io.github.nabilcarel.oapivalidator.service;

import io.github.nabilcarel.oapivalidator.exception.RequestConformanceException;
import io.github.nabilcarel.oapivalidator.exception.RouteNotFoundException;
import io.github.nabilcarel.oapivalidator.model.OpenApiSpecification;
import io.github.nabilcarel.oapivalidator.model.Route;
import io.github.nabilcarel.oapivalidator.model.RouteMatch;
import io.github.nabilcarel.oapivalidator.util.RequestPaths;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.PathItem;
import io.swagger.v3.oas.models.servers.Server;
import jakarta.servlet.http.HttpServletRequest;
import java.nio.charset.StandardCharsets;
import java.util.*;
import java.util.stream.Collectors;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.AntPathMatcher;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

/**
 * Matches requests against the path templates of an OpenAPI document, prefixed by the path of
 * each declared server. The most specific template wins when several match.
 */
@Slf4j
public class AntPathOpenApiRouter implements OpenApiRouter {
    private final AntPathMatcher pathMatcher = new AntPathMatcher();
    private final Map<String, RoutePattern> routesByPattern = new LinkedHashMap<>();

    public AntPathOpenApiRouter(OpenApiSpecification specification) {
        OpenAPI openApi = specification.getOpenApi();
        Set<String> basePaths = resolveBasePaths(openApi.getServers());

        if (openApi.getPaths() != null) {
            for (Map.Entry<String, PathItem> entry : openApi.getPaths().entrySet()) {
                String template = entry.getKey();
                Map<PathItem.HttpMethod, Route> routes = new EnumMap<>(PathItem.HttpMethod.class);

                entry.getValue().readOperationsMap().forEach((method, operation) -> {
                    routes.put(method, Route.builder()
                            .path(template)
                            .method(method)
                            .operation(operation)
                            .spec(openApi)
                            .build());
                    log.debug("Registered OpenAPI route: {} {}", method, template);
                });

                for (String basePath : basePaths) {
                    routesByPattern.put(basePath + template, new RoutePattern(template, routes));
                }
            }
        }

        log.info("OpenAPI router initialized with {} path patterns under base paths {}",
                routesByPattern.size(), basePaths);
    }

    @Override
    public RouteMatch findRoute(HttpServletRequest request) {
        String path = RequestPaths.pathWithinApplication(request);
        Optional<PathItem.HttpMethod> method = resolveMethod(request.getMethod());

        List<String> candidates = routesByPattern.keySet().stream()
                .filter(pattern -> pathMatcher.match(pattern, path))
                .sorted(pathMatcher.getPatternComparator(path))
                .collect(Collectors.toList());

        if (candidates.isEmpty()) {
            throw new RouteNotFoundException(RouteNotFoundException.NO_MATCHING_OPERATION);
        }

        for (String pattern : candidates) {
            RoutePattern routePattern = routesByPattern.get(pattern);
            Route route = method.map(routePattern.getRoutes()::get).orElse(null);

            if (route != null) {
                return new RouteMatch(route, extractPathParams(pattern, routePattern.getTemplate(), path));
            }
        }

        throw new RouteNotFoundException(RouteNotFoundException.METHOD_NOT_ALLOWED);
    }

    private Map<String, String> extractPathParams(String pattern, String template, String path) {
        Map<String, String> pathParams = new LinkedHashMap<>();
        // Server URL variables share the pattern; keep only the template's own variables
        pathMatcher.extractUriTemplateVariables(pattern, path).forEach((name, value) -> {
            if (template.contains("{" + name + "}")) {
                pathParams.put(name, decodePathParam(name, value));
            }
        });
        return Collections.unmodifiableMap(pathParams);
    }

    private String decodePathParam(String name, String value) {
        try {
            return UriUtils.decode(value, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw new RequestConformanceException(
                    List.of("path parameter \"" + name + "\" has an invalid percent-encoding: \"" + value + "\""));
        }
    }

    private Optional<PathItem.HttpMethod> resolveMethod(String method) {
        return Arrays.stream(PathItem.HttpMethod.values())
                .filter(candidate -> candidate.name().equalsIgnoreCase(method))
                .findFirst();
    }

    private Set<String> resolveBasePaths(List<Server> servers) {
        Set<String> basePaths = new LinkedHashSet<>();
        if (servers != null) {
            for (Server server : servers) {
                basePaths.add(basePath(server.getUrl()));
            }
        }
        if (basePaths.isEmpty()) {
            basePaths.add("");
        }
        return basePaths;
    }

    private String basePath(String serverUrl) {
        if (serverUrl == null) {
            return "";
        }
        String path = UriComponentsBuilder.fromUriString(serverUrl).build().getPath();
        if (path == null) {
            return "";
        }
        while (path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        return path;
    }

    @Getter
    @AllArgsConstructor
    private static class RoutePattern {
        private final String template;
        private final Map<PathItem.HttpMethod, Route> routes;
    }
}

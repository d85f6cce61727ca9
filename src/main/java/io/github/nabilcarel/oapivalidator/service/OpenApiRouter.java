package io.github.nabilcarel.oapivalidator.service;

import io.github.nabilcarel.oapivalidator.model.RouteMatch;
import jakarta.servlet.http.HttpServletRequest;

public interface OpenApiRouter {

    /**
     * Resolves the request to an operation of the specification.
     *
     * @throws io.github.nabilcarel.oapivalidator.exception.RouteNotFoundException when no path
     *         template matches or the matching path does not declare the request method
     * @throws io.github.nabilcarel.oapivalidator.exception.RequestConformanceException when a path
     *         parameter cannot be decoded
     */
    RouteMatch findRoute(HttpServletRequest request);
}

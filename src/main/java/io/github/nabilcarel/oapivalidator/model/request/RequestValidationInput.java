package io.github.nabilcarel.oapivalidator.model.request;

import io.github.nabilcarel.oapivalidator.model.Route;
import io.github.nabilcarel.oapivalidator.model.ValidationOptions;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;
import org.springframework.util.MultiValueMap;

/**
 * Everything known about one request while it is being validated. Never outlives the request.
 */
@Getter
@Builder
public class RequestValidationInput {
    private final HttpServletRequest request;
    private final String path;
    private final Route route;
    private final Map<String, String> pathParams;
    private final MultiValueMap<String, String> queryParams;
    /** {@code null} when the body was not buffered. */
    private final String body;
    /** {@code true} when the body was left to the container unread, as for multipart requests. */
    private final boolean bodySkipped;
    private final ValidationOptions options;
}

package io.github.nabilcarel.oapivalidator.util;

import io.github.nabilcarel.oapivalidator.exception.RequestConformanceException;
import jakarta.servlet.http.HttpServletRequest;
import java.nio.charset.StandardCharsets;
import java.util.List;
import lombok.experimental.UtilityClass;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.util.StringUtils;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

@UtilityClass
public class RequestPaths {

    /**
     * The undecoded request path without the servlet context path.
     */
    public String pathWithinApplication(HttpServletRequest request) {
        String uri = request.getRequestURI();
        String contextPath = request.getContextPath();
        if (StringUtils.hasLength(contextPath) && uri.startsWith(contextPath)) {
            uri = uri.substring(contextPath.length());
        }
        return uri.isEmpty() ? "/" : uri;
    }

    /**
     * Decoded query string parameters. Form parameters from the body are not included.
     *
     * @throws RequestConformanceException if the query string holds a malformed percent-escape
     */
    public MultiValueMap<String, String> queryParams(HttpServletRequest request) {
        MultiValueMap<String, String> decoded = new LinkedMultiValueMap<>();
        String queryString = request.getQueryString();
        if (!StringUtils.hasLength(queryString)) {
            return decoded;
        }

        UriComponentsBuilder.newInstance().query(queryString).build().getQueryParams()
                .forEach((name, values) -> values.forEach(value -> decoded.add(decode(name), decode(value))));
        return decoded;
    }

    private String decode(String value) {
        if (value == null) {
            return "";
        }
        try {
            return UriUtils.decode(value.replace("+", "%20"), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw new RequestConformanceException(List.of("query string has an invalid percent-encoding: \"" + value + "\""));
        }
    }
}

package io.github.nabilcarel.oapivalidator.service;

import io.github.nabilcarel.oapivalidator.exception.AuthenticationException;
import io.github.nabilcarel.oapivalidator.model.request.AuthenticationInput;
import io.swagger.v3.oas.models.security.SecurityScheme;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Arrays;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.util.StringUtils;

/**
 * Accepts a security scheme when the request carries the credential it describes. The credential
 * itself is not verified.
 */
@Slf4j
public class CredentialPresenceAuthenticationFunction implements AuthenticationFunction {
    private static final String BEARER = "bearer";

    @Override
    public void authenticate(AuthenticationInput input) {
        String schemeName = input.getSecuritySchemeName();
        SecurityScheme scheme = input.getSecurityScheme();

        if (scheme.getType() == null) {
            throw new AuthenticationException(
                    "security scheme \"" + schemeName + "\" does not declare a type", schemeName);
        }

        switch (scheme.getType()) {
            case APIKEY -> requireApiKey(input);
            case HTTP -> requireAuthorization(input, scheme.getScheme());
            case OAUTH2, OPENIDCONNECT -> requireAuthorization(input, BEARER);
            default -> throw new AuthenticationException(
                    "security scheme type \"" + scheme.getType() + "\" of \"" + schemeName + "\" is not supported",
                    schemeName);
        }
    }

    private void requireApiKey(AuthenticationInput input) {
        SecurityScheme scheme = input.getSecurityScheme();
        String schemeName = input.getSecuritySchemeName();
        String keyName = scheme.getName();

        if (scheme.getIn() == null || keyName == null) {
            throw new AuthenticationException(
                    "security scheme \"" + schemeName + "\" does not declare where the api key is sent", schemeName);
        }

        HttpServletRequest request = input.getValidationInput().getRequest();
        String value = switch (scheme.getIn()) {
            case HEADER -> request.getHeader(keyName);
            case QUERY -> input.getValidationInput().getQueryParams().getFirst(keyName);
            case COOKIE -> findCookie(request, keyName);
        };

        if (!StringUtils.hasText(value)) {
            throw new AuthenticationException(
                    "missing api key \"" + keyName + "\" in " + scheme.getIn() + " for security scheme \""
                            + schemeName + "\"",
                    schemeName);
        }
    }

    private void requireAuthorization(AuthenticationInput input, String authScheme) {
        String schemeName = input.getSecuritySchemeName();
        String authorization = input.getValidationInput().getRequest().getHeader(HttpHeaders.AUTHORIZATION);

        if (!StringUtils.hasText(authorization)) {
            throw new AuthenticationException(
                    "missing Authorization header for security scheme \"" + schemeName + "\"", schemeName);
        }

        if (StringUtils.hasText(authScheme)) {
            String prefix = authScheme + " ";
            boolean matches = authorization.regionMatches(true, 0, prefix, 0, prefix.length())
                    && StringUtils.hasText(authorization.substring(prefix.length()));

            if (!matches) {
                log.debug("Authorization header does not use the {} scheme required by {}", authScheme, schemeName);
                throw new AuthenticationException(
                        "Authorization header must use the \"" + StringUtils.capitalize(authScheme)
                                + "\" scheme for security scheme \"" + schemeName + "\"",
                        schemeName);
            }
        }
    }

    private String findCookie(HttpServletRequest request, String name) {
        Cookie[] cookies = request.getCookies();
        if (cookies == null) {
            return null;
        }
        return Arrays.stream(cookies)
                .filter(cookie -> cookie.getName().equals(name))
                .map(Cookie::getValue)
                .findFirst()
                .orElse(null);
    }
}

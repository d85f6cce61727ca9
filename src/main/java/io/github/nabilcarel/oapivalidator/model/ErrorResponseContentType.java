package io.github.nabilcarel.oapivalidator.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Media types a rejected request's body can be serialized as.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorResponseContentType {
    PLAIN("text/plain"),
    JSON("application/json"),
    XML("application/xml");

    private final String mediaType;

    public String headerValue() {
        return mediaType + "; charset=utf-8";
    }
}

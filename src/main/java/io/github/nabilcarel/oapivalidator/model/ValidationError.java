package io.github.nabilcarel.oapivalidator.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;
import org.springframework.http.HttpStatus;

@Getter
@ToString
@RequiredArgsConstructor
public class ValidationError {
    private final ErrorKind kind;
    private final String message;

    public HttpStatus getStatus() {
        return switch (kind) {
            case ROUTE_NOT_FOUND, REQUEST_CONFORMANCE_FAILED -> HttpStatus.BAD_REQUEST;
            case SECURITY_REQUIREMENT_FAILED -> HttpStatus.UNAUTHORIZED;
            case VALIDATION_FAILED -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}

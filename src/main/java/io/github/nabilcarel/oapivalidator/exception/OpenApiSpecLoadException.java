package io.github.nabilcarel.oapivalidator.exception;

import lombok.Getter;

@Getter
public class OpenApiSpecLoadException extends RuntimeException {
    private final String location;

    public OpenApiSpecLoadException(String message, String location) {
        super(message);
        this.location = location;
    }

    public OpenApiSpecLoadException(String message, String location, Throwable cause) {
        super(message, cause);
        this.location = location;
    }
}

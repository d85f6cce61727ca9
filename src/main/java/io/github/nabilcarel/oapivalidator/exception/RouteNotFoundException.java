package io.github.nabilcarel.oapivalidator.exception;

public class RouteNotFoundException extends RuntimeException {
    public static final String NO_MATCHING_OPERATION = "no matching operation was found";
    public static final String METHOD_NOT_ALLOWED = "method not allowed";

    public RouteNotFoundException(String message) {
        super(message);
    }
}

package org.cleanarch.article.api.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Application error carrying the HTTP status, the public message and optional diagnostic details
 * that end up in the error response.
 * <p>
 * The shared constants are immutable and carry no stack trace, so they can be attached or thrown
 * from any request thread. Use {@link #withDetails} or {@link #withCause} for a fresh instance.
 */
@Getter
public class AppError extends RuntimeException {

    public static final AppError BAD_REQUEST = sentinel(HttpStatus.BAD_REQUEST);
    public static final AppError UNAUTHORIZED = sentinel(HttpStatus.UNAUTHORIZED);
    public static final AppError FORBIDDEN = sentinel(HttpStatus.FORBIDDEN);
    public static final AppError NOT_FOUND = sentinel(HttpStatus.NOT_FOUND);
    public static final AppError CONFLICT = sentinel(HttpStatus.CONFLICT);
    public static final AppError INTERNAL_SERVER_ERROR = sentinel(HttpStatus.INTERNAL_SERVER_ERROR);

    private final int code;
    private final String details;

    private AppError(int code, String message, String details, Throwable cause, boolean writableStackTrace) {
        super(requireMessage(message), cause, false, writableStackTrace);
        this.code = requireStatus(code);
        this.details = details;
    }

    /**
     * Error whose details are safe to show to the client, e.g. the offending id.
     */
    public static AppError withDetails(int code, String message, String details) {
        return new AppError(code, message, details, null, true);
    }

    /**
     * Error wrapping an underlying failure. The cause is logged but never exposed in the response.
     */
    public static AppError withCause(int code, String message, Throwable cause) {
        return new AppError(code, message, null, cause, true);
    }

    private static AppError sentinel(HttpStatus status) {
        return new AppError(status.value(), HttpErrorMessages.messageFor(status.value()), null, null, false);
    }

    private static int requireStatus(int code) {
        if (HttpStatus.resolve(code) == null) {
            throw new IllegalArgumentException("Not a valid HTTP status code: " + code);
        }
        return code;
    }

    private static String requireMessage(String message) {
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("AppError message must not be empty");
        }
        return message;
    }
}

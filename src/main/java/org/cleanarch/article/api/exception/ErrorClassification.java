package org.cleanarch.article.api.exception;

import org.cleanarch.article.api.dto.ErrorResponse;

/**
 * Outcome of classifying a failure: what the client sees and how loudly it is logged.
 *
 * @param kind     which classification rule matched
 * @param code     HTTP status of the response
 * @param message  public message
 * @param details  diagnostic detail, {@code null} when none may be shown
 * @param severity log level
 */
public record ErrorClassification(Kind kind, int code, String message, String details, Severity severity) {

    public enum Kind {
        APPLICATION,
        BINDING,
        DOMAIN,
        FRAMEWORK,
        UNCLASSIFIED
    }

    static ErrorClassification of(Kind kind, int code, String message, String details) {
        return new ErrorClassification(kind, code, message, details, Severity.forStatus(code));
    }

    static ErrorClassification unclassified() {
        return new ErrorClassification(Kind.UNCLASSIFIED, 500, HttpErrorMessages.INTERNAL_ERROR, null, Severity.ERROR);
    }

    public ErrorResponse toResponse() {
        return ErrorResponse.builder()
                .code(code)
                .message(message)
                .details(details)
                .build();
    }
}

package org.cleanarch.article.api.exception;

import jakarta.validation.ConstraintViolationException;
import org.cleanarch.article.domain.exception.DomainError;
import org.cleanarch.article.domain.exception.DomainException;
import org.springframework.beans.TypeMismatchException;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.stereotype.Component;
import org.springframework.validation.BindException;
import org.springframework.validation.FieldError;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MissingPathVariableException;
import org.springframework.web.bind.ServletRequestBindingException;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.util.IdentityHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps any failure raised while serving a request to the status, message and details of the
 * error response, plus the severity it is logged with.
 * <p>
 * Rules, first match wins:
 * <ol>
 *   <li>an {@link AppError} anywhere in the cause chain is used verbatim;</li>
 *   <li>request binding and validation failures become 400 with the binder's message as details;</li>
 *   <li>a {@link DomainException} maps its {@link DomainError} to a fixed status and message;</li>
 *   <li>Spring MVC exceptions that carry their own status keep it, with the canonical message;</li>
 *   <li>everything else is a 500 without details.</li>
 * </ol>
 * Internal error text is never copied into the response outside rules 1 and 2.
 */
@Component
public class ErrorClassifier {

    public ErrorClassification classify(Throwable failure) {
        if (failure == null) {
            return ErrorClassification.unclassified();
        }

        AppError appError = findInChain(failure, AppError.class);
        if (appError != null) {
            return ErrorClassification.of(ErrorClassification.Kind.APPLICATION,
                    appError.getCode(), appError.getMessage(), appError.getDetails());
        }

        if (isBindingFailure(failure)) {
            return new ErrorClassification(ErrorClassification.Kind.BINDING, HttpStatus.BAD_REQUEST.value(),
                    HttpErrorMessages.INVALID_REQUEST, bindingDetails(failure), Severity.WARN);
        }

        DomainException domainException = findInChain(failure, DomainException.class);
        if (domainException != null) {
            int status = statusOf(domainException.getError());
            return ErrorClassification.of(ErrorClassification.Kind.DOMAIN,
                    status, HttpErrorMessages.messageFor(status), null);
        }

        if (failure instanceof ErrorResponse frameworkError) {
            int status = frameworkError.getStatusCode().value();
            return ErrorClassification.of(ErrorClassification.Kind.FRAMEWORK,
                    status, HttpErrorMessages.messageFor(status), null);
        }

        return ErrorClassification.unclassified();
    }

    /**
     * HTTP status a handler answers with when the service layer fails with {@code error}.
     */
    public static int statusOf(DomainError error) {
        return switch (error) {
            case NOT_FOUND -> HttpStatus.NOT_FOUND.value();
            case CONFLICT -> HttpStatus.CONFLICT.value();
            case BAD_PARAM_INPUT -> HttpStatus.BAD_REQUEST.value();
            case INTERNAL_SERVER_ERROR -> HttpStatus.INTERNAL_SERVER_ERROR.value();
        };
    }

    static boolean isBindingFailure(Throwable failure) {
        if (failure instanceof MissingPathVariableException) {
            // a route/handler mismatch, not bad client input
            return false;
        }
        return failure instanceof HttpMessageNotReadableException
                || failure instanceof BindException
                || failure instanceof TypeMismatchException
                || failure instanceof ServletRequestBindingException
                || failure instanceof MissingServletRequestPartException
                || failure instanceof HandlerMethodValidationException
                || failure instanceof ConstraintViolationException;
    }

    private static String bindingDetails(Throwable failure) {
        if (failure instanceof BindException bindException) {
            return bindException.getBindingResult().getAllErrors().stream()
                    .map(e -> e instanceof FieldError fieldError
                            ? fieldError.getField() + ": " + fieldError.getDefaultMessage()
                            : e.getDefaultMessage())
                    .collect(Collectors.joining(", "));
        }
        if (failure instanceof ConstraintViolationException violations) {
            return violations.getConstraintViolations().stream()
                    .map(v -> v.getPropertyPath() + ": " + v.getMessage())
                    .sorted()
                    .collect(Collectors.joining(", "));
        }
        return failure.getMessage();
    }

    private static <T extends Throwable> T findInChain(Throwable failure, Class<T> type) {
        Map<Throwable, Boolean> seen = new IdentityHashMap<>();
        Throwable current = failure;
        while (current != null && seen.put(current, Boolean.TRUE) == null) {
            if (type.isInstance(current)) {
                return type.cast(current);
            }
            current = current.getCause();
        }
        return null;
    }
}

package org.cleanarch.article.api.exception;

import jakarta.servlet.ServletRequest;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Request-attribute storage for attached errors and the abort flag.
 * Handlers call {@link #attach} to fail a request without writing the response themselves.
 */
public final class RequestErrors {

    static final String ERRORS_ATTRIBUTE = RequestErrors.class.getName() + ".errors";
    static final String ABORTED_ATTRIBUTE = RequestErrors.class.getName() + ".aborted";

    private RequestErrors() {
    }

    public static void attach(ServletRequest request, Throwable error) {
        if (error == null) {
            throw new IllegalArgumentException("Attached error must not be null");
        }
        errors(request, true).add(error);
    }

    public static Optional<Throwable> last(ServletRequest request) {
        List<Throwable> errors = errors(request, false);
        if (errors == null || errors.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(errors.get(errors.size() - 1));
    }

    public static int count(ServletRequest request) {
        List<Throwable> errors = errors(request, false);
        return errors == null ? 0 : errors.size();
    }

    public static void abort(ServletRequest request) {
        request.setAttribute(ABORTED_ATTRIBUTE, Boolean.TRUE);
    }

    public static boolean isAborted(ServletRequest request) {
        return Boolean.TRUE.equals(request.getAttribute(ABORTED_ATTRIBUTE));
    }

    @SuppressWarnings("unchecked")
    private static List<Throwable> errors(ServletRequest request, boolean create) {
        List<Throwable> errors = (List<Throwable>) request.getAttribute(ERRORS_ATTRIBUTE);
        if (errors == null && create) {
            errors = new ArrayList<>(1);
            request.setAttribute(ERRORS_ATTRIBUTE, errors);
        }
        return errors;
    }
}

package org.cleanarch.article.service;

import org.springframework.web.context.request.RequestAttributes;
import org.springframework.web.context.request.RequestContextHolder;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Reads the deadline the request timeout filter stored on the current request.
 * Outside a request there is no deadline.
 */
public final class RequestDeadline {

    public static final String ATTRIBUTE = RequestDeadline.class.getName();

    private RequestDeadline() {
    }

    public static Optional<Instant> current() {
        RequestAttributes attributes = RequestContextHolder.getRequestAttributes();
        if (attributes == null) {
            return Optional.empty();
        }
        Object deadline = attributes.getAttribute(ATTRIBUTE, RequestAttributes.SCOPE_REQUEST);
        return deadline instanceof Instant instant ? Optional.of(instant) : Optional.empty();
    }

    public static void checkNotExpired(String operation) {
        checkNotExpired(operation, Clock.systemUTC());
    }

    static void checkNotExpired(String operation, Clock clock) {
        Optional<Instant> deadline = current();
        if (deadline.isPresent() && clock.instant().isAfter(deadline.get())) {
            throw new RequestDeadlineExceededException(operation, deadline.get());
        }
    }
}

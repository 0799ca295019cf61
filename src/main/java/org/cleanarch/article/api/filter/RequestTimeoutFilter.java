package org.cleanarch.article.api.filter;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.cleanarch.article.service.RequestDeadline;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Gives every request a deadline of {@code timeout} from arrival. Service operations check it
 * through {@link RequestDeadline} before going to the database.
 */
public class RequestTimeoutFilter extends OncePerRequestFilter {

    private final Duration timeout;
    private final Clock clock;

    public RequestTimeoutFilter(Duration timeout) {
        this(timeout, Clock.systemUTC());
    }

    RequestTimeoutFilter(Duration timeout, Clock clock) {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("Request timeout must be positive: " + timeout);
        }
        this.timeout = timeout;
        this.clock = clock;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        Instant deadline = clock.instant().plus(timeout);
        request.setAttribute(RequestDeadline.ATTRIBUTE, deadline);
        try {
            filterChain.doFilter(request, response);
        } finally {
            request.removeAttribute(RequestDeadline.ATTRIBUTE);
        }
    }
}

package org.cleanarch.article.api.filter;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.cleanarch.article.api.exception.DispatchStage;
import org.cleanarch.article.api.exception.ErrorDispatcher;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Outermost filter. Anything thrown further down the chain, including from the propagation
 * filter itself, is answered with a classified JSON error instead of reaching the container.
 */
@RequiredArgsConstructor
public class ErrorRecoveryFilter extends OncePerRequestFilter {

    private final ErrorDispatcher errorDispatcher;

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        try {
            filterChain.doFilter(request, response);
        } catch (Exception | Error failure) {
            errorDispatcher.dispatch(request, response, unwrap(failure), DispatchStage.RECOVERY);
        }
    }

    private static Throwable unwrap(Throwable failure) {
        Throwable current = failure;
        while (current instanceof ServletException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}

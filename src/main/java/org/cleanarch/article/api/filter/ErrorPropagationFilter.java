package org.cleanarch.article.api.filter;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.cleanarch.article.api.exception.DispatchStage;
import org.cleanarch.article.api.exception.ErrorContext;
import org.cleanarch.article.api.exception.ErrorDispatcher;
import org.cleanarch.article.api.exception.RequestErrors;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Optional;

/**
 * Answers requests whose handler attached an error through {@link RequestErrors#attach} instead
 * of writing a response. Only the last attached error is reported.
 */
@RequiredArgsConstructor
@Slf4j
public class ErrorPropagationFilter extends OncePerRequestFilter {

    private final ErrorDispatcher errorDispatcher;

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        filterChain.doFilter(request, response);

        ErrorContext context = errorDispatcher.contextFor(request, response);
        Optional<Throwable> attached = context.lastAttachedError();
        if (attached.isEmpty()) {
            return;
        }
        int count = context.attachedErrorCount();
        if (count > 1) {
            log.debug("{} errors attached to {} {}, reporting the last one",
                    count, context.method(), context.uri());
        }
        errorDispatcher.dispatch(context, attached.get(), DispatchStage.PROPAGATION);
    }
}

package org.cleanarch.article.api.exception;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Recovery boundary for exceptions thrown by controllers, including Spring MVC's own binding and
 * routing exceptions. Every exception goes through the {@link ErrorDispatcher}, so thrown and
 * attached failures produce the same response shape.
 * <p>
 * A throw always wins over anything a handler attached before it: the dispatcher aborts the
 * request, so the propagation stage finds nothing left to answer.
 */
@RestControllerAdvice
@RequiredArgsConstructor
public class GlobalExceptionHandler {

    private final ErrorDispatcher errorDispatcher;

    @ExceptionHandler(Exception.class)
    public void handleException(Exception ex, HttpServletRequest request, HttpServletResponse response) {
        errorDispatcher.dispatch(request, response, ex, DispatchStage.RECOVERY);
    }
}

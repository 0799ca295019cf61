package org.cleanarch.article.api.exception;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Locale;

/**
 * Turns one request failure into one log record and one JSON error response.
 * Shared by the recovery and propagation stages; holds no per-request state.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ErrorDispatcher {

    public static final String ERRORS_METRIC = "article.http.errors";

    private final ErrorClassifier classifier;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;

    public ErrorContext contextFor(HttpServletRequest request, HttpServletResponse response) {
        return new ServletErrorContext(request, response, objectMapper);
    }

    public boolean dispatch(HttpServletRequest request, HttpServletResponse response,
                            Throwable failure, DispatchStage stage) {
        return dispatch(contextFor(request, response), failure, stage);
    }

    /**
     * Classifies {@code failure}, logs it and writes the error response, unless the request was
     * already answered by an earlier dispatch.
     *
     * @return true if a response was written
     */
    public boolean dispatch(ErrorContext context, Throwable failure, DispatchStage stage) {
        if (context.isAborted()) {
            log.debug("Request {} {} already answered, ignoring {} failure: {}",
                    context.method(), context.uri(), stage, describe(failure));
            return false;
        }
        context.abortChain();

        ErrorClassification classification = classifier.classify(failure);
        record(context, failure, classification, stage);
        countFailure(classification, stage);

        if (context.isCommitted()) {
            log.warn("Response for {} {} already committed, dropping {} error response",
                    context.method(), context.uri(), classification.code());
            return false;
        }
        try {
            context.writeJson(classification.code(), classification.toResponse());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write error response", e);
        }
        return true;
    }

    private void record(ErrorContext context, Throwable failure,
                        ErrorClassification classification, DispatchStage stage) {
        MDC.put("method", context.method());
        MDC.put("uri", context.uri());
        MDC.put("ip", context.clientAddress());
        MDC.put("user_agent", context.userAgent());
        try {
            String label = label(classification);
            if (classification.severity() == Severity.ERROR) {
                log.error("{} [{}]: {} {} -> {} {}", label, stage, context.method(), context.uri(),
                        classification.code(), describe(failure), failure);
            } else {
                log.warn("{} [{}]: {} {} -> {} {}", label, stage, context.method(), context.uri(),
                        classification.code(), describe(failure));
            }
        } finally {
            MDC.remove("method");
            MDC.remove("uri");
            MDC.remove("ip");
            MDC.remove("user_agent");
        }
    }

    private void countFailure(ErrorClassification classification, DispatchStage stage) {
        Counter.builder(ERRORS_METRIC)
                .description("Failed requests answered by the error pipeline")
                .tag("code", String.valueOf(classification.code()))
                .tag("stage", stage.name().toLowerCase(Locale.ROOT))
                .register(meterRegistry)
                .increment();
    }

    private static String label(ErrorClassification classification) {
        switch (classification.kind()) {
            case BINDING:
                return "Binding error";
            case UNCLASSIFIED:
                return "Unknown error";
            default:
                return classification.severity() == Severity.ERROR ? "Server error" : "Client error";
        }
    }

    private static String describe(Throwable failure) {
        if (failure == null) {
            return "null";
        }
        if (failure instanceof AppError && failure.getCause() != null) {
            return failure.getMessage() + " (cause: " + failure.getCause() + ")";
        }
        return failure.toString();
    }
}

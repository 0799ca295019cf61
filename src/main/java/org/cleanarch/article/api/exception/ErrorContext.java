package org.cleanarch.article.api.exception;

import java.io.IOException;
import java.util.Optional;

/**
 * Per-request view the error pipeline needs from the web layer: attached errors, the abort flag,
 * a way to write the JSON body, and the request fields that go into the log record.
 */
public interface ErrorContext {

    /**
     * The most recent failure a handler attached without writing a response.
     */
    Optional<Throwable> lastAttachedError();

    int attachedErrorCount();

    /**
     * Marks the request as answered so no later stage writes another response.
     */
    void abortChain();

    boolean isAborted();

    boolean isCommitted();

    void writeJson(int status, Object body) throws IOException;

    String method();

    String uri();

    String clientAddress();

    String userAgent();
}

package org.cleanarch.article.service;

import lombok.Getter;

import java.time.Instant;

/**
 * Exception thrown when a service operation starts after the request deadline has passed.
 */
@Getter
public class RequestDeadlineExceededException extends RuntimeException {

    private final Instant deadline;

    public RequestDeadlineExceededException(String operation, Instant deadline) {
        super("Request deadline " + deadline + " exceeded before " + operation);
        this.deadline = deadline;
    }
}

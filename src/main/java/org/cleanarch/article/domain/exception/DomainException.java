package org.cleanarch.article.domain.exception;

import lombok.Getter;

/**
 * Exception thrown by the service layer for a {@link DomainError}.
 */
@Getter
public class DomainException extends RuntimeException {

    private final DomainError error;

    public DomainException(DomainError error) {
        super(error.getMessage());
        this.error = error;
    }

    public DomainException(DomainError error, Throwable cause) {
        super(error.getMessage(), cause);
        this.error = error;
    }

    public boolean is(DomainError candidate) {
        return error == candidate;
    }
}

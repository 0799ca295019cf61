package org.cleanarch.article.domain.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Named failure conditions raised by the service layer.
 */
@Getter
@RequiredArgsConstructor
public enum DomainError {
    NOT_FOUND("your requested Item is not found"),
    CONFLICT("your Item already exist"),
    INTERNAL_SERVER_ERROR("internal Server Error"),
    BAD_PARAM_INPUT("given Param is not valid");

    private final String message;
}

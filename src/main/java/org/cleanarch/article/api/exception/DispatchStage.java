package org.cleanarch.article.api.exception;

/**
 * Pipeline stage that observed a failure.
 */
public enum DispatchStage {
    /** A failure was thrown out of the handler chain. */
    RECOVERY,
    /** A handler attached a failure and returned normally. */
    PROPAGATION
}

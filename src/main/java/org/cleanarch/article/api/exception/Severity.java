package org.cleanarch.article.api.exception;

/**
 * Log level used when a classified failure is reported.
 */
public enum Severity {
    WARN,
    ERROR;

    public static Severity forStatus(int code) {
        return code >= 500 ? ERROR : WARN;
    }
}

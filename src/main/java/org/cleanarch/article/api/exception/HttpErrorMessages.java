package org.cleanarch.article.api.exception;

import org.springframework.http.HttpStatus;

import java.util.Map;

/**
 * Canonical public message for each HTTP status the service answers with.
 */
public final class HttpErrorMessages {

    public static final String INVALID_REQUEST = "请求参数错误";
    public static final String INTERNAL_ERROR = "服务器内部错误";
    public static final String UNKNOWN_ERROR = "未知错误";

    private static final Map<Integer, String> MESSAGES = Map.ofEntries(
            Map.entry(HttpStatus.BAD_REQUEST.value(), INVALID_REQUEST),
            Map.entry(HttpStatus.UNAUTHORIZED.value(), "未授权访问"),
            Map.entry(HttpStatus.FORBIDDEN.value(), "禁止访问"),
            Map.entry(HttpStatus.NOT_FOUND.value(), "资源不存在"),
            Map.entry(HttpStatus.METHOD_NOT_ALLOWED.value(), "请求方法不允许"),
            Map.entry(HttpStatus.CONFLICT.value(), "资源冲突"),
            Map.entry(HttpStatus.UNPROCESSABLE_ENTITY.value(), "请求数据格式错误"),
            Map.entry(HttpStatus.TOO_MANY_REQUESTS.value(), "请求过于频繁"),
            Map.entry(HttpStatus.INTERNAL_SERVER_ERROR.value(), INTERNAL_ERROR),
            Map.entry(HttpStatus.BAD_GATEWAY.value(), "网关错误"),
            Map.entry(HttpStatus.SERVICE_UNAVAILABLE.value(), "服务暂不可用"),
            Map.entry(HttpStatus.GATEWAY_TIMEOUT.value(), "网关超时"));

    private HttpErrorMessages() {
    }

    public static String messageFor(int status) {
        return MESSAGES.getOrDefault(status, UNKNOWN_ERROR);
    }
}

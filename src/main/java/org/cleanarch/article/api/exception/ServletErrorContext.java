package org.cleanarch.article.api.exception;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * {@link ErrorContext} over the servlet request/response pair.
 */
public class ServletErrorContext implements ErrorContext {

    private final HttpServletRequest request;
    private final HttpServletResponse response;
    private final ObjectMapper objectMapper;

    public ServletErrorContext(HttpServletRequest request, HttpServletResponse response, ObjectMapper objectMapper) {
        this.request = request;
        this.response = response;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<Throwable> lastAttachedError() {
        return RequestErrors.last(request);
    }

    @Override
    public int attachedErrorCount() {
        return RequestErrors.count(request);
    }

    @Override
    public void abortChain() {
        RequestErrors.abort(request);
    }

    @Override
    public boolean isAborted() {
        return RequestErrors.isAborted(request);
    }

    @Override
    public boolean isCommitted() {
        return response.isCommitted();
    }

    @Override
    public void writeJson(int status, Object body) throws IOException {
        response.resetBuffer();
        response.setStatus(status);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        byte[] json = objectMapper.writeValueAsBytes(body);
        try {
            response.getOutputStream().write(json);
        } catch (IllegalStateException writerInUse) {
            // the handler already took the writer; the container refuses the stream after that
            PrintWriter writer = response.getWriter();
            writer.write(new String(json, StandardCharsets.UTF_8));
            writer.flush();
        }
        response.flushBuffer();
    }

    @Override
    public String method() {
        return request.getMethod();
    }

    @Override
    public String uri() {
        String query = request.getQueryString();
        return query == null ? request.getRequestURI() : request.getRequestURI() + "?" + query;
    }

    @Override
    public String clientAddress() {
        String forwardedFor = request.getHeader("X-Forwarded-For");
        if (forwardedFor != null && !forwardedFor.isBlank()) {
            return forwardedFor.split(",")[0].trim();
        }
        String realIp = request.getHeader("X-Real-IP");
        if (realIp != null && !realIp.isBlank()) {
            return realIp;
        }
        return request.getRemoteAddr();
    }

    @Override
    public String userAgent() {
        return request.getHeader(HttpHeaders.USER_AGENT);
    }
}

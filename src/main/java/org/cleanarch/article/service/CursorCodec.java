package org.cleanarch.article.service;

import org.cleanarch.article.domain.exception.DomainError;
import org.cleanarch.article.domain.exception.DomainException;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Base64;

/**
 * Opaque pagination cursor: base64 of the ISO-8601 instant of the last returned article.
 */
public final class CursorCodec {

    private CursorCodec() {
    }

    public static String encode(OffsetDateTime createdAt) {
        String instant = createdAt.toInstant().toString();
        return Base64.getEncoder().encodeToString(instant.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * @throws DomainException with {@link DomainError#BAD_PARAM_INPUT} if the cursor is not one we issued
     */
    public static OffsetDateTime decode(String cursor) {
        try {
            String instant = new String(Base64.getDecoder().decode(cursor), StandardCharsets.UTF_8);
            return OffsetDateTime.ofInstant(Instant.parse(instant), ZoneOffset.UTC);
        } catch (IllegalArgumentException | DateTimeParseException e) {
            throw new DomainException(DomainError.BAD_PARAM_INPUT, e);
        }
    }
}

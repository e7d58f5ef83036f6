package com.e2eq.odata.etag;

import com.e2eq.odata.spi.RecordFields;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.Date;
import java.util.Map;

/**
 * Computes weak entity tags. In order of preference the tag is derived from the
 * {@code updated_at} timestamp (epoch milliseconds), the {@code _id}, or a hash of the entity
 * serialized with sorted keys.
 */
public class ETagGenerator {

    private final ObjectMapper mapper;

    public ETagGenerator() {
        this(new ObjectMapper());
    }

    public ETagGenerator(ObjectMapper mapper) {
        this.mapper = mapper.copy().configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
    }

    public String compute(Map<String, Object> entity) {
        Object updatedAt = entity.get(RecordFields.UPDATED_AT);
        if (updatedAt != null) {
            Long millis = toEpochMillis(updatedAt);
            return weak(millis != null ? String.valueOf(millis) : hash(String.valueOf(updatedAt)));
        }
        Object id = entity.get(RecordFields.ID);
        if (id != null) {
            return weak(String.valueOf(id));
        }
        return weak(hash(serialize(entity)));
    }

    static String weak(String value) {
        return "W/\"" + value + "\"";
    }

    /**
     * 32-bit rolling hash ({@code h = h * 31 + c}) rendered in base 36.
     */
    static String hash(String content) {
        int h = 0;
        for (int i = 0; i < content.length(); i++) {
            h = 31 * h + content.charAt(i);
        }
        return Long.toString(Math.abs((long) h), 36);
    }

    static Long toEpochMillis(Object value) {
        if (value instanceof Number number) {
            return number.longValue();
        }
        if (value instanceof Date date) {
            return date.getTime();
        }
        if (value instanceof Instant instant) {
            return instant.toEpochMilli();
        }
        if (value instanceof OffsetDateTime odt) {
            return odt.toInstant().toEpochMilli();
        }
        if (value instanceof ZonedDateTime zdt) {
            return zdt.toInstant().toEpochMilli();
        }
        if (value instanceof LocalDate date) {
            return date.atStartOfDay(ZoneOffset.UTC).toInstant().toEpochMilli();
        }
        if (value instanceof String text) {
            return parseTimestamp(text.trim());
        }
        return null;
    }

    private static Long parseTimestamp(String text) {
        try {
            return Instant.parse(text).toEpochMilli();
        } catch (DateTimeParseException ignored) {
            // not an instant, try the next format
        }
        try {
            return OffsetDateTime.parse(text).toInstant().toEpochMilli();
        } catch (DateTimeParseException ignored) {
            // not an offset date-time
        }
        try {
            return LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC).toInstant().toEpochMilli();
        } catch (DateTimeParseException ignored) {
            return null;
        }
    }

    private String serialize(Map<String, Object> entity) {
        try {
            return mapper.writeValueAsString(entity);
        } catch (JsonProcessingException e) {
            return String.valueOf(entity);
        }
    }
}

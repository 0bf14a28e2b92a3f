package com.tio.report.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.postgresql.util.PGobject;

import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * SQL value conversion for report columns (UUID, JSONB, timestamps).
 */
final class ReportSqlUtils {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};
    private static final TypeReference<List<String>> LIST_TYPE = new TypeReference<>() {};

    private ReportSqlUtils() {}

    /**
     * Job ids are UUIDs; anything else maps to a deterministic name-based UUID so lookups stay stable.
     */
    static UUID toUuid(String s) {
        if (s == null || s.isBlank()) return null;
        String t = s.trim();
        try {
            return UUID.fromString(t);
        } catch (IllegalArgumentException notAUuid) {
            return UUID.nameUUIDFromBytes(t.getBytes(StandardCharsets.UTF_8));
        }
    }

    static PGobject toJsonb(String json) throws SQLException {
        PGobject o = new PGobject();
        o.setType("jsonb");
        o.setValue(json);
        return o;
    }

    static String writeJson(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Report body is not serializable", e);
        }
    }

    static Map<String, Object> readReport(String json) {
        if (json == null || json.isBlank()) return Map.of();
        try {
            return MAPPER.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Invalid report JSON", e);
        }
    }

    static List<String> readErrors(String json) {
        if (json == null || json.isBlank()) return List.of();
        try {
            return MAPPER.readValue(json, LIST_TYPE);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Invalid report errors JSON", e);
        }
    }

    static Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }
}

package com.sandkev.ledgersync.normalize;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.math.BigDecimal;

/** Helpers shared by the normalizers. */
final class RawPayloads {

    private RawPayloads() {}

    /** Opaque JSON of the upstream record, kept for audit only. */
    static String toJson(ObjectMapper om, RawRecord raw) {
        try {
            return om.writeValueAsString(raw);
        } catch (JsonProcessingException e) {
            return String.valueOf(raw);
        }
    }

    static BigDecimal abs(BigDecimal x) {
        return x == null ? null : x.abs();
    }

    static boolean blank(String s) {
        return s == null || s.isBlank();
    }

    static String trimToNull(String s) {
        return blank(s) ? null : s.trim();
    }
}

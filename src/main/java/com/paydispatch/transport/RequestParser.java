package com.paydispatch.transport;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

public class RequestParser {

    private RequestParser() {
    }

    public static Map<String, String> parseQueryParams(String query) {
        if (query == null || query.isEmpty()) {
            return Collections.emptyMap();
        }

        Map<String, String> params = new HashMap<>();
        String[] pairs = query.split("&");

        for (String pair : pairs) {
            int idx = pair.indexOf('=');
            if (idx > 0 && idx < pair.length() - 1) {
                params.put(
                        URLDecoder.decode(pair.substring(0, idx), StandardCharsets.UTF_8),
                        URLDecoder.decode(pair.substring(idx + 1), StandardCharsets.UTF_8));
            }
        }

        return params;
    }

    /**
     * Accepts an ISO instant, a local date-time or a bare date, all read as UTC.
     *
     * @return {@code null} for a missing value
     */
    public static Instant parseFlexibleTime(String timeStr) {
        if (timeStr == null || timeStr.isEmpty()) {
            return null;
        }

        try {
            return Instant.parse(timeStr);
        } catch (DateTimeParseException e) {
            try {
                return LocalDateTime.parse(timeStr).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException ex) {
                try {
                    return LocalDate.parse(timeStr).atStartOfDay().toInstant(ZoneOffset.UTC);
                } catch (DateTimeParseException last) {
                    throw new IllegalArgumentException("Invalid ISO UTC date format: " + timeStr);
                }
            }
        }
    }

    public static void validateTimeRange(Instant from, Instant to) {
        if (from != null && to != null && from.isAfter(to)) {
            throw new IllegalArgumentException("'from' must be before or equal to 'to'");
        }
    }
}

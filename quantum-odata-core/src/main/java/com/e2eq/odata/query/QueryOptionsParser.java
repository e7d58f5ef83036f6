package com.e2eq.odata.query;

import com.e2eq.odata.error.ODataErrorCode;
import com.e2eq.odata.error.ODataException;
import org.apache.commons.lang3.StringUtils;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Splits a raw query string into an option map. Pairs are separated by {@code &}; each pair is
 * split on its first {@code =} and both sides are form-decoded ({@code +} becomes a space). A
 * repeated option keeps its last value.
 */
public final class QueryOptionsParser {

    private QueryOptionsParser() {
    }

    public static Map<String, String> parse(String queryString) {
        Map<String, String> options = new LinkedHashMap<>();
        if (StringUtils.isBlank(queryString)) {
            return options;
        }
        String raw = queryString.startsWith("?") ? queryString.substring(1) : queryString;
        for (String pair : raw.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            String key = eq < 0 ? pair : pair.substring(0, eq);
            String value = eq < 0 ? "" : pair.substring(eq + 1);
            options.put(decode(key), decode(value));
        }
        return options;
    }

    static String decode(String value) {
        try {
            return URLDecoder.decode(value, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw new ODataException(ODataErrorCode.INVALID_QUERY,
                    "Malformed percent-encoding in query option '" + value + "'", null, null, e);
        }
    }
}

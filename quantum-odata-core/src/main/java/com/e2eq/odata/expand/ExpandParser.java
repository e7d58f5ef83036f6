package com.e2eq.odata.expand;

import com.e2eq.odata.error.ODataErrorCode;
import com.e2eq.odata.error.ODataException;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses {@code $expand} values. Items are separated by commas outside parentheses and quotes.
 * Nested options are separated by {@code ;} (or {@code &}) at the option list's own level, so
 * a nested {@code $expand=x($select=a;$top=1)} stays intact.
 */
public final class ExpandParser {

    private ExpandParser() {
    }

    public static List<ExpandSpec> parse(String expand) {
        List<ExpandSpec> specs = new ArrayList<>();
        if (StringUtils.isBlank(expand)) {
            return specs;
        }
        for (String item : splitTopLevel(expand, ',')) {
            String clean = item.trim();
            if (clean.isEmpty()) {
                continue;
            }
            specs.add(parseItem(clean));
        }
        return specs;
    }

    private static ExpandSpec parseItem(String item) {
        int open = item.indexOf('(');
        if (open < 0) {
            if (item.indexOf(')') >= 0) {
                throw invalid("Unbalanced parentheses in $expand item '" + item + "'");
            }
            return new ExpandSpec(item);
        }
        String property = item.substring(0, open).trim();
        if (property.isEmpty()) {
            throw invalid("Missing navigation property in $expand item '" + item + "'");
        }
        int close = matchingClose(item, open);
        if (close != item.length() - 1) {
            throw invalid("Unexpected text after nested options in $expand item '" + item + "'");
        }
        return new ExpandSpec(property, parseOptions(item.substring(open + 1, close)));
    }

    /**
     * Parses a nested option list such as {@code $select=name;$top=5}.
     */
    static Map<String, String> parseOptions(String optionString) {
        Map<String, String> options = new LinkedHashMap<>();
        for (String pair : splitTopLevel(optionString, ';', '&')) {
            String clean = pair.trim();
            if (clean.isEmpty()) {
                continue;
            }
            int eq = clean.indexOf('=');
            if (eq <= 0) {
                throw invalid("Invalid nested $expand option '" + clean + "'");
            }
            options.put(clean.substring(0, eq).trim(), clean.substring(eq + 1).trim());
        }
        return options;
    }

    private static int matchingClose(String item, int open) {
        int depth = 0;
        boolean inQuotes = false;
        for (int i = open; i < item.length(); i++) {
            char c = item.charAt(i);
            if (c == '\'') {
                inQuotes = !inQuotes;
            } else if (!inQuotes && c == '(') {
                depth++;
            } else if (!inQuotes && c == ')') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        throw invalid("Unbalanced parentheses in $expand item '" + item + "'");
    }

    static List<String> splitTopLevel(String value, char... separators) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        boolean inQuotes = false;
        int start = 0;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '\'') {
                inQuotes = !inQuotes;
            } else if (inQuotes) {
                continue;
            } else if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth < 0) {
                    throw invalid("Unbalanced parentheses in $expand '" + value + "'");
                }
            } else if (depth == 0 && isSeparator(c, separators)) {
                parts.add(value.substring(start, i));
                start = i + 1;
            }
        }
        if (depth != 0 || inQuotes) {
            throw invalid("Unbalanced parentheses in $expand '" + value + "'");
        }
        parts.add(value.substring(start));
        return parts;
    }

    private static boolean isSeparator(char c, char[] separators) {
        for (char separator : separators) {
            if (c == separator) {
                return true;
            }
        }
        return false;
    }

    private static ODataException invalid(String message) {
        return new ODataException(ODataErrorCode.INVALID_EXPAND, message, "$expand");
    }
}

package com.e2eq.odata.batch;

import org.apache.commons.lang3.StringUtils;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses {@code multipart/mixed} batch bodies into {@link BatchPart}s. CRLF and bare LF line
 * endings are both accepted.
 */
public final class BatchParser {
    private static final Logger LOG = Logger.getLogger(BatchParser.class);

    private static final Pattern BOUNDARY =
            Pattern.compile("boundary\\s*=\\s*(?:\"([^\"]+)\"|([^;\\s]+))", Pattern.CASE_INSENSITIVE);
    private static final Pattern REQUEST_LINE =
            Pattern.compile("^(GET|POST|PATCH|PUT|DELETE)\\s+(\\S+)(?:\\s+HTTP/\\d(?:\\.\\d)?)?\\s*$");
    private static final Pattern LINE_BREAK = Pattern.compile("\r?\n");

    private BatchParser() {
    }

    /**
     * Extracts the {@code boundary} parameter of a multipart content type, quoted or bare.
     */
    public static Optional<String> extractBoundary(String contentType) {
        if (contentType == null) {
            return Optional.empty();
        }
        Matcher m = BOUNDARY.matcher(contentType);
        if (!m.find()) {
            return Optional.empty();
        }
        return Optional.of(m.group(1) != null ? m.group(1) : m.group(2));
    }

    public static List<BatchPart> parse(String body, String boundary) {
        List<BatchPart> parts = new ArrayList<>();
        if (body == null) {
            return parts;
        }
        String[] sections = body.split(Pattern.quote("--" + boundary), -1);
        // sections[0] is the preamble
        for (int i = 1; i < sections.length; i++) {
            String section = sections[i];
            if (section.isBlank() || section.startsWith("--")) {
                continue;
            }
            BatchPart part = parseSection(section, boundary);
            if (part != null) {
                parts.add(part);
            }
        }
        return parts;
    }

    private static BatchPart parseSection(String section, String boundary) {
        List<String> lines = List.of(LINE_BREAK.split(stripLeadingLineBreak(section), -1));

        Map<String, String> partHeaders = new LinkedHashMap<>();
        int index = readHeaders(lines, 0, partHeaders);
        String contentType = headerIgnoreCase(partHeaders, "Content-Type");
        if (contentType != null && contentType.toLowerCase(Locale.ROOT).startsWith("multipart/mixed")) {
            Optional<String> inner = extractBoundary(contentType);
            if (inner.isPresent() && !inner.get().equals(boundary)) {
                return parseChangeset(joinFrom(lines, index), inner.get());
            }
        }

        for (int i = 0; i < lines.size(); i++) {
            Matcher m = REQUEST_LINE.matcher(lines.get(i).trim());
            if (m.matches()) {
                Map<String, String> headers = new LinkedHashMap<>();
                int bodyStart = readHeaders(lines, i + 1, headers);
                String payload = StringUtils.stripEnd(joinFrom(lines, bodyStart), "\r\n");
                return new BatchPart.Request(m.group(1), m.group(2), headers,
                        StringUtils.isBlank(payload) ? null : payload);
            }
        }
        LOG.debugf("Ignoring batch section without a request line: %s", StringUtils.abbreviate(section.trim(), 80));
        return null;
    }

    private static BatchPart.Changeset parseChangeset(String content, String boundary) {
        List<BatchPart.Request> requests = new ArrayList<>();
        for (BatchPart part : parse(content, boundary)) {
            if (part instanceof BatchPart.Request request) {
                requests.add(request);
            } else {
                LOG.warn("Nested changesets are not allowed; ignoring inner changeset");
            }
        }
        return new BatchPart.Changeset(requests);
    }

    /**
     * Reads {@code Name: value} lines from {@code start} up to the first blank line and returns
     * the index of the line after it.
     */
    private static int readHeaders(List<String> lines, int start, Map<String, String> headers) {
        int i = start;
        while (i < lines.size()) {
            String line = lines.get(i);
            if (line.isBlank()) {
                return i + 1;
            }
            int colon = line.indexOf(':');
            if (colon > 0) {
                headers.put(line.substring(0, colon).trim(), line.substring(colon + 1).trim());
            }
            i++;
        }
        return i;
    }

    private static String joinFrom(List<String> lines, int start) {
        if (start >= lines.size()) {
            return "";
        }
        return String.join("\r\n", lines.subList(start, lines.size()));
    }

    private static String stripLeadingLineBreak(String section) {
        if (section.startsWith("\r\n")) {
            return section.substring(2);
        }
        if (section.startsWith("\n")) {
            return section.substring(1);
        }
        return section;
    }

    static String headerIgnoreCase(Map<String, String> headers, String name) {
        for (Map.Entry<String, String> entry : headers.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(name)) {
                return entry.getValue();
            }
        }
        return null;
    }
}

package com.yamltest.service.http;

import com.yamltest.infra.TransportException;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses {@code curl -s -i -w '\n---RESPONSE_END---\n'} output into status,
 * headers and body.
 *
 * Header names are lower-cased. Interim 1xx blocks are skipped. When no
 * status line is present the status defaults to 200.
 */
final class CurlResponseParser {

    static final String END_MARKER = "---RESPONSE_END---";
    private static final Pattern STATUS_LINE = Pattern.compile("^HTTP/[\\d.]+\\s+(\\d+)");

    record Parsed(int statusCode, Map<String, String> headers, String body) {
    }

    private CurlResponseParser() {
    }

    static Parsed parse(String output) {
        String response = output == null ? "" : output.split(Pattern.quote(END_MARKER), -1)[0].trim();
        if (response.isEmpty()) {
            throw new TransportException("No response data found in curl output");
        }
        String[] lines = response.replace("\r", "").split("\n", -1);

        int start = 0;
        int statusCode = 200;
        Map<String, String> headers = new LinkedHashMap<>();
        int bodyStart = lines.length;
        while (true) {
            Matcher m = STATUS_LINE.matcher(lines[start]);
            if (m.find()) {
                statusCode = Integer.parseInt(m.group(1));
            }
            headers.clear();
            bodyStart = lines.length;
            for (int i = start + 1; i < lines.length; i++) {
                String line = lines[i];
                if (line.isBlank()) {
                    bodyStart = i + 1;
                    break;
                }
                int colon = line.indexOf(':');
                if (colon > 0) {
                    headers.put(line.substring(0, colon).trim().toLowerCase(Locale.ROOT), line.substring(colon + 1).trim());
                }
            }
            boolean interim = statusCode >= 100 && statusCode < 200
                && bodyStart < lines.length && lines[bodyStart].startsWith("HTTP/");
            if (!interim) {
                break;
            }
            start = bodyStart;
        }

        String body = bodyStart < lines.length ? String.join("\n", Arrays.copyOfRange(lines, bodyStart, lines.length)) : "";
        return new Parsed(statusCode, headers, body.trim());
    }
}

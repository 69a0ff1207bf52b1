package org.muxhttp.api.impl;

import org.muxhttp.api.interfaces.http.HttpRequest;

import java.nio.charset.StandardCharsets;
import java.util.regex.Pattern;

/**
 * Decodes a request head (request line plus header block) into a {@link MinimalHttpRequest}.
 * <p>
 * A {@code STREAM-ID: <n>} line is accepted either in front of the request line or among
 * the headers. Either way it becomes {@link HttpRequest#streamId()} and is removed from the
 * header block, so nothing downstream ever sees it.
 */
public final class RequestParser {

    public static final String STREAM_ID = "STREAM-ID";

    private static final Pattern NON_NEGATIVE_INT = Pattern.compile("\\d{1,10}");
    private static final Pattern LINE_BREAK = Pattern.compile("\r?\n");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private RequestParser() {}

    public static MinimalHttpRequest parse(byte[] head) throws MalformedRequestException {
        // ISO-8859-1 maps every byte to one char, so nothing in the head is lost
        String[] lines = LINE_BREAK.split(new String(head, StandardCharsets.ISO_8859_1), -1);

        int i = 0;
        while (i < lines.length && lines[i].isEmpty()) i++;
        if (i == lines.length) {
            throw new MalformedRequestException("empty request head");
        }

        Integer streamId = null;
        if (lines[i].regionMatches(true, 0, STREAM_ID + ":", 0, STREAM_ID.length() + 1)) {
            Integer preamble = streamIdValue(lines[i].substring(STREAM_ID.length() + 1));
            if (preamble != null) {
                streamId = preamble;
                i++;
            }
        }
        if (i == lines.length) {
            throw new MalformedRequestException("missing request line");
        }

        String[] tokens = WHITESPACE.split(lines[i].trim());
        if (tokens.length != 3) {
            throw new MalformedRequestException(
                    "request line must have 3 tokens, got " + tokens.length + ": '" + lines[i] + "'");
        }
        i++;

        Headers headers = new Headers();
        for (; i < lines.length; i++) {
            String line = lines[i];
            if (line.isEmpty()) break; // end of header block

            int idx = line.indexOf(':');
            if (idx <= 0) {
                throw new MalformedRequestException("bad header line: '" + line + "'");
            }
            String name = line.substring(0, idx).trim();
            String value = line.substring(idx + 1).trim();
            if (name.isEmpty()) {
                throw new MalformedRequestException("bad header line: '" + line + "'");
            }

            if (STREAM_ID.equalsIgnoreCase(name)) {
                Integer id = streamIdValue(value);
                if (id != null) {
                    streamId = id;
                    continue;
                }
            }
            headers.set(name, value);
        }

        return new MinimalHttpRequest(tokens[0], tokens[1], tokens[2], headers, null, streamId);
    }

    /** Announced body length; 0 if absent or not a non-negative integer. */
    public static int contentLength(HttpRequest req) {
        String v = req.header("Content-Length");
        if (v == null || !NON_NEGATIVE_INT.matcher(v.trim()).matches()) return 0;
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    private static Integer streamIdValue(String raw) {
        String v = raw.trim();
        if (!NON_NEGATIVE_INT.matcher(v).matches()) return null;
        try {
            return Integer.parseInt(v);
        } catch (NumberFormatException e) {
            return null; // wider than int
        }
    }
}

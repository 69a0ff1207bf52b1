package org.muxhttp.framing;

import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Text-headed frame encoding. Header fields are ASCII decimal numbers separated by
 * {@link #DELIMITER}; the payload follows the last delimiter verbatim.
 */
public final class FrameCodec {

    public static final byte DELIMITER = '|';

    // 10 digits covers every int
    private static final int MAX_FIELD_DIGITS = 10;

    private final FrameFormat format;
    private final int maxPayload;

    public FrameCodec(FrameFormat format, int maxPayload) {
        if (maxPayload <= 0) throw new IllegalArgumentException("maxPayload must be positive");
        this.format = format;
        this.maxPayload = maxPayload;
    }

    public byte[] encode(Frame f) {
        StringBuilder head = new StringBuilder(24);
        head.append(f.streamId()).append((char) DELIMITER).append(f.end() ? '1' : '0').append((char) DELIMITER);
        if (format == FrameFormat.LENGTH_PREFIXED) {
            head.append(f.length()).append((char) DELIMITER);
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream(head.length() + f.length());
        out.writeBytes(head.toString().getBytes(StandardCharsets.US_ASCII));
        out.writeBytes(f.payload());
        return out.toByteArray();
    }

    /** Decodes one complete frame held in a buffer of its own. */
    public Frame decode(byte[] bytes) throws FrameFormatException {
        int first = indexOf(bytes, 0);
        int second = first < 0 ? -1 : indexOf(bytes, first + 1);
        if (second < 0) {
            throw new FrameFormatException("frame header needs at least two delimiters");
        }
        int id = parseField(bytes, 0, first, "stream id");
        boolean end = parseFlag(bytes, first + 1, second);

        int payloadStart = second + 1;
        if (format == FrameFormat.LENGTH_PREFIXED) {
            int third = indexOf(bytes, payloadStart);
            if (third < 0) throw new FrameFormatException("missing length field");
            int len = parseField(bytes, payloadStart, third, "length");
            payloadStart = third + 1;
            if (bytes.length - payloadStart != len) {
                throw new FrameFormatException("length " + len + " but " + (bytes.length - payloadStart) + " payload bytes");
            }
        }
        return new Frame(id, end, Arrays.copyOfRange(bytes, payloadStart, bytes.length));
    }

    /**
     * Reads the next frame off a byte stream. Only the length-prefixed format can be
     * read this way.
     *
     * @return the frame, or null on a clean end of stream between frames
     */
    public Frame read(InputStream in) throws IOException {
        if (format != FrameFormat.LENGTH_PREFIXED) {
            throw new UnsupportedOperationException(format + " frames are not self-delimiting");
        }
        int b = in.read();
        if (b < 0) return null;

        int id = readField(in, b, "stream id");
        boolean end = readFlag(in);
        int len = readField(in, in.read(), "length");
        if (len > maxPayload) {
            throw new FrameFormatException("payload length " + len + " exceeds " + maxPayload);
        }
        byte[] payload = in.readNBytes(len);
        if (payload.length < len) {
            throw new EOFException("stream ended inside a frame payload");
        }
        return new Frame(id, end, payload);
    }

    private static int indexOf(byte[] bytes, int from) {
        for (int i = from; i < bytes.length; i++) {
            if (bytes[i] == DELIMITER) return i;
        }
        return -1;
    }

    private static int parseField(byte[] bytes, int from, int to, String what) throws FrameFormatException {
        if (to <= from || to - from > MAX_FIELD_DIGITS) {
            throw new FrameFormatException("bad " + what + " field");
        }
        long v = 0;
        for (int i = from; i < to; i++) {
            int d = bytes[i] - '0';
            if (d < 0 || d > 9) throw new FrameFormatException("non-digit in " + what + " field");
            v = v * 10 + d;
        }
        if (v > Integer.MAX_VALUE) throw new FrameFormatException(what + " out of range");
        return (int) v;
    }

    private static boolean parseFlag(byte[] bytes, int from, int to) throws FrameFormatException {
        if (to - from == 1) {
            if (bytes[from] == '1') return true;
            if (bytes[from] == '0') return false;
        }
        throw new FrameFormatException("end flag must be 0 or 1");
    }

    private static int readField(InputStream in, int first, String what) throws IOException {
        long v = 0;
        int digits = 0;
        int b = first;
        while (b != DELIMITER) {
            if (b < 0) throw new EOFException("stream ended inside a frame header");
            int d = b - '0';
            if (d < 0 || d > 9 || ++digits > MAX_FIELD_DIGITS) {
                throw new FrameFormatException("bad " + what + " field");
            }
            v = v * 10 + d;
            b = in.read();
        }
        if (digits == 0 || v > Integer.MAX_VALUE) throw new FrameFormatException("bad " + what + " field");
        return (int) v;
    }

    private static boolean readFlag(InputStream in) throws IOException {
        int flag = in.read();
        int delim = in.read();
        if (flag < 0 || delim < 0) throw new EOFException("stream ended inside a frame header");
        if (delim != DELIMITER || (flag != '0' && flag != '1')) {
            throw new FrameFormatException("end flag must be 0 or 1");
        }
        return flag == '1';
    }
}

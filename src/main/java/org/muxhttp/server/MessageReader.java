package org.muxhttp.server;

import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;

/** Pulls request heads and bodies off a connection's input. */
final class MessageReader {

    private MessageReader() {}

    /**
     * Reads one request head, up to and including the blank line. Empty lines before
     * the head are skipped.
     *
     * @return the head bytes, or null if the peer closed cleanly between messages
     * @throws EOFException if the stream ends inside a head
     * @throws IOException if the head is longer than {@code maxBytes}; the stream can
     *                     no longer be split into messages after that
     */
    static byte[] readHead(InputStream in, int maxBytes) throws IOException {
        ByteArrayOutputStream head = new ByteArrayOutputStream(256);
        boolean started = false;
        int lineLength = 0;
        int b;
        while ((b = in.read()) != -1) {
            if (!started) {
                if (b == '\r' || b == '\n') continue;
                started = true;
            }
            head.write(b);
            if (head.size() > maxBytes) {
                throw new IOException("request head exceeds " + maxBytes + " bytes");
            }
            if (b == '\n') {
                if (lineLength == 0) return head.toByteArray();
                lineLength = 0;
            } else if (b != '\r') {
                lineLength++;
            }
        }
        if (!started) return null;
        throw new EOFException("connection closed inside a request head");
    }

    static byte[] readBody(InputStream in, int length) throws IOException {
        byte[] body = in.readNBytes(length);
        if (body.length < length) {
            throw new EOFException("connection closed after " + body.length + " of " + length + " body bytes");
        }
        return body;
    }
}

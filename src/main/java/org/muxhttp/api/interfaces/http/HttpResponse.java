package org.muxhttp.api.interfaces.http;

import java.io.InputStream;

/** Minimal response contract */
public interface HttpResponse {
    void status(int code, String reason);
    void header(String name, String value);
    void body(String text);
    void body(byte[] bytes);

    /**
     * Hands over an already serialised response (status line included) to be copied
     * to the client as-is. The transmitter closes the stream when done.
     */
    void passthrough(InputStream raw);
}

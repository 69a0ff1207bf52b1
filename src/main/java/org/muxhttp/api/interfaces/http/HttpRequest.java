package org.muxhttp.api.interfaces.http;

import java.util.Map;
import java.util.OptionalInt;

/** Minimal request contract */
public interface HttpRequest {
    String method();
    String path();
    String version();

    /** Case-insensitive lookup; null when absent. */
    String header(String name);

    /** Headers with their original spelling, in arrival order. STREAM-ID is never included. */
    Map<String, String> headers();

    byte[] body();

    /** Present only for multiplexed messages. */
    OptionalInt streamId();
}

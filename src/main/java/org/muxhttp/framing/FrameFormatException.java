package org.muxhttp.framing;

import java.io.IOException;

/** Bytes on the wire do not form a valid frame. */
public class FrameFormatException extends IOException {
    public FrameFormatException(String message) {
        super(message);
    }
}

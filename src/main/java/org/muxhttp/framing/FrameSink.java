package org.muxhttp.framing;

import java.io.IOException;

/** Destination that writes each frame as one indivisible unit. */
@FunctionalInterface
public interface FrameSink {
    void write(Frame frame) throws IOException;
}

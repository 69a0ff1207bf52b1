package org.muxhttp.framing;

import java.io.IOException;
import java.io.OutputStream;
import java.util.Arrays;

/**
 * Frames an outgoing byte stream of unknown length. A full chunk is only emitted once
 * at least one more byte has arrived, so {@link #close()} can mark the last frame as
 * the end of the stream. An empty stream still produces one empty end frame.
 */
public final class FrameOutputStream extends OutputStream {

    private final FrameSink sink;
    private final int streamId;
    private final byte[] buf;
    private int count;
    private boolean closed;

    public FrameOutputStream(FrameSink sink, int streamId, int maxPayload) {
        if (maxPayload <= 0) throw new IllegalArgumentException("maxPayload must be positive");
        this.sink = sink;
        this.streamId = streamId;
        this.buf = new byte[maxPayload];
    }

    @Override
    public void write(int b) throws IOException {
        write(new byte[]{(byte) b}, 0, 1);
    }

    @Override
    public void write(byte[] b, int off, int len) throws IOException {
        if (closed) throw new IOException("stream " + streamId + " already ended");
        while (len > 0) {
            if (count == buf.length) {
                sink.write(new Frame(streamId, false, buf));
                count = 0;
            }
            int n = Math.min(len, buf.length - count);
            System.arraycopy(b, off, buf, count, n);
            count += n;
            off += n;
            len -= n;
        }
    }

    /** Emits the held-back chunk as the end frame. */
    @Override
    public void close() throws IOException {
        if (closed) return;
        closed = true;
        sink.write(new Frame(streamId, true, Arrays.copyOf(buf, count)));
    }
}

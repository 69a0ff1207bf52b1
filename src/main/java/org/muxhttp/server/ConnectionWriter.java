package org.muxhttp.server;

import org.muxhttp.framing.Frame;
import org.muxhttp.framing.FrameCodec;
import org.muxhttp.framing.FrameSink;

import java.io.IOException;
import java.io.OutputStream;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The only path to a connection's output. Each call holds the connection's write lock
 * for exactly one unit: one encoded frame, or one complete non-framed response.
 * Units from different workers therefore never mix on the wire, while frames of
 * different streams may alternate between calls.
 */
public final class ConnectionWriter implements FrameSink {

    private final OutputStream out;
    private final FrameCodec codec;
    private final ReentrantLock lock;
    private volatile boolean broken;

    public ConnectionWriter(OutputStream out, FrameCodec codec, ReentrantLock lock) {
        this.out = out;
        this.codec = codec;
        this.lock = lock;
    }

    @Override
    public void write(Frame frame) throws IOException {
        byte[] bytes = codec.encode(frame); // encode outside the lock
        writeWhole(bytes);
    }

    public void writeWhole(byte[] message) throws IOException {
        lock.lock();
        try {
            out.write(message);
            out.flush();
        } catch (IOException e) {
            broken = true;
            throw e;
        } finally {
            lock.unlock();
        }
    }

    /** True once a write to the transport has failed; the connection is unusable. */
    public boolean isBroken() {
        return broken;
    }
}

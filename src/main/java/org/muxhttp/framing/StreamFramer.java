package org.muxhttp.framing;

import java.util.Arrays;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Splits a payload into frames of at most {@code maxPayload} bytes, in order.
 * Every frame but the last has the end flag clear; the last one (also for an empty
 * payload, which yields a single empty frame) has it set.
 */
public final class StreamFramer {

    public static final int DEFAULT_MAX_PAYLOAD = 1024;

    private final int maxPayload;

    public StreamFramer() {
        this(DEFAULT_MAX_PAYLOAD);
    }

    public StreamFramer(int maxPayload) {
        if (maxPayload <= 0) throw new IllegalArgumentException("maxPayload must be positive");
        this.maxPayload = maxPayload;
    }

    public int maxPayload() { return maxPayload; }

    /**
     * Frames are cut lazily as the sequence is walked. Like a directory stream, the
     * returned sequence can be iterated only once. The payload is copied on entry, so
     * later changes to the caller's array do not reach the frames.
     */
    public Iterable<Frame> frame(int streamId, byte[] payload) {
        if (streamId < 0) throw new IllegalArgumentException("negative stream id " + streamId);
        byte[] data = payload == null ? new byte[0] : payload.clone();
        return new Iterable<>() {
            private boolean used;

            @Override
            public Iterator<Frame> iterator() {
                if (used) throw new IllegalStateException("frame sequence already consumed");
                used = true;
                return new Chunks(streamId, data, maxPayload);
            }
        };
    }

    private static final class Chunks implements Iterator<Frame> {
        private final int streamId;
        private final byte[] data;
        private final int max;
        private int offset;
        private boolean done;

        Chunks(int streamId, byte[] data, int max) {
            this.streamId = streamId;
            this.data = data;
            this.max = max;
        }

        @Override
        public boolean hasNext() {
            return !done;
        }

        @Override
        public Frame next() {
            if (done) throw new NoSuchElementException();
            int to = Math.min(offset + max, data.length);
            boolean last = to == data.length;
            Frame f = new Frame(streamId, last, Arrays.copyOfRange(data, offset, to));
            offset = to;
            done = last;
            return f;
        }
    }
}

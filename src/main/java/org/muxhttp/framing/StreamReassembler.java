package org.muxhttp.framing;

import java.io.ByteArrayOutputStream;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Receiver side of multiplexing: rebuilds each stream from frames arriving in any
 * interleaving. Not thread-safe; feed it from the single thread reading the connection.
 */
public final class StreamReassembler {

    private final Map<Integer, ByteArrayOutputStream> open = new HashMap<>();
    private final Map<Integer, byte[]> completed = new LinkedHashMap<>();

    /**
     * @return true if this frame completed its stream
     * @throws IllegalStateException for a frame on a stream that already ended
     */
    public boolean accept(Frame f) {
        if (completed.containsKey(f.streamId())) {
            throw new IllegalStateException("frame after end of stream " + f.streamId());
        }
        ByteArrayOutputStream acc = open.computeIfAbsent(f.streamId(), k -> new ByteArrayOutputStream());
        acc.writeBytes(f.payload());
        if (f.end()) {
            open.remove(f.streamId());
            completed.put(f.streamId(), acc.toByteArray());
            return true;
        }
        return false;
    }

    public boolean isComplete(int streamId) {
        return completed.containsKey(streamId);
    }

    /** @return the full payload of a completed stream, or null if it has not ended yet */
    public byte[] payload(int streamId) {
        byte[] p = completed.get(streamId);
        return p == null ? null : p.clone();
    }

    /** Completed streams in completion order. */
    public Map<Integer, byte[]> completed() {
        return Collections.unmodifiableMap(completed);
    }

    public int pendingCount() {
        return open.size();
    }
}

package org.muxhttp.framing;

import java.util.Arrays;

/** One bounded slice of a stream's response, tagged with its stream id and the final-slice flag. */
public final class Frame {
    private final int streamId;
    private final boolean end;
    private final byte[] payload;

    public Frame(int streamId, boolean end, byte[] payload) {
        if (streamId < 0) throw new IllegalArgumentException("negative stream id " + streamId);
        this.streamId = streamId;
        this.end = end;
        this.payload = payload == null ? new byte[0] : payload.clone();
    }

    public int streamId() { return streamId; }
    public boolean end() { return end; }
    public byte[] payload() { return payload.clone(); }
    public int length() { return payload.length; }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Frame)) {
            return false;
        }
        Frame that = (Frame) o;
        return streamId == that.streamId && end == that.end && Arrays.equals(payload, that.payload);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * streamId + (end ? 1 : 0)) + Arrays.hashCode(payload);
    }

    @Override
    public String toString() {
        return "Frame{stream=" + streamId + ", end=" + end + ", length=" + payload.length + '}';
    }
}

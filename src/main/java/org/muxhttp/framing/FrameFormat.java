package org.muxhttp.framing;

public enum FrameFormat {
    /**
     * {@code <stream_id>|<end_flag>|<payload>}. Frame boundaries must be known out of band;
     * a payload containing '|' is still decoded correctly from a standalone buffer.
     */
    DELIMITED,

    /** {@code <stream_id>|<end_flag>|<length>|<payload>}; self-delimiting on a byte stream. */
    LENGTH_PREFIXED
}

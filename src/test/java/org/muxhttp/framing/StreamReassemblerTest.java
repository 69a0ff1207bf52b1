package org.muxhttp.framing;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StreamReassemblerTest {

    private static Frame f(int id, boolean end, String payload) {
        return new Frame(id, end, payload.getBytes(StandardCharsets.UTF_8));
    }

    private static String text(byte[] b) {
        return new String(b, StandardCharsets.UTF_8);
    }

    @Test
    void interleavedStreamsAreRebuiltIndependently() {
        StreamReassembler r = new StreamReassembler();

        assertFalse(r.accept(f(1, false, "Hel")));
        assertFalse(r.accept(f(2, false, "Wor")));
        assertFalse(r.accept(f(1, false, "lo")));
        assertEquals(2, r.pendingCount());
        assertTrue(r.accept(f(2, true, "ld")));
        assertTrue(r.accept(f(1, true, "")));

        assertEquals("Hello", text(r.payload(1)));
        assertEquals("World", text(r.payload(2)));
        assertEquals(0, r.pendingCount());
        assertEquals(List.of(2, 1), List.copyOf(r.completed().keySet()));
    }

    @Test
    void unfinishedStreamHasNoPayload() {
        StreamReassembler r = new StreamReassembler();
        r.accept(f(3, false, "part"));

        assertFalse(r.isComplete(3));
        assertNull(r.payload(3));
        assertNull(r.payload(99));
    }

    @Test
    void frameAfterEndIsRejected() {
        StreamReassembler r = new StreamReassembler();
        r.accept(f(1, true, "done"));

        assertThrows(IllegalStateException.class, () -> r.accept(f(1, false, "more")));
        assertEquals("done", text(r.payload(1)));
    }

    @Test
    void singleEmptyEndFrameCompletesAnEmptyStream() {
        StreamReassembler r = new StreamReassembler();
        assertTrue(r.accept(f(0, true, "")));
        assertEquals(0, r.payload(0).length);
    }

    @Test
    void framerOutputRoundTripsThroughReassembler() {
        byte[] payload = new byte[3000];
        for (int i = 0; i < payload.length; i++) payload[i] = (byte) (i * 7);
        StreamReassembler r = new StreamReassembler();

        for (Frame frame : new StreamFramer(1024).frame(5, payload)) {
            r.accept(frame);
        }
        assertArrayEquals(payload, r.payload(5));
    }
}

package org.muxhttp.framing;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FrameOutputStreamTest {

    private final List<Frame> sent = new ArrayList<>();

    @Test
    void holdsBackLastChunkUntilClose() throws IOException {
        FrameOutputStream out = new FrameOutputStream(sent::add, 5, 4);
        out.write(new byte[]{1, 2, 3, 4});
        assertTrue(sent.isEmpty());

        out.write(5);
        assertEquals(List.of(new Frame(5, false, new byte[]{1, 2, 3, 4})), sent);

        out.close();
        assertEquals(new Frame(5, true, new byte[]{5}), sent.get(1));
    }

    @Test
    void fullChunkAtCloseBecomesTheEndFrame() throws IOException {
        try (FrameOutputStream out = new FrameOutputStream(sent::add, 1, 3)) {
            out.write(new byte[]{1, 2, 3, 4, 5, 6});
        }
        assertEquals(List.of(
                new Frame(1, false, new byte[]{1, 2, 3}),
                new Frame(1, true, new byte[]{4, 5, 6})), sent);
    }

    @Test
    void emptyStreamSendsEmptyEndFrame() throws IOException {
        new FrameOutputStream(sent::add, 2, 8).close();
        assertEquals(List.of(new Frame(2, true, new byte[0])), sent);
    }

    @Test
    void closeIsIdempotentAndWritesAfterCloseFail() throws IOException {
        FrameOutputStream out = new FrameOutputStream(sent::add, 2, 8);
        out.close();
        out.close();

        assertEquals(1, sent.size());
        assertThrows(IOException.class, () -> out.write(1));
    }

    @Test
    void sinkFailurePropagates() {
        FrameOutputStream out = new FrameOutputStream(f -> {
            throw new IOException("peer gone");
        }, 1, 2);
        IOException e = assertThrows(IOException.class, () -> out.write(new byte[]{1, 2, 3}));
        assertEquals("peer gone", e.getMessage());
    }
}

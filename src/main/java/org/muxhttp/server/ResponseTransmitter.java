package org.muxhttp.server;

import org.muxhttp.api.impl.HttpResponseImpl;
import org.muxhttp.api.impl.HttpResponseWriter;
import org.muxhttp.framing.Frame;
import org.muxhttp.framing.FrameOutputStream;
import org.muxhttp.framing.StreamFramer;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.util.OptionalInt;
import java.util.logging.Logger;

/**
 * Puts one finished response on a connection, framed when the request carried a
 * stream id and as a plain HTTP message otherwise. The whole serialised message
 * (status line and headers included) is what gets framed.
 * <p>
 * A relayed plain response is read to the end before the write lock is taken, so a
 * slow origin never blocks other streams on the connection. If that read fails,
 * nothing has reached the client yet and a 500 is sent in its place.
 */
public final class ResponseTransmitter {

    private static final Logger LOGGER = Logger.getLogger(ResponseTransmitter.class.getName());

    private final ConnectionWriter writer;
    private final StreamFramer framer;
    private final String serverName;
    private final int copyBufferSize;
    private final Clock clock;

    public ResponseTransmitter(ConnectionWriter writer, StreamFramer framer, String serverName,
                               int copyBufferSize, Clock clock) {
        this.writer = writer;
        this.framer = framer;
        this.serverName = serverName;
        this.copyBufferSize = copyBufferSize;
        this.clock = clock;
    }

    public void transmit(HttpResponseImpl res, OptionalInt streamId) throws IOException {
        InputStream raw = res.passthrough();
        if (raw != null) {
            if (streamId.isPresent()) {
                copyFramed(raw, streamId.getAsInt());
            } else {
                relayWhole(raw);
            }
            return;
        }
        send(res, streamId);
    }

    private void send(HttpResponseImpl res, OptionalInt streamId) throws IOException {
        byte[] message = HttpResponseWriter.serialize(res, serverName, clock.instant());
        if (streamId.isPresent()) {
            for (Frame f : framer.frame(streamId.getAsInt(), message)) {
                writer.write(f); // lock taken per frame
            }
        } else {
            writer.writeWhole(message);
        }
    }

    private void relayWhole(InputStream raw) throws IOException {
        byte[] relayed;
        try (InputStream in = raw) {
            relayed = in.readAllBytes();
        } catch (IOException e) {
            LOGGER.warning("relayed response failed before any byte was sent: " + e.getMessage());
            send(HttpResponseImpl.internalError(e), OptionalInt.empty());
            return;
        }
        writer.writeWhole(relayed);
    }

    private void copyFramed(InputStream raw, int streamId) throws IOException {
        byte[] buf = new byte[copyBufferSize];
        try (InputStream in = raw;
             FrameOutputStream out = new FrameOutputStream(writer, streamId, framer.maxPayload())) {
            int n;
            while ((n = in.read(buf)) >= 0) {
                out.write(buf, 0, n);
            }
        }
    }
}

package org.muxhttp.server;

import org.muxhttp.api.impl.HttpResponseImpl;
import org.muxhttp.api.impl.MalformedRequestException;
import org.muxhttp.api.impl.MinimalHttpRequest;
import org.muxhttp.api.impl.RequestParser;
import org.muxhttp.api.interfaces.IHttpHandler;
import org.muxhttp.framing.FrameCodec;
import org.muxhttp.framing.StreamFramer;
import org.muxhttp.infrastructure.config.ServerConfig;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.Socket;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.time.Clock;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Owns one accepted connection.
 * <p>
 * The reading thread splits the input into requests and hands each one to its own
 * worker, so a slow response never holds up the ones behind it. Workers write back
 * through the connection's {@link ConnectionWriter}. When the input ends (EOF, reset,
 * read timeout, oversize head) the connection goes CLOSING, waits for its workers,
 * then closes the socket and goes CLOSED.
 */
public final class ConnectionHandler implements Runnable {

    private static final Logger LOGGER = Logger.getLogger(ConnectionHandler.class.getName());

    private final Socket socket;
    private final IHttpHandler handler;
    private final ServerConfig config;
    private final Executor workers;
    private final ConnectionState state = new ConnectionState();
    private final String name;

    public ConnectionHandler(Socket socket, IHttpHandler handler, ServerConfig config, Executor workers) {
        this.socket = socket;
        this.handler = handler;
        this.config = config;
        this.workers = workers;
        this.name = "[Conn " + socket.getRemoteSocketAddress() + "]";
    }

    public ConnectionState state() {
        return state;
    }

    @Override
    public void run() {
        LOGGER.fine(name + " open");
        try {
            socket.setSoTimeout(config.readTimeoutMs);
            InputStream in = new BufferedInputStream(socket.getInputStream());
            ConnectionWriter writer = new ConnectionWriter(
                    new BufferedOutputStream(socket.getOutputStream()),
                    new FrameCodec(config.frameFormat, config.maxFramePayload),
                    state.writeLock());
            ResponseTransmitter transmitter = new ResponseTransmitter(
                    writer, new StreamFramer(config.maxFramePayload), config.serverName,
                    config.relayBufferSize, Clock.systemUTC());

            readLoop(in, writer, transmitter);
        } catch (SocketTimeoutException e) {
            LOGGER.info(name + " read timeout after " + config.readTimeoutMs + " ms");
        } catch (SocketException e) {
            LOGGER.fine(name + " transport closed: " + e.getMessage());
        } catch (IOException e) {
            LOGGER.warning(name + " input failed: " + e.getMessage());
        } finally {
            state.beginClosing();
            state.awaitIdle();
            try {
                socket.close();
            } catch (IOException e) {
                LOGGER.log(Level.FINE, name + " close failed", e);
            }
            state.markClosed();
            LOGGER.fine(name + " closed");
        }
    }

    /** Closes the socket without waiting for workers; used when the server shuts down. */
    public void abort() {
        state.beginClosing();
        try {
            socket.close();
        } catch (IOException e) {
            LOGGER.log(Level.FINE, name + " abort failed", e);
        }
    }

    private void readLoop(InputStream in, ConnectionWriter writer, ResponseTransmitter transmitter)
            throws IOException {
        while (state.isOpen()) {
            byte[] head = MessageReader.readHead(in, config.maxHeaderBytes);
            if (head == null) return; // peer finished sending

            MinimalHttpRequest req;
            try {
                req = RequestParser.parse(head);
            } catch (MalformedRequestException e) {
                LOGGER.warning(name + " dropped malformed request: " + e.getMessage());
                continue;
            }
            int length = RequestParser.contentLength(req);
            if (length > 0) {
                req = req.withBody(MessageReader.readBody(in, length));
            }
            dispatch(req, writer, transmitter);
        }
    }

    private void dispatch(MinimalHttpRequest req, ConnectionWriter writer, ResponseTransmitter transmitter)
            throws IOException {
        if (!state.workerStarted()) return;
        try {
            workers.execute(() -> {
                try {
                    serve(req, writer, transmitter);
                } finally {
                    state.workerFinished();
                }
            });
        } catch (RejectedExecutionException e) {
            state.workerFinished();
            throw new IOException("server is shutting down", e);
        }
    }

    private void serve(MinimalHttpRequest req, ConnectionWriter writer, ResponseTransmitter transmitter) {
        HttpResponseImpl res = new HttpResponseImpl();
        try {
            handler.handle(req, res);
        } catch (Exception e) {
            LOGGER.log(Level.WARNING, name + " handler failed for " + req, e);
            res = HttpResponseImpl.internalError(e);
        }
        LOGGER.info(name + " " + req + " -> " + (res.passthrough() != null ? "relayed" : res.status()));

        try {
            transmitter.transmit(res, req.streamId());
        } catch (IOException e) {
            if (writer.isBroken()) {
                LOGGER.warning(name + " write failed, closing: " + e.getMessage());
                onTransportFailure();
            } else {
                LOGGER.warning(name + " response for " + req + " abandoned: " + e.getMessage());
            }
        }
    }

    /** Moves to CLOSING and unblocks the reading thread. */
    private void onTransportFailure() {
        state.beginClosing();
        try {
            socket.shutdownInput();
        } catch (IOException e) {
            LOGGER.log(Level.FINE, name + " shutdownInput failed", e);
        }
    }
}

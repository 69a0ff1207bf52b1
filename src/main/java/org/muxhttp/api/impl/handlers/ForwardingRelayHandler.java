package org.muxhttp.api.impl.handlers;

import org.muxhttp.api.impl.HttpRequestWriter;
import org.muxhttp.api.interfaces.IHttpHandler;
import org.muxhttp.api.interfaces.http.HttpRequest;
import org.muxhttp.api.interfaces.http.HttpResponse;
import org.muxhttp.domain.impl.StatusDecisionEngine;
import org.muxhttp.domain.interfaces.IOriginResolver;
import org.muxhttp.domain.model.HttpStatus;
import org.muxhttp.domain.model.Origin;

import java.io.FilterInputStream;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.util.logging.Logger;

/**
 * Proxy side: sends each request to its origin over a fresh connection and relays the
 * origin's bytes back untouched. Status semantics (404, 304, ...) are the origin's;
 * only an unsupported version is answered locally, without contacting the origin.
 */
public class ForwardingRelayHandler implements IHttpHandler {

    private static final Logger LOGGER = Logger.getLogger(ForwardingRelayHandler.class.getName());

    private final IOriginResolver resolver;
    private final int connectTimeoutMs;

    public ForwardingRelayHandler(IOriginResolver resolver, int connectTimeoutMs) {
        this.resolver = resolver;
        this.connectTimeoutMs = connectTimeoutMs;
    }

    @Override
    public void handle(HttpRequest req, HttpResponse res) throws IOException {
        if (!StatusDecisionEngine.SUPPORTED_VERSION.equals(req.version())) {
            HttpStatus s = HttpStatus.HTTP_VERSION_NOT_SUPPORTED;
            res.status(s.code(), s.reason());
            res.header("Content-Type", "text/html");
            res.body(s.defaultBody());
            return;
        }

        Origin origin = resolver.resolve(req);
        Socket upstream = new Socket();
        try {
            upstream.connect(new InetSocketAddress(origin.host(), origin.port()), connectTimeoutMs);
            HttpRequestWriter.send(upstream.getOutputStream(), HttpRequestWriter.serialize(req));
            // the origin sees end of input and closes once it has answered
            upstream.shutdownOutput();
            res.passthrough(new UpstreamStream(upstream));
            LOGGER.fine("[Relay] " + req + " forwarded to " + origin);
        } catch (IOException e) {
            upstream.close();
            throw new IOException("origin " + origin + " unreachable: " + e.getMessage(), e);
        }
    }

    /** Origin response body; closing it closes the upstream connection. */
    private static final class UpstreamStream extends FilterInputStream {
        private final Socket socket;

        UpstreamStream(Socket socket) throws IOException {
            super(socket.getInputStream());
            this.socket = socket;
        }

        @Override
        public void close() throws IOException {
            try {
                super.close();
            } finally {
                socket.close();
            }
        }
    }
}

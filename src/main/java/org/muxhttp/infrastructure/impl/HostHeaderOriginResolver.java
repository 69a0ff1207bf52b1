package org.muxhttp.infrastructure.impl;

import org.muxhttp.api.interfaces.http.HttpRequest;
import org.muxhttp.domain.interfaces.IOriginResolver;
import org.muxhttp.domain.model.Origin;

import java.io.IOException;

/** Takes the origin from the request's Host header ({@code host[:port]}). */
public class HostHeaderOriginResolver implements IOriginResolver {

    private final int defaultPort;

    public HostHeaderOriginResolver(int defaultPort) {
        this.defaultPort = defaultPort;
    }

    @Override
    public Origin resolve(HttpRequest req) throws IOException {
        String host = req.header("Host");
        if (host == null || host.isBlank()) {
            throw new IOException("request has no Host header");
        }
        host = host.trim();

        // [v6]:port
        if (host.startsWith("[")) {
            int close = host.indexOf(']');
            if (close < 0) throw new IOException("bad Host header: " + host);
            String addr = host.substring(1, close);
            String rest = host.substring(close + 1);
            return new Origin(addr, rest.startsWith(":") ? parsePort(rest.substring(1), host) : defaultPort);
        }

        int colon = host.lastIndexOf(':');
        if (colon < 0) return new Origin(host, defaultPort);
        return new Origin(host.substring(0, colon), parsePort(host.substring(colon + 1), host));
    }

    private static int parsePort(String s, String header) throws IOException {
        int p;
        try {
            p = Integer.parseInt(s);
        } catch (NumberFormatException e) {
            throw new IOException("bad port in Host header: " + header, e);
        }
        if (p <= 0 || p > 65535) throw new IOException("port out of range in Host header: " + header);
        return p;
    }
}

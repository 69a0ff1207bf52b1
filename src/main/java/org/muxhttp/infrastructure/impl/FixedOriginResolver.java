package org.muxhttp.infrastructure.impl;

import org.muxhttp.api.interfaces.http.HttpRequest;
import org.muxhttp.domain.interfaces.IOriginResolver;
import org.muxhttp.domain.model.Origin;

/** Sends everything to one configured origin, whatever the Host header says. */
public class FixedOriginResolver implements IOriginResolver {

    private final Origin origin;

    public FixedOriginResolver(String host, int port) {
        this.origin = new Origin(host, port);
    }

    @Override
    public Origin resolve(HttpRequest req) {
        return origin;
    }
}

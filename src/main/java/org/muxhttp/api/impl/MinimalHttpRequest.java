package org.muxhttp.api.impl;

import org.muxhttp.api.interfaces.http.HttpRequest;

import java.util.Map;
import java.util.OptionalInt;

public class MinimalHttpRequest implements HttpRequest {
    private final String method;
    private final String path;
    private final String version;
    private final Map<String, String> headers;
    private final Headers lookup;
    private final byte[] body;
    private final Integer streamId;

    public MinimalHttpRequest(String method, String path, String version,
                              Headers headers, byte[] body, Integer streamId) {
        this.method = method;
        this.path = path;
        this.version = version;
        this.headers = headers.asMap();
        this.lookup = headers;
        this.body = body == null ? new byte[0] : body.clone();
        this.streamId = streamId;
    }

    /** Same message with a different body; used once the reader has consumed Content-Length bytes. */
    public MinimalHttpRequest withBody(byte[] newBody) {
        return new MinimalHttpRequest(method, path, version, lookup, newBody, streamId);
    }

    @Override public String method() { return method; }
    @Override public String path() { return path; }
    @Override public String version() { return version; }

    @Override
    public String header(String name) {
        return lookup.get(name);
    }

    @Override public Map<String, String> headers() { return headers; }

    @Override public byte[] body() { return body.clone(); }

    @Override
    public OptionalInt streamId() {
        return streamId == null ? OptionalInt.empty() : OptionalInt.of(streamId);
    }

    @Override
    public String toString() {
        return method + " " + path + " " + version + (streamId == null ? "" : " [stream " + streamId + "]");
    }
}

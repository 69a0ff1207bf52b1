package org.muxhttp.domain.model;

import java.util.Objects;

/** Address of the origin server a proxied request is forwarded to. */
public final class Origin {
    private final String host;
    private final int port;

    public Origin(String host, int port) {
        this.host = Objects.requireNonNull(host, "host");
        this.port = port;
    }

    public String host() { return host; }
    public int port() { return port; }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Origin)) {
            return false;
        }
        Origin that = (Origin) o;
        return port == that.port && host.equals(that.host);
    }

    @Override
    public int hashCode() {
        return Objects.hash(host, port);
    }

    @Override
    public String toString() {
        return host + ":" + port;
    }
}

package org.muxhttp.api.interfaces;

/*
AutoCloseable lets callers stop the listener and its workers with try-with-resources
 */
public interface IHttpServer extends AutoCloseable {
    /** Binds the listener and starts accepting; port 0 picks an ephemeral port. */
    void start(int port) throws Exception;

    /** The port actually bound, or -1 before {@link #start(int)}. */
    int port();

    @Override void close() throws Exception;
}

package org.muxhttp.api.interfaces;

import org.muxhttp.api.interfaces.http.HttpRequest;
import org.muxhttp.api.interfaces.http.HttpResponse;

/**
 * Produces the response for one parsed request. Called from a worker thread, so
 * implementations must not keep per-request state in fields.
 */
public interface IHttpHandler {
    void handle(HttpRequest req, HttpResponse res) throws Exception;
}

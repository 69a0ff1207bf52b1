package org.muxhttp.api.impl.handlers;

import org.muxhttp.api.interfaces.IHttpHandler;
import org.muxhttp.api.interfaces.http.HttpRequest;
import org.muxhttp.api.interfaces.http.HttpResponse;
import org.muxhttp.domain.impl.StatusDecisionEngine;
import org.muxhttp.domain.interfaces.IResourceStore;
import org.muxhttp.domain.model.HttpStatus;
import org.muxhttp.infrastructure.util.ContentTypes;
import org.muxhttp.infrastructure.util.HttpDates;

import java.io.IOException;

public class StaticFileHandler implements IHttpHandler {
    private final IResourceStore store;
    private final StatusDecisionEngine engine;
    private final ContentTypes contentTypes;

    public StaticFileHandler(IResourceStore store, String defaultFile, ContentTypes contentTypes) {
        this.store = store;
        this.engine = new StatusDecisionEngine(store, defaultFile);
        this.contentTypes = contentTypes;
    }

    @Override
    public void handle(HttpRequest req, HttpResponse res) throws IOException {
        HttpStatus status = engine.decide(req);
        res.status(status.code(), status.reason());

        switch (status) {
            case OK: {
                String name = engine.resourceName(req.path());
                res.header("Last-Modified", HttpDates.format(store.lastModified(name)));
                res.header("Content-Type", contentTypes.forName(name));
                res.body(store.read(name));
                break;
            }
            case NOT_MODIFIED:
                res.header("Last-Modified",
                        HttpDates.format(store.lastModified(engine.resourceName(req.path()))));
                break;
            default:
                res.header("Content-Type", "text/html");
                res.body(status.defaultBody());
        }
    }
}

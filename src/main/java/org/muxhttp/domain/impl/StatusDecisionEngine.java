package org.muxhttp.domain.impl;

import org.muxhttp.api.interfaces.http.HttpRequest;
import org.muxhttp.domain.interfaces.IResourceStore;
import org.muxhttp.domain.model.HttpStatus;
import org.muxhttp.infrastructure.util.HttpDates;

import java.io.IOException;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Chooses the status for a static-file request. Checks run in a fixed order and the
 * first match wins:
 * <ol>
 *   <li>version other than HTTP/1.1: 505, before any resource lookup</li>
 *   <li>restricted name: 403, even if the file exists</li>
 *   <li>no regular file under the root: 404</li>
 *   <li>valid If-Modified-Since not older than the file: 304</li>
 *   <li>otherwise 200</li>
 * </ol>
 * Only reads facts from the store; never touches file contents.
 */
public final class StatusDecisionEngine {

    public static final String SUPPORTED_VERSION = "HTTP/1.1";

    private final IResourceStore store;
    private final String defaultFile;

    public StatusDecisionEngine(IResourceStore store, String defaultFile) {
        this.store = store;
        this.defaultFile = defaultFile;
    }

    public HttpStatus decide(HttpRequest req) throws IOException {
        if (!SUPPORTED_VERSION.equals(req.version())) {
            return HttpStatus.HTTP_VERSION_NOT_SUPPORTED;
        }

        String name = resourceName(req.path());
        if (store.isRestricted(name)) {
            return HttpStatus.FORBIDDEN;
        }
        if (!store.exists(name)) {
            return HttpStatus.NOT_FOUND;
        }

        Instant since = HttpDates.parseOrNull(req.header("If-Modified-Since"));
        if (since != null) {
            // HTTP dates carry whole seconds only
            Instant modified = store.lastModified(name).truncatedTo(ChronoUnit.SECONDS);
            if (!modified.isAfter(since)) {
                return HttpStatus.NOT_MODIFIED;
            }
        }
        return HttpStatus.OK;
    }

    /** Maps a request path to a store name: query dropped, leading slashes stripped, "/" to the default file. */
    public String resourceName(String path) {
        String p = path == null ? "" : path;
        int q = p.indexOf('?');
        if (q >= 0) p = p.substring(0, q);
        int i = 0;
        while (i < p.length() && p.charAt(i) == '/') i++;
        p = p.substring(i);
        return p.isEmpty() ? defaultFile : p;
    }
}

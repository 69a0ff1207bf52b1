package org.muxhttp.domain.interfaces;

import org.muxhttp.api.interfaces.http.HttpRequest;
import org.muxhttp.domain.model.Origin;

import java.io.IOException;

public interface IOriginResolver {
    /** @throws IOException when no origin can be derived for the request */
    Origin resolve(HttpRequest req) throws IOException;
}

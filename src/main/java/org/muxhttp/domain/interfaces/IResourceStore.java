package org.muxhttp.domain.interfaces;

import java.io.IOException;
import java.time.Instant;

/**
 * Read-only view of the served resources. Names are relative to the serving root,
 * without a leading slash (e.g. {@code test.html}).
 */
public interface IResourceStore {
    /** True only for a regular file that resolves under the serving root. */
    boolean exists(String name);

    Instant lastModified(String name) throws IOException;

    byte[] read(String name) throws IOException;

    /** Restricted names are refused whether or not they exist. */
    boolean isRestricted(String name);
}

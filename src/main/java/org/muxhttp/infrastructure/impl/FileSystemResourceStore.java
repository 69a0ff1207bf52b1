package org.muxhttp.infrastructure.impl;

import org.muxhttp.domain.interfaces.IResourceStore;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

/**
 * Serves regular files below a root directory. The restricted set is fixed at construction.
 * <p>
 * Restriction is checked on the normalised root-relative name, the same file that
 * {@link #exists} and {@link #read} would reach, so {@code ./private.html} or
 * {@code sub/../private.html} is as restricted as {@code private.html}.
 */
public class FileSystemResourceStore implements IResourceStore {

    private final Path root;
    private final Set<String> restricted;

    public FileSystemResourceStore(Path root, Collection<String> restricted) {
        this.root = root.toAbsolutePath().normalize();
        Set<String> names = new HashSet<>();
        for (String r : restricted) {
            names.add(canonicalName(r));
        }
        this.restricted = Set.copyOf(names);
    }

    @Override
    public boolean exists(String name) {
        Path p = resolve(name);
        return p != null && Files.isRegularFile(p);
    }

    @Override
    public Instant lastModified(String name) throws IOException {
        return Files.getLastModifiedTime(resolveExisting(name)).toInstant();
    }

    @Override
    public byte[] read(String name) throws IOException {
        return Files.readAllBytes(resolveExisting(name));
    }

    @Override
    public boolean isRestricted(String name) {
        return name != null && restricted.contains(canonicalName(name));
    }

    /** Root-relative, '/'-separated name with dot segments removed; the raw name if it escapes the root. */
    private String canonicalName(String name) {
        Path p = resolve(name);
        if (p == null) return name;
        return root.relativize(p).toString().replace(File.separatorChar, '/');
    }

    private Path resolveExisting(String name) throws IOException {
        Path p = resolve(name);
        if (p == null) throw new NoSuchFileException(name);
        return p;
    }

    /** @return the file for a name, or null if it would land outside the root */
    private Path resolve(String name) {
        if (name == null) return null;
        try {
            Path p = root.resolve(name).normalize();
            return p.startsWith(root) ? p : null;
        } catch (InvalidPathException e) {
            return null;
        }
    }
}

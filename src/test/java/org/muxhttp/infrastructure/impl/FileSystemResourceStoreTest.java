package org.muxhttp.infrastructure.impl;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FileSystemResourceStoreTest {

    @TempDir
    Path root;

    @Test
    void regularFilesExistDirectoriesDoNot() throws IOException {
        Files.writeString(root.resolve("a.html"), "a");
        Files.createDirectory(root.resolve("dir"));
        FileSystemResourceStore store = new FileSystemResourceStore(root, List.of());

        assertTrue(store.exists("a.html"));
        assertFalse(store.exists("dir"));
        assertFalse(store.exists("b.html"));
        assertFalse(store.exists(null));
    }

    @Test
    void readsContentAndModificationTime() throws IOException {
        Path f = Files.write(root.resolve("data.bin"), new byte[]{0, 1, 2, (byte) 0xFF});
        Instant t = Instant.parse("2024-01-02T03:04:05Z");
        Files.setLastModifiedTime(f, FileTime.from(t));
        FileSystemResourceStore store = new FileSystemResourceStore(root, List.of());

        assertArrayEquals(new byte[]{0, 1, 2, (byte) 0xFF}, store.read("data.bin"));
        assertEquals(t, store.lastModified("data.bin"));
    }

    @Test
    void namesEscapingTheRootAreInvisible() throws IOException {
        Path www = Files.createDirectory(root.resolve("www"));
        Files.writeString(root.resolve("outside.html"), "x");
        FileSystemResourceStore store = new FileSystemResourceStore(www, List.of());

        assertFalse(store.exists("../outside.html"));
        assertThrows(IOException.class, () -> store.read("../outside.html"));
        assertThrows(IOException.class, () -> store.lastModified("../outside.html"));
    }

    @Test
    void nestedPathsResolveBelowRoot() throws IOException {
        Files.createDirectories(root.resolve("css"));
        Files.writeString(root.resolve("css/site.css"), "body{}");
        FileSystemResourceStore store = new FileSystemResourceStore(root, List.of());

        assertTrue(store.exists("css/site.css"));
        assertTrue(store.exists("css/../css/site.css"));
    }

    @Test
    void restrictionIsByResolvedName() {
        FileSystemResourceStore store = new FileSystemResourceStore(root, List.of("private.html"));

        assertTrue(store.isRestricted("private.html"));
        assertFalse(store.isRestricted("public.html"));
        assertFalse(store.isRestricted("sub/private.html"));
        assertFalse(store.isRestricted(null));
    }

    @Test
    void dotSegmentSpellingsOfARestrictedNameAreRestricted() {
        FileSystemResourceStore store = new FileSystemResourceStore(root, List.of("private.html", "./docs/internal.txt"));

        assertTrue(store.isRestricted("./private.html"));
        assertTrue(store.isRestricted("sub/../private.html"));
        assertTrue(store.isRestricted("docs/internal.txt"));
        assertTrue(store.isRestricted("docs/x/../internal.txt"));
        assertFalse(store.isRestricted("docs/private.html"));
    }
}

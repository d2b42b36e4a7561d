package com.example.pawluxe_export.engine;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Fresh working directory for one render attempt. {@link #close()} removes the whole tree and throws when
 * anything is left behind.
 */
public class ScratchDirectory implements Closeable {
    private final Path path;

    ScratchDirectory(Path path) {
        this.path = path;
    }

    /**
     * @param parent directory to create the scratch space in; the system temp dir when {@code null}.
     */
    public static ScratchDirectory create(Path parent, String prefix) throws IOException {
        if (parent == null) {
            return new ScratchDirectory(Files.createTempDirectory(prefix));
        }
        Files.createDirectories(parent);
        return new ScratchDirectory(Files.createTempDirectory(parent, prefix));
    }

    public Path path() {
        return path;
    }

    public Path resolve(String name) {
        return path.resolve(name);
    }

    @Override
    public void close() throws IOException {
        if (!Files.exists(path)) {
            return;
        }
        List<Path> entries;
        try (Stream<Path> walk = Files.walk(path)) {
            entries = new ArrayList<>(walk.sorted(Comparator.reverseOrder()).toList());
        }
        IOException failure = null;
        for (Path entry : entries) {
            try {
                Files.deleteIfExists(entry);
            } catch (IOException e) {
                if (failure == null) {
                    failure = new IOException("Scratch directory not fully removed: " + path, e);
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }
}

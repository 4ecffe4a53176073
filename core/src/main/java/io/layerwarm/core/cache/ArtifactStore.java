package io.layerwarm.core.cache;

import io.layerwarm.core.model.ArtifactKind;
import io.layerwarm.core.model.Mode;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Layout of the artifact cache directory: one canonical file per kind and mode, named
 * {@code <kind>.<mode>.json}. The canonical path is the artifact's identity.
 */
public final class ArtifactStore {

    private static final String EXTENSION = ".json";

    private final Path cacheDir;

    public ArtifactStore(Path cacheDir) {
        this.cacheDir = Objects.requireNonNull(cacheDir, "cacheDir must not be null")
                .toAbsolutePath()
                .normalize();
    }

    public Path cacheDir() {
        return cacheDir;
    }

    /** Canonical identity of the artifact for a kind and mode. */
    public Path identity(ArtifactKind kind, Mode mode) {
        return cacheDir.resolve(fileName(kind, mode));
    }

    /** Returns {@code true} if the canonical artifact exists. */
    public boolean exists(ArtifactKind kind, Mode mode) {
        return Files.isRegularFile(identity(kind, mode));
    }

    static String fileName(ArtifactKind kind, Mode mode) {
        return kind.token() + "." + mode.token() + EXTENSION;
    }
}

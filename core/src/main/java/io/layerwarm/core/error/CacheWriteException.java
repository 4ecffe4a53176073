package io.layerwarm.core.error;

import io.layerwarm.core.model.ArtifactKind;
import java.nio.file.Path;

/**
 * Thrown when the write-then-swap of an artifact could not complete. The previous canonical
 * artifact, if any, is unchanged.
 */
public final class CacheWriteException extends CompositionException {

    private static final long serialVersionUID = 1L;

    private final transient Path identity;

    public CacheWriteException(String message, Throwable cause, ArtifactKind kind, Path identity) {
        super(message, cause, kind, Phase.PERSIST);
        this.identity = identity;
    }

    /** Canonical artifact path that was being replaced. */
    public Path identity() {
        return identity;
    }
}

package io.layerwarm.core.error;

import io.layerwarm.core.model.ArtifactKind;
import java.nio.file.Path;

/**
 * Thrown when a canonical artifact exists but cannot be used: unreadable, not valid JSON, written
 * for another kind or mode, or failing its fingerprint check.
 */
public final class ArtifactReadException extends CompositionException {

    private static final long serialVersionUID = 1L;

    private final transient Path identity;

    public ArtifactReadException(String message, ArtifactKind kind, Path identity) {
        super(message, kind, Phase.LOAD);
        this.identity = identity;
    }

    public ArtifactReadException(String message, Throwable cause, ArtifactKind kind, Path identity) {
        super(message, cause, kind, Phase.LOAD);
        this.identity = identity;
    }

    /** Canonical artifact path that was read. */
    public Path identity() {
        return identity;
    }
}

package io.layerwarm.core.error;

import io.layerwarm.core.model.ArtifactKind;
import java.nio.file.Path;

/**
 * Thrown at boot when no canonical artifact exists. There is deliberately no fallback to an
 * empty or baseline-only structure: the artifact has to be warmed first.
 */
public final class ArtifactNotFoundException extends CompositionException {

    private static final long serialVersionUID = 1L;

    private final transient Path identity;

    public ArtifactNotFoundException(String message, ArtifactKind kind, Path identity) {
        super(message, kind, Phase.LOAD);
        this.identity = identity;
    }

    /** Canonical artifact path that was looked up. */
    public Path identity() {
        return identity;
    }
}

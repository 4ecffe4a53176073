package io.layerwarm.core.spi;

import io.layerwarm.core.model.ArtifactKind;
import io.layerwarm.core.model.CacheArtifact;
import io.layerwarm.core.model.Mode;
import io.layerwarm.core.validate.Violation;
import java.util.List;
import java.util.Objects;

/**
 * Observability hooks for the build and warm lifecycle.
 *
 * <p>
 * Implementations bridge to whatever metrics or audit system the host uses; the core has no
 * such dependency. Events are immutable. Implementations must be thread-safe. Exceptions thrown
 * by a listener are caught by the engine and logged; they never change the outcome of a build.
 *
 * <p>
 * All methods have empty defaults so an implementation overrides only what it needs.
 */
public interface CompositionListener {

    /** Listener that ignores every event. */
    CompositionListener NONE = new CompositionListener() {};

    /**
     * Called when an artifact has been composed and validated.
     *
     * @param event kind, mode, layer count, fingerprint
     */
    default void onArtifactBuilt(ArtifactBuiltEvent event) {}

    /**
     * Called after an artifact's atomic swap has committed.
     *
     * @param event the committed artifact
     */
    default void onArtifactWritten(ArtifactWrittenEvent event) {}

    /**
     * Called when a build fails, whether in layer resolution, validation or persistence.
     *
     * @param event kind, mode, error detail and any violations
     */
    default void onBuildRejected(BuildRejectedEvent event) {}

    // --- Event records ---

    /** Emitted when a composition passes validation. */
    record ArtifactBuiltEvent(ArtifactKind kind, Mode mode, int layerCount, String fingerprint) {}

    /** Emitted when an artifact is on disk under its canonical identity. */
    record ArtifactWrittenEvent(CacheArtifact artifact) {

        public ArtifactWrittenEvent {
            Objects.requireNonNull(artifact, "artifact must not be null");
        }
    }

    /** Emitted when a build is aborted. */
    record BuildRejectedEvent(ArtifactKind kind, Mode mode, String errorDetail, List<Violation> violations) {

        public BuildRejectedEvent {
            violations = violations == null ? List.of() : List.copyOf(violations);
        }
    }
}

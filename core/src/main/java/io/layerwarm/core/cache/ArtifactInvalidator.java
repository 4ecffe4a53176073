package io.layerwarm.core.cache;

import java.nio.file.Path;

/**
 * Hook for caches that hold compiled or loaded forms of an artifact, keyed by its canonical
 * identity. Called strictly after the atomic swap has committed, so a cache reloading on
 * invalidation always sees the new content.
 *
 * <p>
 * Implementations must be thread-safe. Exceptions are caught and logged by the writer; they do
 * not undo the swap.
 */
@FunctionalInterface
public interface ArtifactInvalidator {

    /** An invalidator that does nothing. */
    ArtifactInvalidator NONE = identity -> {};

    /**
     * Drops anything cached for the artifact at {@code identity}.
     *
     * @param identity canonical artifact path
     */
    void invalidate(Path identity);
}

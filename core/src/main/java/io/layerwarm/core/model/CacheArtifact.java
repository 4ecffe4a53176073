package io.layerwarm.core.model;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Objects;

/**
 * Durable, directly loadable snapshot of one {@link CompositionResult}.
 *
 * @param kind        artifact kind
 * @param mode        execution mode
 * @param identity    canonical artifact path, also the key used for cache invalidation
 * @param fingerprint SHA-256 of the canonical payload
 * @param writtenAt   when the atomic swap committed
 */
public record CacheArtifact(ArtifactKind kind, Mode mode, Path identity, String fingerprint, Instant writtenAt) {

    public CacheArtifact {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(mode, "mode must not be null");
        Objects.requireNonNull(identity, "identity must not be null");
        Objects.requireNonNull(fingerprint, "fingerprint must not be null");
        Objects.requireNonNull(writtenAt, "writtenAt must not be null");
    }
}

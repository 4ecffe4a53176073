package io.layerwarm.core.layer;

import com.fasterxml.jackson.databind.JsonNode;
import io.layerwarm.core.model.ArtifactKind;
import io.layerwarm.core.model.Mode;
import java.util.Optional;

/**
 * A source of layer payloads. Each source exposes one slot per mode and artifact kind holding
 * pure data.
 *
 * <p>
 * An absent slot means "this layer contributes nothing for this kind" and is not an error.
 * Reading a slot must have no side effects. Implementations report unreadable slots with
 * {@link io.layerwarm.core.error.LayerResolutionException} or
 * {@link java.io.UncheckedIOException}; the {@link LayerSourceReader} adds the layer position.
 */
public interface LayerSource {

    /** Human-readable identity, used in logs and error reports. */
    String id();

    /**
     * Reads the slot for a mode and artifact kind.
     *
     * @param mode execution mode
     * @param kind artifact kind
     * @return the slot payload, or empty if the slot is absent
     */
    Optional<JsonNode> slot(Mode mode, ArtifactKind kind);
}

package io.layerwarm.core.model;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Locale;
import java.util.Objects;

/**
 * One ordered, independently authored payload for a single artifact kind and mode.
 *
 * <p>
 * The payload is copied on construction, so later changes to the caller's tree do not leak
 * into a build. Compositors read the payload and never modify it.
 *
 * @param kind    role of the layer
 * @param order   0-based position in the ordered layer list
 * @param id      human-readable identity of the source (provider name, file path, ...)
 * @param payload the layer's mapping payload
 */
public record Layer(LayerKind kind, int order, String id, ObjectNode payload) {

    public Layer {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(payload, "payload must not be null");
        if (order < 0) {
            throw new IllegalArgumentException("order must not be negative: " + order);
        }
        payload = payload.deepCopy();
    }

    /** Short description used in logs and error reports, e.g. {@code #2 provider 'blog'}. */
    public String describe() {
        return "#" + order + " " + kind.name().toLowerCase(Locale.ROOT) + " '" + id + "'";
    }
}

package io.layerwarm.core.validate;

import io.layerwarm.core.model.ArtifactKind;
import java.io.Serializable;
import java.util.Objects;

/**
 * One structural problem found in a composed artifact.
 *
 * @param kind          artifact kind
 * @param layerPosition position of the layer that supplied the offending value, or null if
 *                      unknown
 * @param layerId       identity of that layer, or null if unknown
 * @param key           offending key, path or identifier, e.g. {@code /blog}, {@code regex[2]},
 *                      {@code mailer.options.hooks}
 * @param detail        what is wrong
 */
public record Violation(ArtifactKind kind, Integer layerPosition, String layerId, String key, String detail)
        implements Serializable {

    private static final long serialVersionUID = 1L;

    public Violation {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(detail, "detail must not be null");
    }

    /** One-line report, e.g. {@code routes [layer #2 'blog'] '/x': missing 'methods'}. */
    public String describe() {
        String layer = layerPosition != null ? "layer #" + layerPosition + " '" + layerId + "'" : "layer unknown";
        return kind + " [" + layer + "] '" + key + "': " + detail;
    }
}

package io.layerwarm.core.error;

import io.layerwarm.core.model.ArtifactKind;

/**
 * Abstract parent for errors tied to one layer of the ordered list. Carries the layer's
 * position and identity so tooling can point at the layer to fix.
 */
public abstract class LayerException extends CompositionException {

    private static final long serialVersionUID = 1L;

    private final Integer layerPosition;
    private final String layerId;

    protected LayerException(String message, ArtifactKind kind, Integer layerPosition, String layerId) {
        super(message, kind, Phase.BUILD);
        this.layerPosition = layerPosition;
        this.layerId = layerId;
    }

    protected LayerException(
            String message, Throwable cause, ArtifactKind kind, Integer layerPosition, String layerId) {
        super(message, cause, kind, Phase.BUILD);
        this.layerPosition = layerPosition;
        this.layerId = layerId;
    }

    /** Position of the offending layer (or provider list entry), or {@code null} if unknown. */
    public Integer layerPosition() {
        return layerPosition;
    }

    /** Identity of the offending layer, or {@code null} if unknown. */
    public String layerId() {
        return layerId;
    }
}

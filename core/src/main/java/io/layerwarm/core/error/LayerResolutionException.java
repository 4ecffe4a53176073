package io.layerwarm.core.error;

import io.layerwarm.core.model.ArtifactKind;

/**
 * Thrown when a listed layer cannot be located or read. For providers, {@link #layerPosition()}
 * is the provider's position in the application's provider list.
 */
public final class LayerResolutionException extends LayerException {

    private static final long serialVersionUID = 1L;

    public LayerResolutionException(String message, ArtifactKind kind, Integer layerPosition, String layerId) {
        super(message, kind, layerPosition, layerId);
    }

    public LayerResolutionException(
            String message, Throwable cause, ArtifactKind kind, Integer layerPosition, String layerId) {
        super(message, cause, kind, layerPosition, layerId);
    }
}

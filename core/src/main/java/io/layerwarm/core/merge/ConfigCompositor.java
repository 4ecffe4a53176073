package io.layerwarm.core.merge;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.layerwarm.core.model.ArtifactKind;
import io.layerwarm.core.model.Composition;
import io.layerwarm.core.model.Layer;
import io.layerwarm.core.model.Mode;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Deep-merges configuration layers into one tree with last-wins-per-key semantics.
 *
 * <p>
 * Layer order is the only tie-break. Nested mappings recurse, lists and scalars replace, and an
 * explicit empty mapping is a real override that clears the subtree below its key.
 *
 * <p>
 * Thread-safe: stateless. Inputs are never mutated.
 */
public final class ConfigCompositor {

    /**
     * Merges raw configuration payloads in order.
     *
     * @param layers ordered payloads, earliest first
     * @return a fresh merged tree sharing no nodes with the inputs
     */
    public ObjectNode mergeConfig(List<ObjectNode> layers) {
        ObjectNode result = Layers.NODES.objectNode();
        for (ObjectNode layer : layers) {
            DeepMerge.mergeInto(result, Objects.requireNonNull(layer, "layer payload must not be null"));
        }
        return result;
    }

    /**
     * Merges ordered configuration layers for one mode.
     *
     * @param mode   execution mode
     * @param layers ordered layers, as returned by the layer reader
     * @return the composition with per-key origins
     * @throws IllegalArgumentException if layer positions do not strictly increase
     */
    public Composition compose(Mode mode, List<Layer> layers) {
        Layers.requireStrictOrder(layers);
        Map<String, Integer> origins = new HashMap<>();
        ObjectNode tree = DeepMerge.fold(layers, origins);
        return new Composition(ArtifactKind.CONFIG, mode, tree, layers, origins);
    }
}

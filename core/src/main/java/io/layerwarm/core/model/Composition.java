package io.layerwarm.core.model;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Output of a compositor before validation: the merged tree and, for every top-level key, the
 * position of the layer whose value survived the merge.
 *
 * <p>
 * The origin map is what lets validation report the offending layer for a violation. It is
 * not part of the persisted artifact.
 *
 * @param kind    artifact kind
 * @param mode    execution mode
 * @param tree    merged tree
 * @param layers  the ordered layers that were merged
 * @param origins top-level key to layer position of the surviving value
 */
public record Composition(
        ArtifactKind kind, Mode mode, ObjectNode tree, List<Layer> layers, Map<String, Integer> origins) {

    public Composition {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(mode, "mode must not be null");
        Objects.requireNonNull(tree, "tree must not be null");
        layers = List.copyOf(layers);
        origins = Collections.unmodifiableMap(new LinkedHashMap<>(origins));
    }

    /**
     * Returns the layer that supplied the surviving value for a top-level key.
     *
     * @param key top-level key (config key, route path, service id)
     * @return the origin layer, or empty if the key is not in the tree
     */
    public Optional<Layer> originOf(String key) {
        Integer position = origins.get(key);
        if (position == null) {
            return Optional.empty();
        }
        return layers.stream().filter(l -> l.order() == position).findFirst();
    }

    /** Converts this composition into an immutable result. Callers validate first. */
    public CompositionResult toResult() {
        return new CompositionResult(kind, mode, tree);
    }
}

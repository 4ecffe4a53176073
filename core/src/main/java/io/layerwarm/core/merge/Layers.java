package io.layerwarm.core.merge;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.layerwarm.core.model.Layer;
import java.util.List;

/** Ordering contract shared by the compositors. */
final class Layers {

    static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private Layers() {}

    /**
     * Checks that layer positions strictly increase.
     *
     * @throws IllegalArgumentException if two layers claim the same position or are out of order
     */
    static void requireStrictOrder(List<Layer> layers) {
        for (int i = 1; i < layers.size(); i++) {
            Layer previous = layers.get(i - 1);
            Layer current = layers.get(i);
            if (current.order() <= previous.order()) {
                throw new IllegalArgumentException("Layers out of order: " + previous.describe() + " precedes "
                        + current.describe());
            }
        }
    }
}

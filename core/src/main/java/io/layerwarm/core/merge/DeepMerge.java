package io.layerwarm.core.merge;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.layerwarm.core.model.Layer;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Last-wins deep merge shared by configuration and routes.
 *
 * <ul>
 * <li>both values are mappings and the incoming one is non-empty → recurse</li>
 * <li>incoming value is an empty mapping → replaces, clearing the merged subtree</li>
 * <li>incoming list → replaces the existing value wholesale, never concatenated</li>
 * <li>incoming scalar (including null) → overwrites</li>
 * </ul>
 *
 * <p>
 * Every key-level decision is independent of sibling keys, so key iteration order inside a
 * layer cannot change the result. Thread-safe: stateless utility class.
 */
final class DeepMerge {

    private DeepMerge() {}

    /**
     * Merges {@code overlay} into {@code target} in place. Values taken from the overlay are
     * copied; the overlay is never modified.
     *
     * @param target  accumulated result, modified
     * @param overlay later layer payload
     */
    static void mergeInto(ObjectNode target, ObjectNode overlay) {
        Iterator<Map.Entry<String, JsonNode>> fields = overlay.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String key = field.getKey();
            JsonNode incoming = field.getValue();
            JsonNode existing = target.get(key);
            if (existing != null && existing.isObject() && incoming.isObject() && !incoming.isEmpty()) {
                mergeInto((ObjectNode) existing, (ObjectNode) incoming);
            } else {
                target.set(key, incoming.deepCopy());
            }
        }
    }

    /**
     * Folds the layers in order into a fresh tree, recording for each top-level key the position
     * of the last layer that declared it.
     *
     * @param layers  ordered layers
     * @param origins receives top-level key → layer position
     * @return the merged tree
     */
    static ObjectNode fold(List<Layer> layers, Map<String, Integer> origins) {
        ObjectNode result = Layers.NODES.objectNode();
        for (Layer layer : layers) {
            mergeInto(result, layer.payload());
            layer.payload().fieldNames().forEachRemaining(key -> origins.put(key, layer.order()));
        }
        return result;
    }
}

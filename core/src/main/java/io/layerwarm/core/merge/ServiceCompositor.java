package io.layerwarm.core.merge;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.layerwarm.core.model.ArtifactKind;
import io.layerwarm.core.model.Composition;
import io.layerwarm.core.model.Layer;
import io.layerwarm.core.model.Mode;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Unions identifier-keyed service maps with a left-wins-per-step algebra.
 *
 * <p>
 * Starting from {@code acc = baseline}, each provider in listed order computes
 * {@code acc = provider ∪ acc}, then {@code acc = app ∪ acc}, where {@code ∪} keeps the left
 * operand's entry on a key collision. The net precedence (later provider over earlier provider
 * over baseline, application over everything) falls out of that rule alone.
 *
 * <p>
 * Unlike configuration and routes, a service definition is replaced as a whole: the winning
 * definition is used verbatim and its {@code options} are never merged with a losing one.
 *
 * <p>
 * Thread-safe: stateless. Inputs are never mutated.
 */
public final class ServiceCompositor {

    /**
     * Left-wins union: every entry of {@code left}, plus the entries of {@code right} whose key
     * {@code left} does not have.
     *
     * @param left  winning operand
     * @param right fallback operand
     * @return a fresh map sharing no nodes with the operands
     */
    public ObjectNode union(ObjectNode left, ObjectNode right) {
        ObjectNode result = left.deepCopy();
        Iterator<Map.Entry<String, JsonNode>> fields = right.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!result.has(field.getKey())) {
                result.set(field.getKey(), field.getValue().deepCopy());
            }
        }
        return result;
    }

    /**
     * Merges raw service maps.
     *
     * @param baseline  vendor baseline map, or null
     * @param providers provider maps in listed order
     * @param app       application map, or null
     * @return the merged registry map
     */
    public ObjectNode mergeServices(ObjectNode baseline, List<ObjectNode> providers, ObjectNode app) {
        ObjectNode acc = baseline != null ? baseline.deepCopy() : Layers.NODES.objectNode();
        for (ObjectNode provider : providers) {
            acc = union(provider, acc);
        }
        if (app != null) {
            acc = union(app, acc);
        }
        return acc;
    }

    /**
     * Merges service layers for one mode, tracking which layer each winning definition came from.
     *
     * @param mode      execution mode
     * @param baseline  baseline layer, or null if the baseline declares no services
     * @param providers provider layers in listed order
     * @param app       application layer, or null if the application declares no services
     * @return the composition with per-identifier origins
     */
    public Composition mergeServices(Mode mode, Layer baseline, List<Layer> providers, Layer app) {
        List<Layer> ordered = new ArrayList<>();
        if (baseline != null) {
            ordered.add(baseline);
        }
        ordered.addAll(providers);
        if (app != null) {
            ordered.add(app);
        }
        Layers.requireStrictOrder(ordered);

        ObjectNode acc = Layers.NODES.objectNode();
        Map<String, Integer> origins = new HashMap<>();
        if (baseline != null) {
            acc = baseline.payload().deepCopy();
            recordOrigins(baseline, origins);
        }
        for (Layer provider : providers) {
            acc = union(provider.payload(), acc);
            recordOrigins(provider, origins);
        }
        if (app != null) {
            acc = union(app.payload(), acc);
            recordOrigins(app, origins);
        }
        return new Composition(ArtifactKind.SERVICES, mode, acc, ordered, origins);
    }

    /**
     * Splits reader output into baseline, providers and application layer and merges them.
     *
     * @param mode   execution mode
     * @param layers ordered layers, as returned by the layer reader
     * @return the composition
     * @throws IllegalArgumentException if the list contains an environment overlay or more than
     *                                  one baseline or application layer
     */
    public Composition compose(Mode mode, List<Layer> layers) {
        Layer baseline = null;
        Layer app = null;
        List<Layer> providers = new ArrayList<>();
        for (Layer layer : layers) {
            switch (layer.kind()) {
                case BASELINE -> baseline = single(baseline, layer);
                case PROVIDER -> providers.add(layer);
                case APP_BASE -> app = single(app, layer);
                case APP_ENV -> throw new IllegalArgumentException(
                        "Services have no environment overlay: " + layer.describe());
                default -> throw new IllegalStateException("Unexpected layer kind: " + layer.kind());
            }
        }
        return mergeServices(mode, baseline, providers, app);
    }

    private static Layer single(Layer existing, Layer candidate) {
        if (existing != null) {
            throw new IllegalArgumentException("Duplicate " + candidate.kind() + " layers: " + existing.describe()
                    + " and " + candidate.describe());
        }
        return candidate;
    }

    /** Left-wins: the layer applied last in the fold is the left operand, so it owns its keys. */
    private static void recordOrigins(Layer layer, Map<String, Integer> origins) {
        layer.payload().fieldNames().forEachRemaining(key -> origins.put(key, layer.order()));
    }
}

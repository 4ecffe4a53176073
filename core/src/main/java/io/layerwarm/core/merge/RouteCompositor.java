package io.layerwarm.core.merge;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.layerwarm.core.model.ArtifactKind;
import io.layerwarm.core.model.Composition;
import io.layerwarm.core.model.Layer;
import io.layerwarm.core.model.Mode;
import io.layerwarm.core.model.RouteTable;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Deep-merges path-keyed route tables with last-wins-per-path semantics.
 *
 * <p>
 * A later layer redeclaring a path as a mapping overrides only the fields it names; authors
 * wanting a full replacement redeclare every field. The pattern-route list under
 * {@value RouteTable#PATTERN_KEY} is a list, so a later declaration replaces the whole ordered
 * list. There is no per-pattern merging: adding one pattern means redeclaring the full list.
 *
 * <p>
 * Thread-safe: stateless. Inputs are never mutated.
 */
public final class RouteCompositor {

    private static final Logger LOG = LoggerFactory.getLogger(RouteCompositor.class);

    /**
     * Merges raw route tables in order.
     *
     * @param layers ordered route tables, earliest first
     * @return a fresh merged table sharing no nodes with the inputs
     */
    public ObjectNode mergeRoutes(List<ObjectNode> layers) {
        ObjectNode result = Layers.NODES.objectNode();
        for (ObjectNode layer : layers) {
            DeepMerge.mergeInto(result, Objects.requireNonNull(layer, "layer payload must not be null"));
        }
        return result;
    }

    /**
     * Merges ordered route layers for one mode.
     *
     * @param mode   execution mode
     * @param layers ordered layers, as returned by the layer reader
     * @return the composition with per-path origins
     * @throws IllegalArgumentException if layer positions do not strictly increase
     */
    public Composition compose(Mode mode, List<Layer> layers) {
        Layers.requireStrictOrder(layers);
        for (Layer layer : layers) {
            if (layer.payload().has(RouteTable.PATTERN_KEY)) {
                LOG.debug(
                        "Pattern routes of mode {} now come from {} (earlier lists are replaced)",
                        mode,
                        layer.describe());
            }
        }
        Map<String, Integer> origins = new HashMap<>();
        ObjectNode tree = DeepMerge.fold(layers, origins);
        return new Composition(ArtifactKind.ROUTES, mode, tree, layers, origins);
    }
}

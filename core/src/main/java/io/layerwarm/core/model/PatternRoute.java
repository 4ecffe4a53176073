package io.layerwarm.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * An entry of the ordered pattern-route list. Dispatch evaluates these strictly in list order;
 * {@link #index()} is the entry's position in that list.
 *
 * @param index      position in the pattern list
 * @param pattern    the route pattern
 * @param controller controller symbol reference
 * @param action     action name
 * @param methods    allowed methods, upper-cased, in declaration order
 * @param metadata   remaining fields of the entry
 */
public record PatternRoute(
        int index, String pattern, String controller, String action, Set<String> methods, ObjectNode metadata) {

    public static final String PATTERN = "pattern";

    public PatternRoute {
        Objects.requireNonNull(pattern, "pattern must not be null");
        Objects.requireNonNull(controller, "controller must not be null");
        Objects.requireNonNull(action, "action must not be null");
        methods = Collections.unmodifiableSet(new LinkedHashSet<>(methods));
        metadata = metadata != null ? metadata.deepCopy() : JsonNodeFactory.instance.objectNode();
    }

    /** Returns a copy of the metadata mapping. */
    @Override
    public ObjectNode metadata() {
        return metadata.deepCopy();
    }

    /**
     * Builds a pattern route from a validated list item.
     *
     * @param index position in the pattern list
     * @param entry the list item mapping
     * @return the typed entry
     */
    public static PatternRoute fromNode(int index, JsonNode entry) {
        return new PatternRoute(
                index,
                entry.path(PATTERN).asText(),
                entry.path(RouteEntry.CONTROLLER).asText(),
                entry.path(RouteEntry.ACTION).asText(),
                RouteEntry.readMethods(entry.get(RouteEntry.METHODS)),
                RouteEntry.metadataOf(
                        entry, Set.of(PATTERN, RouteEntry.CONTROLLER, RouteEntry.ACTION, RouteEntry.METHODS)));
    }
}

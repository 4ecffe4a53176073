package io.layerwarm.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A path-keyed route: which controller action handles a literal request path, for which HTTP
 * methods. Every other field of the route mapping is kept as metadata.
 *
 * @param path       literal request path
 * @param controller controller symbol reference
 * @param action     action name
 * @param methods    allowed methods, upper-cased, in declaration order
 * @param metadata   remaining fields of the route mapping
 */
public record RouteEntry(String path, String controller, String action, Set<String> methods, ObjectNode metadata) {

    public static final String CONTROLLER = "controller";
    public static final String ACTION = "action";
    public static final String METHODS = "methods";

    public RouteEntry {
        Objects.requireNonNull(path, "path must not be null");
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

    /** Returns {@code true} if this route accepts the given method (case-insensitive). */
    public boolean allows(String method) {
        return method != null && methods.contains(method.toUpperCase(Locale.ROOT));
    }

    /**
     * Builds an entry from a validated route mapping.
     *
     * @param path  the route's path key
     * @param entry the route mapping
     * @return the typed entry
     */
    public static RouteEntry fromNode(String path, JsonNode entry) {
        return new RouteEntry(
                path,
                entry.path(CONTROLLER).asText(),
                entry.path(ACTION).asText(),
                readMethods(entry.get(METHODS)),
                metadataOf(entry, Set.of(CONTROLLER, ACTION, METHODS)));
    }

    /** Reads a {@code methods} value: a list of method names or a single method name. */
    static Set<String> readMethods(JsonNode methodsNode) {
        Set<String> methods = new LinkedHashSet<>();
        if (methodsNode == null) {
            return methods;
        }
        if (methodsNode.isTextual()) {
            methods.add(methodsNode.asText().trim().toUpperCase(Locale.ROOT));
        } else if (methodsNode.isArray()) {
            for (JsonNode method : methodsNode) {
                methods.add(method.asText().trim().toUpperCase(Locale.ROOT));
            }
        }
        return methods;
    }

    static ObjectNode metadataOf(JsonNode entry, Set<String> reserved) {
        ObjectNode metadata = JsonNodeFactory.instance.objectNode();
        Iterator<Map.Entry<String, JsonNode>> fields = entry.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!reserved.contains(field.getKey())) {
                metadata.set(field.getKey(), field.getValue().deepCopy());
            }
        }
        return metadata;
    }
}

package io.layerwarm.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Objects;

/**
 * Declarative service definition: a class reference and inert option data.
 *
 * <p>
 * In a layer payload a definition is either a bare class-name string or a mapping with
 * {@value #CLASS} and optional {@value #OPTIONS}.
 *
 * @param id        service identifier
 * @param className class symbol reference
 * @param options   option mapping, empty when none were declared
 */
public record ServiceDefinition(String id, String className, ObjectNode options) {

    public static final String CLASS = "class";
    public static final String OPTIONS = "options";

    public ServiceDefinition {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(className, "className must not be null");
        options = options != null ? options.deepCopy() : JsonNodeFactory.instance.objectNode();
    }

    /** Returns a copy of the options mapping. */
    @Override
    public ObjectNode options() {
        return options.deepCopy();
    }

    /** Returns {@code true} if options were declared. */
    public boolean hasOptions() {
        return !options.isEmpty();
    }

    /**
     * Builds a definition from a validated payload value.
     *
     * @param id   service identifier
     * @param node bare class-name string or {@code {class, options}} mapping
     * @return the typed definition
     */
    public static ServiceDefinition fromNode(String id, JsonNode node) {
        if (node.isTextual()) {
            return new ServiceDefinition(id, node.asText().trim(), null);
        }
        JsonNode options = node.get(OPTIONS);
        return new ServiceDefinition(
                id,
                node.path(CLASS).asText().trim(),
                options != null && options.isObject() ? (ObjectNode) options : null);
    }
}

package io.layerwarm.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only service registry: identifier to winning {@link ServiceDefinition}.
 *
 * <p>
 * Thread-safe: the map is unmodifiable and definitions are immutable.
 */
public final class ServiceRegistry {

    private final CompositionResult result;
    private final Map<String, ServiceDefinition> definitions;

    private ServiceRegistry(CompositionResult result, Map<String, ServiceDefinition> definitions) {
        this.result = result;
        this.definitions = Collections.unmodifiableMap(definitions);
    }

    /**
     * Builds the typed registry from a validated services result.
     *
     * @param result a {@link ArtifactKind#SERVICES} result
     * @return the registry
     * @throws IllegalArgumentException if the result is not a services result
     */
    public static ServiceRegistry from(CompositionResult result) {
        Objects.requireNonNull(result, "result must not be null");
        if (result.kind() != ArtifactKind.SERVICES) {
            throw new IllegalArgumentException("Expected a services result, got: " + result.kind());
        }
        Map<String, ServiceDefinition> definitions = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = result.tree().fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            definitions.put(field.getKey(), ServiceDefinition.fromNode(field.getKey(), field.getValue()));
        }
        return new ServiceRegistry(result, definitions);
    }

    public Mode mode() {
        return result.mode();
    }

    /** The underlying immutable result. */
    public CompositionResult result() {
        return result;
    }

    /** Looks up the definition registered under {@code id}. */
    public Optional<ServiceDefinition> definition(String id) {
        return Optional.ofNullable(definitions.get(id));
    }

    /** All service identifiers, in canonical order. */
    public Set<String> ids() {
        return definitions.keySet();
    }

    public int size() {
        return definitions.size();
    }
}

package io.layerwarm.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-only view over a composed configuration tree with dotted-path lookup.
 *
 * <p>
 * A path such as {@code http.base_url} walks nested mappings one segment at a time. Lookups
 * return copies, the underlying result stays untouched.
 */
public final class ConfigTree {

    private final CompositionResult result;

    private ConfigTree(CompositionResult result) {
        this.result = result;
    }

    /**
     * Wraps a configuration result.
     *
     * @param result a {@link ArtifactKind#CONFIG} result
     * @return the view
     * @throws IllegalArgumentException if the result is not a configuration result
     */
    public static ConfigTree from(CompositionResult result) {
        Objects.requireNonNull(result, "result must not be null");
        if (result.kind() != ArtifactKind.CONFIG) {
            throw new IllegalArgumentException("Expected a config result, got: " + result.kind());
        }
        return new ConfigTree(result);
    }

    public Mode mode() {
        return result.mode();
    }

    /** The underlying immutable result. */
    public CompositionResult result() {
        return result;
    }

    /**
     * Looks up a value by dotted path.
     *
     * @param path dotted path, e.g. {@code http.base_url}
     * @return a copy of the value, or empty if any segment is missing
     */
    public Optional<JsonNode> get(String path) {
        Objects.requireNonNull(path, "path must not be null");
        String[] segments = path.split("\\.");
        JsonNode node = result.get(segments[0]);
        for (int i = 1; i < segments.length && node != null; i++) {
            node = node.isObject() ? node.get(segments[i]) : null;
        }
        return Optional.ofNullable(node);
    }

    /** Returns {@code true} if the dotted path resolves to a value (including JSON null). */
    public boolean has(String path) {
        return get(path).isPresent();
    }

    /** Text value at {@code path}, or {@code defaultValue} if absent or not a scalar. */
    public String string(String path, String defaultValue) {
        return get(path).filter(JsonNode::isValueNode)
                .filter(n -> !n.isNull())
                .map(JsonNode::asText)
                .orElse(defaultValue);
    }

    /** Integer value at {@code path}, or {@code defaultValue} if absent or not integral. */
    public int integer(String path, int defaultValue) {
        return get(path).filter(JsonNode::canConvertToInt).map(JsonNode::asInt).orElse(defaultValue);
    }

    /** Boolean value at {@code path}, or {@code defaultValue} if absent or not boolean. */
    public boolean bool(String path, boolean defaultValue) {
        return get(path).filter(JsonNode::isBoolean).map(JsonNode::booleanValue).orElse(defaultValue);
    }

    /**
     * Returns the mapping at {@code path}.
     *
     * @param path dotted path
     * @return a copy of the mapping, or empty if absent or not a mapping
     */
    public Optional<ObjectNode> section(String path) {
        return get(path).filter(JsonNode::isObject).map(ObjectNode.class::cast);
    }

    @Override
    public String toString() {
        return "ConfigTree[mode=" + result.mode() + ", fingerprint=" + result.fingerprint() + "]";
    }
}

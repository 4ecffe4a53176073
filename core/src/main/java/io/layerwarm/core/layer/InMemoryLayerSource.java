package io.layerwarm.core.layer;

import com.fasterxml.jackson.databind.JsonNode;
import io.layerwarm.core.model.ArtifactKind;
import io.layerwarm.core.model.Mode;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Layer source backed by trees held in memory, for embedding code that assembles its layers
 * programmatically.
 *
 * <p>
 * Thread-safe: the slot map is fixed at construction and every read returns a copy.
 */
public final class InMemoryLayerSource implements LayerSource {

    private final String id;
    private final Map<String, JsonNode> slots;

    private InMemoryLayerSource(String id, Map<String, JsonNode> slots) {
        this.id = id;
        this.slots = Collections.unmodifiableMap(new HashMap<>(slots));
    }

    /**
     * Returns a new builder.
     *
     * @param id source identity
     * @return a fresh builder
     */
    public static Builder builder(String id) {
        return new Builder(id);
    }

    /** A source with no slots at all. */
    public static InMemoryLayerSource empty(String id) {
        return builder(id).build();
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public Optional<JsonNode> slot(Mode mode, ArtifactKind kind) {
        JsonNode node = slots.get(key(mode, kind));
        return node != null ? Optional.of(node.deepCopy()) : Optional.empty();
    }

    private static String key(Mode mode, ArtifactKind kind) {
        return mode.token() + "/" + kind.token();
    }

    /** Builder for {@link InMemoryLayerSource}. */
    public static final class Builder {

        private final String id;
        private final Map<String, JsonNode> slots = new HashMap<>();

        Builder(String id) {
            this.id = Objects.requireNonNull(id, "id must not be null");
        }

        /**
         * Sets a slot payload. The node is copied.
         *
         * @param mode    execution mode
         * @param kind    artifact kind
         * @param payload slot payload
         * @return this builder (fluent)
         */
        public Builder slot(Mode mode, ArtifactKind kind, JsonNode payload) {
            Objects.requireNonNull(payload, "payload must not be null");
            slots.put(key(mode, kind), payload.deepCopy());
            return this;
        }

        /**
         * Sets a slot payload from YAML text. An empty document leaves the slot absent.
         *
         * @param mode execution mode
         * @param kind artifact kind
         * @param yaml slot payload as YAML
         * @return this builder (fluent)
         * @throws UncheckedIOException if the YAML cannot be parsed
         */
        public Builder yaml(Mode mode, ArtifactKind kind, String yaml) {
            try {
                PayloadFormat.YAML.read(yaml).ifPresent(node -> slots.put(key(mode, kind), node));
            } catch (IOException e) {
                throw new UncheckedIOException("Invalid YAML for slot " + key(mode, kind) + " of '" + id + "'", e);
            }
            return this;
        }

        public InMemoryLayerSource build() {
            return new InMemoryLayerSource(id, slots);
        }
    }
}

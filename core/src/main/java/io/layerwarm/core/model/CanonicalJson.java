package io.layerwarm.core.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.UncheckedIOException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;

/**
 * Canonical form of composed trees: object keys sorted recursively, list order preserved.
 *
 * <p>
 * Two trees that are {@link JsonNode#equals equal} always have the same canonical bytes, no
 * matter in which order their keys were inserted. Artifacts and fingerprints are computed from
 * this form so that the same layer inputs reproduce a byte-identical snapshot.
 *
 * <p>
 * Thread-safe: stateless utility class.
 */
public final class CanonicalJson {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final ObjectWriter PRETTY = MAPPER.writer(new DefaultPrettyPrinter()
            .withObjectIndenter(new DefaultIndenter("  ", "\n"))
            .withArrayIndenter(new DefaultIndenter("  ", "\n")));

    private CanonicalJson() {}

    /**
     * Returns a deep copy of {@code node} with every object's keys in natural string order.
     *
     * @param node the tree to copy, must not be null
     * @return the canonical copy
     */
    public static JsonNode canonicalize(JsonNode node) {
        if (node.isObject()) {
            List<String> names = new ArrayList<>();
            node.fieldNames().forEachRemaining(names::add);
            names.sort(null);
            ObjectNode copy = JsonNodeFactory.instance.objectNode();
            for (String name : names) {
                copy.set(name, canonicalize(node.get(name)));
            }
            return copy;
        }
        if (node.isArray()) {
            ArrayNode copy = JsonNodeFactory.instance.arrayNode(node.size());
            for (JsonNode element : node) {
                copy.add(canonicalize(element));
            }
            return copy;
        }
        return node.deepCopy();
    }

    /** Canonical copy of an object tree. */
    public static ObjectNode canonicalize(ObjectNode node) {
        return (ObjectNode) canonicalize((JsonNode) node);
    }

    /**
     * Serializes a tree in canonical form as indented UTF-8 JSON with {@code \n} line breaks.
     *
     * @param node the tree to write
     * @return the canonical bytes
     */
    public static byte[] toPrettyBytes(JsonNode node) {
        try {
            return PRETTY.writeValueAsBytes(canonicalize(node));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize canonical JSON", e);
        }
    }

    /**
     * Computes the SHA-256 fingerprint (lower-case hex) of the compact canonical serialization.
     *
     * @param node the tree to fingerprint
     * @return 64-character hex digest
     */
    public static String fingerprint(JsonNode node) {
        try {
            byte[] compact = MAPPER.writeValueAsBytes(canonicalize(node));
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(compact));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize canonical JSON", e);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}

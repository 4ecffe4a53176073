package io.layerwarm.core.layer;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Data formats a slot file may be written in. Both are parsed into inert Jackson trees; nothing
 * in a payload is ever executed.
 *
 * <p>
 * A key repeated within one mapping is a parse error in both formats, so the outcome of a
 * layer never depends on the order of its own keys.
 */
public enum PayloadFormat {
    YAML(strict(new ObjectMapper(new YAMLFactory())), List.of("yaml", "yml")),
    JSON(strict(new ObjectMapper()), List.of("json"));

    private final ObjectMapper mapper;
    private final List<String> extensions;

    PayloadFormat(ObjectMapper mapper, List<String> extensions) {
        this.mapper = mapper;
        this.extensions = extensions;
    }

    private static ObjectMapper strict(ObjectMapper mapper) {
        return mapper.enable(DeserializationFeature.FAIL_ON_READING_DUP_TREE_KEY);
    }

    /** File extensions recognised for this format, without the dot. */
    public List<String> extensions() {
        return extensions;
    }

    /**
     * Parses a payload. An empty document yields empty, the same as an absent slot.
     *
     * @param in the payload stream, closed by the caller
     * @return the parsed tree, or empty for an empty document
     * @throws IOException if the content is not valid for this format
     */
    public Optional<JsonNode> read(InputStream in) throws IOException {
        JsonNode node = mapper.readTree(in);
        if (node == null || node.isMissingNode() || node.isNull()) {
            return Optional.empty();
        }
        return Optional.of(node);
    }

    /**
     * Parses a payload from text.
     *
     * @param content the payload text
     * @return the parsed tree, or empty for an empty document
     * @throws IOException if the content is not valid for this format
     */
    public Optional<JsonNode> read(String content) throws IOException {
        JsonNode node = mapper.readTree(content);
        if (node == null || node.isMissingNode() || node.isNull()) {
            return Optional.empty();
        }
        return Optional.of(node);
    }

    /** Finds the format for a file extension (case-insensitive). */
    public static Optional<PayloadFormat> forExtension(String extension) {
        String normalized = extension.toLowerCase(Locale.ROOT);
        for (PayloadFormat format : values()) {
            if (format.extensions.contains(normalized)) {
                return Optional.of(format);
            }
        }
        return Optional.empty();
    }
}

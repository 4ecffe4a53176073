package io.layerwarm.core.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.layerwarm.core.error.ArtifactReadException;
import io.layerwarm.core.model.ArtifactKind;
import io.layerwarm.core.model.CanonicalJson;
import io.layerwarm.core.model.CompositionResult;
import io.layerwarm.core.model.Mode;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Artifact file format: a JSON envelope around the canonical payload.
 *
 * <pre>
 * {
 *   "fingerprint" : "&lt;sha-256 of payload&gt;",
 *   "format" : 1,
 *   "kind" : "routes",
 *   "mode" : "http",
 *   "payload" : { ... }
 * }
 * </pre>
 *
 * <p>
 * No timestamp is written, so the same composition always encodes to the same bytes. Decoding
 * is a generic JSON read plus consistency checks; no merge logic runs at load time.
 */
final class ArtifactCodec {

    static final int FORMAT = 1;

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ArtifactCodec() {}

    static byte[] encode(CompositionResult result) {
        ObjectNode envelope = JsonNodeFactory.instance.objectNode();
        envelope.put("format", FORMAT);
        envelope.put("kind", result.kind().token());
        envelope.put("mode", result.mode().token());
        envelope.put("fingerprint", result.fingerprint());
        envelope.set("payload", result.tree());
        return CanonicalJson.toPrettyBytes(envelope);
    }

    static CompositionResult decode(byte[] bytes, ArtifactKind kind, Mode mode, Path identity) {
        JsonNode envelope;
        try {
            envelope = MAPPER.readTree(bytes);
        } catch (IOException e) {
            throw new ArtifactReadException("Artifact is not valid JSON: " + identity, e, kind, identity);
        }
        if (envelope == null || !envelope.isObject()) {
            throw new ArtifactReadException("Artifact is not a JSON object: " + identity, kind, identity);
        }
        int format = envelope.path("format").asInt(-1);
        if (format != FORMAT) {
            throw new ArtifactReadException(
                    "Unsupported artifact format " + format + " (expected " + FORMAT + "): " + identity, kind, identity);
        }
        String storedKind = envelope.path("kind").asText();
        String storedMode = envelope.path("mode").asText();
        if (!kind.token().equals(storedKind) || !mode.token().equals(storedMode)) {
            throw new ArtifactReadException(
                    "Artifact " + identity + " holds " + storedKind + "/" + storedMode + ", expected " + kind + "/"
                            + mode,
                    kind,
                    identity);
        }
        JsonNode payload = envelope.get("payload");
        if (payload == null || !payload.isObject()) {
            throw new ArtifactReadException("Artifact payload is missing or not a mapping: " + identity, kind, identity);
        }
        CompositionResult result = new CompositionResult(kind, mode, (ObjectNode) payload);
        String expected = envelope.path("fingerprint").asText();
        if (!result.fingerprint().equals(expected)) {
            throw new ArtifactReadException(
                    "Artifact fingerprint mismatch for " + identity + ": stored " + expected + ", computed "
                            + result.fingerprint(),
                    kind,
                    identity);
        }
        return result;
    }
}

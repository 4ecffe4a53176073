package io.layerwarm.core.layer;

import com.fasterxml.jackson.databind.JsonNode;
import io.layerwarm.core.model.ArtifactKind;
import io.layerwarm.core.model.Mode;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Objects;
import java.util.Optional;

/**
 * Layer source backed by classpath resources at {@code <prefix>/<mode>/<kind>.yaml}. The vendor
 * baseline ships this way inside the core jar.
 */
public final class ClasspathLayerSource implements LayerSource {

    /** Resource prefix of the bundled vendor baseline. */
    public static final String BASELINE_PREFIX = "META-INF/layerwarm/baseline";

    private final String id;
    private final String prefix;
    private final ClassLoader classLoader;

    public ClasspathLayerSource(String id, String prefix, ClassLoader classLoader) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.prefix = stripSlashes(Objects.requireNonNull(prefix, "prefix must not be null"));
        this.classLoader = Objects.requireNonNull(classLoader, "classLoader must not be null");
    }

    /** The vendor baseline bundled with layerwarm. */
    public static ClasspathLayerSource bundledBaseline() {
        return new ClasspathLayerSource("baseline", BASELINE_PREFIX, ClasspathLayerSource.class.getClassLoader());
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public Optional<JsonNode> slot(Mode mode, ArtifactKind kind) {
        String resource = prefix + "/" + mode.token() + "/" + kind.token() + ".yaml";
        try (InputStream in = classLoader.getResourceAsStream(resource)) {
            if (in == null) {
                return Optional.empty();
            }
            return PayloadFormat.YAML.read(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read or parse classpath resource " + resource, e);
        }
    }

    private static String stripSlashes(String value) {
        String result = value;
        while (result.startsWith("/")) {
            result = result.substring(1);
        }
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }
}

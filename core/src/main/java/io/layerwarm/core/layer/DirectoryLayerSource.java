package io.layerwarm.core.layer;

import com.fasterxml.jackson.databind.JsonNode;
import io.layerwarm.core.error.LayerResolutionException;
import io.layerwarm.core.model.ArtifactKind;
import io.layerwarm.core.model.Mode;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Layer source backed by a directory of slot files.
 *
 * <p>
 * Slot files live at {@code <root>/<mode>/<kind>.<ext>}, or
 * {@code <root>/<mode>/<kind>.<variant>.<ext>} when a variant is set (the environment overlay
 * uses the environment token as variant). Recognised extensions are those of
 * {@link PayloadFormat}. Declaring the same slot in two formats is rejected rather than
 * silently picking one.
 *
 * <p>
 * Thread-safe: holds no mutable state; each read goes to the file system.
 */
public final class DirectoryLayerSource implements LayerSource {

    private static final Logger LOG = LoggerFactory.getLogger(DirectoryLayerSource.class);

    private final String id;
    private final Path root;
    private final String variant;

    /**
     * Creates a source without variant.
     *
     * @param id   source identity
     * @param root directory holding one sub-directory per mode
     */
    public DirectoryLayerSource(String id, Path root) {
        this(id, root, null);
    }

    /**
     * Creates a source reading {@code <kind>.<variant>.<ext>} slot files.
     *
     * @param id      source identity
     * @param root    directory holding one sub-directory per mode
     * @param variant file-name variant, or null for plain {@code <kind>.<ext>} files
     */
    public DirectoryLayerSource(String id, Path root, String variant) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.root = Objects.requireNonNull(root, "root must not be null");
        if (variant != null && !Mode.isValidToken(variant)) {
            throw new IllegalArgumentException("Invalid variant token: '" + variant + "'");
        }
        this.variant = variant;
    }

    @Override
    public String id() {
        return id;
    }

    /** The directory this source reads from. */
    public Path root() {
        return root;
    }

    @Override
    public Optional<JsonNode> slot(Mode mode, ArtifactKind kind) {
        Path modeDir = root.resolve(mode.token());
        String baseName = variant != null ? kind.token() + "." + variant : kind.token();

        List<Path> candidates = new ArrayList<>();
        for (PayloadFormat format : PayloadFormat.values()) {
            for (String extension : format.extensions()) {
                Path candidate = modeDir.resolve(baseName + "." + extension);
                if (Files.isRegularFile(candidate)) {
                    candidates.add(candidate);
                }
            }
        }
        if (candidates.isEmpty()) {
            LOG.debug("No {} slot for mode {} in {}", kind, mode, modeDir);
            return Optional.empty();
        }
        if (candidates.size() > 1) {
            throw new LayerResolutionException(
                    "Ambiguous " + kind + " slot in layer '" + id + "': " + candidates, kind, null, id);
        }

        Path file = candidates.get(0);
        String fileName = file.getFileName().toString();
        PayloadFormat format = PayloadFormat.forExtension(fileName.substring(fileName.lastIndexOf('.') + 1))
                .orElseThrow();
        try (InputStream in = Files.newInputStream(file)) {
            LOG.debug("Reading {} slot for mode {} from {}", kind, mode, file);
            return format.read(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read or parse " + file + ": " + e.getMessage(), e);
        }
    }

    @Override
    public String toString() {
        return "DirectoryLayerSource[id=" + id + ", root=" + root + (variant != null ? ", variant=" + variant : "")
                + "]";
    }
}

package io.layerwarm.core.cache;

import io.layerwarm.core.error.ArtifactNotFoundException;
import io.layerwarm.core.error.ArtifactReadException;
import io.layerwarm.core.model.ArtifactKind;
import io.layerwarm.core.model.CompositionBundle;
import io.layerwarm.core.model.CompositionResult;
import io.layerwarm.core.model.ConfigTree;
import io.layerwarm.core.model.Mode;
import io.layerwarm.core.model.RouteTable;
import io.layerwarm.core.model.ServiceRegistry;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Boot-time access to warmed artifacts.
 *
 * <p>
 * Reads the canonical artifact and decodes it; no layer is read and no merge runs. A missing
 * artifact is fatal: there is no fallback to an empty or baseline-only structure.
 *
 * <p>
 * Safe for any number of concurrent readers.
 */
public final class RuntimeLoader {

    private static final Logger LOG = LoggerFactory.getLogger(RuntimeLoader.class);

    private final ArtifactStore store;
    private final LoadedArtifactCache cache;

    public RuntimeLoader(ArtifactStore store) {
        this(store, null);
    }

    /**
     * @param store artifact layout
     * @param cache optional loaded-artifact cache, may be null
     */
    public RuntimeLoader(ArtifactStore store, LoadedArtifactCache cache) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.cache = cache;
    }

    /**
     * Loads the canonical artifact for a kind and mode.
     *
     * @throws ArtifactNotFoundException if the artifact has not been warmed
     * @throws ArtifactReadException     if the artifact cannot be read or is inconsistent
     */
    public CompositionResult load(ArtifactKind kind, Mode mode) {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(mode, "mode must not be null");
        Path identity = store.identity(kind, mode);
        if (cache != null) {
            return cache.computeIfAbsent(identity, path -> read(kind, mode, path));
        }
        return read(kind, mode, identity);
    }

    public ConfigTree loadConfig(Mode mode) {
        return ConfigTree.from(load(ArtifactKind.CONFIG, mode));
    }

    public RouteTable loadRoutes(Mode mode) {
        return RouteTable.from(load(ArtifactKind.ROUTES, mode));
    }

    public ServiceRegistry loadServices(Mode mode) {
        return ServiceRegistry.from(load(ArtifactKind.SERVICES, mode));
    }

    /** Loads all three artifacts of a mode, failing on the first that is unavailable. */
    public CompositionBundle loadAll(Mode mode) {
        return new CompositionBundle(
                load(ArtifactKind.CONFIG, mode), load(ArtifactKind.ROUTES, mode), load(ArtifactKind.SERVICES, mode));
    }

    private static CompositionResult read(ArtifactKind kind, Mode mode, Path identity) {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(identity);
        } catch (NoSuchFileException e) {
            throw notFound(kind, mode, identity);
        } catch (IOException e) {
            throw new ArtifactReadException(
                    "Cannot read " + kind + " artifact " + identity + ": " + e.getMessage(), e, kind, identity);
        }
        CompositionResult result = ArtifactCodec.decode(bytes, kind, mode, identity);
        LOG.debug("Loaded artifact: kind={}, mode={}, path={}", kind, mode, identity);
        return result;
    }

    private static ArtifactNotFoundException notFound(ArtifactKind kind, Mode mode, Path identity) {
        return new ArtifactNotFoundException(
                "No " + kind + " artifact for mode '" + mode + "' at " + identity + "; run the warm step first",
                kind,
                identity);
    }
}

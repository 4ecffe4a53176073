package io.layerwarm.core.engine;

import io.layerwarm.core.cache.CacheWriter;
import io.layerwarm.core.error.CompositionException;
import io.layerwarm.core.error.ValidationException;
import io.layerwarm.core.layer.LayerSourceReader;
import io.layerwarm.core.layer.LayerStack;
import io.layerwarm.core.merge.ConfigCompositor;
import io.layerwarm.core.merge.RouteCompositor;
import io.layerwarm.core.merge.ServiceCompositor;
import io.layerwarm.core.model.ArtifactKind;
import io.layerwarm.core.model.CacheArtifact;
import io.layerwarm.core.model.Composition;
import io.layerwarm.core.model.CompositionBundle;
import io.layerwarm.core.model.CompositionResult;
import io.layerwarm.core.model.Layer;
import io.layerwarm.core.model.Mode;
import io.layerwarm.core.spi.CompositionListener;
import io.layerwarm.core.spi.CompositionListener.ArtifactBuiltEvent;
import io.layerwarm.core.spi.CompositionListener.ArtifactWrittenEvent;
import io.layerwarm.core.spi.CompositionListener.BuildRejectedEvent;
import io.layerwarm.core.validate.ArtifactValidator;
import io.layerwarm.core.validate.Violation;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Explicit build entry points: compose, validate and persist artifacts for one mode.
 *
 * <p>
 * Builds are synchronous and only ever triggered by a call here, never by a cache miss at
 * runtime. Each kind runs its own merge algebra:
 * <ul>
 * <li>config: deep last-wins ({@link ConfigCompositor})</li>
 * <li>routes: last-wins per path, pattern list replaced wholesale ({@link RouteCompositor})</li>
 * <li>services: left-wins union per step ({@link ServiceCompositor})</li>
 * </ul>
 *
 * <p>
 * {@link #warm} builds and validates every requested kind of a mode before writing any of them,
 * so a validation failure in one kind never leaves the cache with a mix of old and new
 * generations. Each write is an atomic swap done by the {@link CacheWriter}.
 *
 * <p>
 * Thread-safe: holds no mutable state of its own. Listener exceptions are caught and logged.
 */
public final class CompositionEngine {

    private static final Logger LOG = LoggerFactory.getLogger(CompositionEngine.class);

    private final LayerSourceReader reader;
    private final CacheWriter writer;
    private final CompositionListener listener;
    private final ConfigCompositor configCompositor = new ConfigCompositor();
    private final RouteCompositor routeCompositor = new RouteCompositor();
    private final ServiceCompositor serviceCompositor = new ServiceCompositor();
    private final ArtifactValidator validator = new ArtifactValidator();

    public CompositionEngine(LayerStack stack, CacheWriter writer) {
        this(new LayerSourceReader(stack), writer, CompositionListener.NONE);
    }

    public CompositionEngine(LayerSourceReader reader, CacheWriter writer, CompositionListener listener) {
        this.reader = Objects.requireNonNull(reader, "reader must not be null");
        this.writer = Objects.requireNonNull(writer, "writer must not be null");
        this.listener = Objects.requireNonNull(listener, "listener must not be null");
    }

    /**
     * Reads the layers of one kind, composes and validates them. Writes nothing.
     *
     * @param mode execution mode
     * @param kind artifact kind
     * @return the validated result
     * @throws CompositionException if a layer cannot be resolved or the result is invalid
     */
    public CompositionResult build(Mode mode, ArtifactKind kind) {
        Objects.requireNonNull(mode, "mode must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        try {
            List<Layer> layers = reader.collectLayers(mode, kind);
            Composition composition = compose(mode, kind, layers);
            validator.validate(composition).throwIfInvalid();
            CompositionResult result = composition.toResult();
            LOG.info(
                    "Artifact built: kind={}, mode={}, layers={}, entries={}",
                    kind,
                    mode,
                    layers.size(),
                    result.size());
            notifyBuilt(new ArtifactBuiltEvent(kind, mode, layers.size(), result.fingerprint()));
            return result;
        } catch (CompositionException e) {
            LOG.debug("Build rejected: kind={}, mode={}", kind, mode, e);
            notifyRejected(e, kind, mode);
            throw e;
        }
    }

    /**
     * Builds all three kinds of a mode. Every kind is attempted; if several fail, the first
     * failure is thrown with the others attached as suppressed exceptions.
     *
     * @param mode execution mode
     * @return the three validated results
     */
    public CompositionBundle buildAll(Mode mode) {
        Map<ArtifactKind, CompositionResult> results = buildKinds(mode, List.of(ArtifactKind.values()));
        return new CompositionBundle(
                results.get(ArtifactKind.CONFIG), results.get(ArtifactKind.ROUTES), results.get(ArtifactKind.SERVICES));
    }

    /**
     * Builds and persists the artifacts of a mode.
     *
     * @param mode                    execution mode
     * @param overwrite               when false, kinds whose artifact already exists are skipped
     *                                and not returned
     * @param invalidateExternalCache whether to signal invalidation after each swap
     * @return the written artifacts, in kind order
     * @throws CompositionException if any kind fails to build (nothing is written) or a write
     *                              fails
     */
    public List<CacheArtifact> warm(Mode mode, boolean overwrite, boolean invalidateExternalCache) {
        Objects.requireNonNull(mode, "mode must not be null");
        List<ArtifactKind> kinds = new ArrayList<>();
        for (ArtifactKind kind : ArtifactKind.values()) {
            if (!overwrite && writer.store().exists(kind, mode)) {
                LOG.info("Artifact exists, skipped: kind={}, mode={}", kind, mode);
            } else {
                kinds.add(kind);
            }
        }
        if (kinds.isEmpty()) {
            return List.of();
        }

        Map<ArtifactKind, CompositionResult> results = buildKinds(mode, kinds);

        List<CacheArtifact> written = new ArrayList<>();
        for (ArtifactKind kind : kinds) {
            try {
                CacheArtifact artifact = writer.persist(results.get(kind), invalidateExternalCache);
                notifyWritten(new ArtifactWrittenEvent(artifact));
                written.add(artifact);
            } catch (CompositionException e) {
                notifyRejected(e, kind, mode);
                throw e;
            }
        }
        LOG.info("Warm complete: mode={}, written={}", mode, written.size());
        return Collections.unmodifiableList(written);
    }

    /**
     * Warms several modes in order. Modes are independent; a failure stops at the failing mode,
     * leaving modes already warmed in place.
     *
     * @return every written artifact
     */
    public List<CacheArtifact> warmAll(Collection<Mode> modes, boolean overwrite, boolean invalidateExternalCache) {
        Set<Mode> ordered = new LinkedHashSet<>(modes);
        List<CacheArtifact> written = new ArrayList<>();
        for (Mode mode : ordered) {
            written.addAll(warm(mode, overwrite, invalidateExternalCache));
        }
        return Collections.unmodifiableList(written);
    }

    private Map<ArtifactKind, CompositionResult> buildKinds(Mode mode, List<ArtifactKind> kinds) {
        Map<ArtifactKind, CompositionResult> results = new EnumMap<>(ArtifactKind.class);
        CompositionException first = null;
        for (ArtifactKind kind : kinds) {
            try {
                results.put(kind, build(mode, kind));
            } catch (CompositionException e) {
                if (first == null) {
                    first = e;
                } else {
                    first.addSuppressed(e);
                }
            }
        }
        if (first != null) {
            throw first;
        }
        return results;
    }

    private Composition compose(Mode mode, ArtifactKind kind, List<Layer> layers) {
        return switch (kind) {
            case CONFIG -> configCompositor.compose(mode, layers);
            case ROUTES -> routeCompositor.compose(mode, layers);
            case SERVICES -> serviceCompositor.compose(mode, layers);
        };
    }

    // --- Listener notification (exceptions caught and logged) ---

    private void notifyBuilt(ArtifactBuiltEvent event) {
        try {
            listener.onArtifactBuilt(event);
        } catch (RuntimeException e) {
            LOG.warn("CompositionListener.onArtifactBuilt failed", e);
        }
    }

    private void notifyWritten(ArtifactWrittenEvent event) {
        try {
            listener.onArtifactWritten(event);
        } catch (RuntimeException e) {
            LOG.warn("CompositionListener.onArtifactWritten failed", e);
        }
    }

    private void notifyRejected(CompositionException error, ArtifactKind kind, Mode mode) {
        List<Violation> violations = error instanceof ValidationException invalid ? invalid.violations() : List.of();
        try {
            listener.onBuildRejected(new BuildRejectedEvent(kind, mode, error.getMessage(), violations));
        } catch (RuntimeException e) {
            LOG.warn("CompositionListener.onBuildRejected failed", e);
        }
    }
}

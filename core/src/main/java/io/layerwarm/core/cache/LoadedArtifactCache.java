package io.layerwarm.core.cache;

import io.layerwarm.core.model.CompositionResult;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-process cache of loaded artifacts keyed by canonical identity.
 *
 * <p>
 * Registered as the {@link ArtifactInvalidator} of a {@link CacheWriter}, it drops an entry once
 * the artifact behind it has been swapped, so the next load reads the new file. Results are
 * immutable and safe to share across threads.
 */
public final class LoadedArtifactCache implements ArtifactInvalidator {

    private static final Logger LOG = LoggerFactory.getLogger(LoadedArtifactCache.class);

    private final Map<Path, CompositionResult> entries = new ConcurrentHashMap<>();

    CompositionResult computeIfAbsent(Path identity, Function<Path, CompositionResult> loader) {
        Objects.requireNonNull(identity, "identity must not be null");
        return entries.computeIfAbsent(identity, loader);
    }

    @Override
    public void invalidate(Path identity) {
        if (entries.remove(identity) != null) {
            LOG.debug("Evicted loaded artifact {}", identity);
        }
    }

    /** Drops every entry. */
    public void clear() {
        entries.clear();
    }

    public boolean contains(Path identity) {
        return entries.containsKey(identity);
    }

    public int size() {
        return entries.size();
    }
}

package io.layerwarm.core.cache;

import io.layerwarm.core.error.CacheWriteException;
import io.layerwarm.core.model.CacheArtifact;
import io.layerwarm.core.model.CompositionResult;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Persists composition results with write-then-swap.
 *
 * <p>
 * The artifact is written to a uniquely named temporary file in the cache directory, forced to
 * disk, then moved onto its canonical identity in one atomic step. A concurrent reader sees
 * either the previous file or the new one. Any failure before the move deletes the temporary
 * file and leaves the previous artifact untouched.
 *
 * <p>
 * Invalidation runs strictly after the move has committed, which for {@link AtomicMove#RENAME}
 * includes syncing the cache directory. An invalidator failure is logged and does not undo the
 * swap.
 *
 * <p>
 * Thread-safe: no mutable state. Two racing writers for the same identity are resolved by the
 * file system; the last move wins.
 */
public final class CacheWriter {

    private static final Logger LOG = LoggerFactory.getLogger(CacheWriter.class);

    private final ArtifactStore store;
    private final ArtifactInvalidator invalidator;
    private final AtomicMove atomicMove;
    private final Clock clock;

    public CacheWriter(ArtifactStore store, ArtifactInvalidator invalidator) {
        this(store, invalidator, AtomicMove.RENAME, Clock.systemUTC());
    }

    public CacheWriter(ArtifactStore store, ArtifactInvalidator invalidator, AtomicMove atomicMove, Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.invalidator = Objects.requireNonNull(invalidator, "invalidator must not be null");
        this.atomicMove = Objects.requireNonNull(atomicMove, "atomicMove must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public ArtifactStore store() {
        return store;
    }

    /** Persists and invalidates. */
    public CacheArtifact persist(CompositionResult result) {
        return persist(result, true);
    }

    /**
     * Persists one result onto its canonical identity.
     *
     * @param result     validated composition result
     * @param invalidate whether to call the invalidator after the swap
     * @return the committed artifact
     * @throws CacheWriteException if the write-then-swap did not complete
     */
    public CacheArtifact persist(CompositionResult result, boolean invalidate) {
        Objects.requireNonNull(result, "result must not be null");
        Path identity = store.identity(result.kind(), result.mode());
        byte[] bytes = ArtifactCodec.encode(result);

        Path temp = null;
        try {
            Files.createDirectories(store.cacheDir());
            temp = Files.createTempFile(
                    store.cacheDir(), "." + ArtifactStore.fileName(result.kind(), result.mode()) + ".", ".tmp");
            writeDurably(temp, bytes);
            atomicMove.move(temp, identity);
        } catch (IOException | RuntimeException e) {
            deleteQuietly(temp);
            throw new CacheWriteException(
                    "Failed to write " + result.kind() + " artifact for mode " + result.mode() + " to " + identity
                            + ": " + e.getMessage(),
                    e,
                    result.kind(),
                    identity);
        }

        CacheArtifact artifact =
                new CacheArtifact(result.kind(), result.mode(), identity, result.fingerprint(), clock.instant());
        LOG.info(
                "Artifact written: kind={}, mode={}, path={}, fingerprint={}",
                result.kind(),
                result.mode(),
                identity,
                result.fingerprint());

        if (invalidate) {
            try {
                invalidator.invalidate(identity);
            } catch (RuntimeException e) {
                LOG.warn("Cache invalidation failed for {}", identity, e);
            }
        }
        return artifact;
    }

    private static void writeDurably(Path file, byte[] bytes) throws IOException {
        try (FileChannel channel =
                FileChannel.open(file, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
            ByteBuffer buffer = ByteBuffer.wrap(bytes);
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            channel.force(true);
        }
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            LOG.warn("Could not delete temporary artifact {}", temp, e);
        }
    }
}

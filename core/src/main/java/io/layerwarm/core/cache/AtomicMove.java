package io.layerwarm.core.cache;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The swap step of write-then-swap: moves a fully written temporary file onto the canonical
 * identity in one atomic step. When {@link #move} returns the swap is committed; callers run
 * invalidation only after that.
 */
@FunctionalInterface
public interface AtomicMove {

    /**
     * Atomic rename within one directory, followed by a sync of that directory so the new entry
     * survives a crash. Fails with {@link java.nio.file.AtomicMoveNotSupportedException} rather
     * than degrading to a copy. File systems that cannot open a directory for syncing keep the
     * rename without the sync.
     */
    AtomicMove RENAME = (source, target) -> {
        Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        syncDirectory(target.toAbsolutePath().getParent());
    };

    /**
     * @param source fully written temporary file
     * @param target canonical identity
     * @throws IOException if the move did not happen
     */
    void move(Path source, Path target) throws IOException;

    /**
     * Forces a directory's entries to disk.
     *
     * @return {@code true} if the directory was synced, {@code false} if the platform does not
     *         support opening a directory for it
     */
    static boolean syncDirectory(Path directory) {
        try (FileChannel channel = FileChannel.open(directory, StandardOpenOption.READ)) {
            channel.force(true);
            return true;
        } catch (IOException | UnsupportedOperationException e) {
            Logger log = LoggerFactory.getLogger(AtomicMove.class);
            log.debug("Directory sync not supported for {}: {}", directory, e.toString());
            return false;
        }
    }
}

package io.layerwarm.core.layer;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolves provider references to sub-directories of a providers root: provider {@code blog}
 * reads its slots from {@code <root>/blog}. Nested references such as {@code acme/blog} are
 * allowed; references escaping the root are not resolved.
 */
public final class DirectoryProviderResolver implements ProviderResolver {

    private final Path root;

    public DirectoryProviderResolver(Path root) {
        this.root = Objects.requireNonNull(root, "root must not be null").toAbsolutePath().normalize();
    }

    @Override
    public Optional<LayerSource> resolve(String providerName) {
        if (providerName == null || providerName.isBlank()) {
            return Optional.empty();
        }
        Path dir = root.resolve(providerName).normalize();
        if (!dir.startsWith(root) || dir.equals(root) || !Files.isDirectory(dir)) {
            return Optional.empty();
        }
        return Optional.of(new DirectoryLayerSource(providerName, dir));
    }
}

package io.layerwarm.core.model;

import java.util.List;
import java.util.Objects;

/**
 * The three composed artifacts of one mode.
 *
 * @param config   configuration result
 * @param routes   routes result
 * @param services services result
 */
public record CompositionBundle(CompositionResult config, CompositionResult routes, CompositionResult services) {

    public CompositionBundle {
        requireKind(config, ArtifactKind.CONFIG);
        requireKind(routes, ArtifactKind.ROUTES);
        requireKind(services, ArtifactKind.SERVICES);
        if (!config.mode().equals(routes.mode()) || !config.mode().equals(services.mode())) {
            throw new IllegalArgumentException("All results of a bundle must share one mode");
        }
    }

    private static void requireKind(CompositionResult result, ArtifactKind kind) {
        Objects.requireNonNull(result, kind.token() + " must not be null");
        if (result.kind() != kind) {
            throw new IllegalArgumentException("Expected " + kind + " result, got: " + result.kind());
        }
    }

    public Mode mode() {
        return config.mode();
    }

    /** Results in {@link ArtifactKind} order. */
    public List<CompositionResult> all() {
        return List.of(config, routes, services);
    }

    public ConfigTree configTree() {
        return ConfigTree.from(config);
    }

    public RouteTable routeTable() {
        return RouteTable.from(routes);
    }

    public ServiceRegistry serviceRegistry() {
        return ServiceRegistry.from(services);
    }
}

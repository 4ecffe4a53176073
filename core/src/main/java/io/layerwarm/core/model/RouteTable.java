package io.layerwarm.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only routing table: literal paths to {@link RouteEntry}, plus the ordered
 * {@link PatternRoute} list stored under the reserved {@value #PATTERN_KEY} key.
 *
 * <p>
 * Built once from a validated result. Thread-safe: all collections are unmodifiable.
 */
public final class RouteTable {

    /** Reserved top-level key holding the ordered pattern-route list. */
    public static final String PATTERN_KEY = "regex";

    private final CompositionResult result;
    private final Map<String, RouteEntry> routes;
    private final List<PatternRoute> patternRoutes;

    private RouteTable(CompositionResult result, Map<String, RouteEntry> routes, List<PatternRoute> patternRoutes) {
        this.result = result;
        this.routes = Collections.unmodifiableMap(routes);
        this.patternRoutes = Collections.unmodifiableList(patternRoutes);
    }

    /**
     * Builds the typed table from a validated routes result.
     *
     * @param result a {@link ArtifactKind#ROUTES} result
     * @return the table
     * @throws IllegalArgumentException if the result is not a routes result
     */
    public static RouteTable from(CompositionResult result) {
        Objects.requireNonNull(result, "result must not be null");
        if (result.kind() != ArtifactKind.ROUTES) {
            throw new IllegalArgumentException("Expected a routes result, got: " + result.kind());
        }
        Map<String, RouteEntry> routes = new LinkedHashMap<>();
        List<PatternRoute> patterns = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = result.tree().fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (PATTERN_KEY.equals(field.getKey())) {
                int index = 0;
                for (JsonNode item : field.getValue()) {
                    patterns.add(PatternRoute.fromNode(index++, item));
                }
            } else {
                routes.put(field.getKey(), RouteEntry.fromNode(field.getKey(), field.getValue()));
            }
        }
        return new RouteTable(result, routes, patterns);
    }

    public Mode mode() {
        return result.mode();
    }

    /** The underlying immutable result. */
    public CompositionResult result() {
        return result;
    }

    /** Exact lookup by literal path. */
    public Optional<RouteEntry> route(String path) {
        return Optional.ofNullable(routes.get(path));
    }

    /** All literal paths, in canonical order. */
    public Set<String> paths() {
        return routes.keySet();
    }

    /** All literal routes keyed by path. */
    public Map<String, RouteEntry> routes() {
        return routes;
    }

    /** Pattern routes in evaluation order. */
    public List<PatternRoute> patternRoutes() {
        return patternRoutes;
    }

    /** Number of literal routes plus pattern routes. */
    public int size() {
        return routes.size() + patternRoutes.size();
    }
}

package io.layerwarm.core.validate;

import com.fasterxml.jackson.databind.JsonNode;
import io.layerwarm.core.model.ArtifactKind;
import io.layerwarm.core.model.Composition;
import io.layerwarm.core.model.Layer;
import io.layerwarm.core.model.PatternRoute;
import io.layerwarm.core.model.RouteEntry;
import io.layerwarm.core.model.RouteTable;
import io.layerwarm.core.model.ServiceDefinition;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Structural validation of composed artifacts before they may be persisted.
 *
 * <p>
 * Validation is exhaustive: every violation in the artifact is collected in one pass so that a
 * single corrected build can fix all of them.
 *
 * <ul>
 * <li>routes: every path entry and every pattern-route item is a mapping with non-blank
 * {@code controller} and {@code action} and a non-empty {@code methods}; pattern items also need
 * a non-blank {@code pattern}; the pattern key holds a list</li>
 * <li>services: every definition is a non-blank class name or a mapping with a non-blank
 * {@code class} and optional {@code options} holding only scalars, lists and mappings</li>
 * <li>config: the top level is a mapping; shape below that is free as long as it is plain
 * data (a YAML {@code !!binary} value, for instance, is rejected)</li>
 * </ul>
 *
 * <p>
 * Thread-safe: stateless.
 */
public final class ArtifactValidator {

    private static final Set<String> SERVICE_KEYS = Set.of(ServiceDefinition.CLASS, ServiceDefinition.OPTIONS);

    /**
     * Validates a composition.
     *
     * @param composition the merged artifact and its origins
     * @return the validation outcome
     */
    public ValidationResult validate(Composition composition) {
        List<Violation> violations = new ArrayList<>();
        switch (composition.kind()) {
            case CONFIG -> validateConfig(composition, violations);
            case ROUTES -> validateRoutes(composition, violations);
            case SERVICES -> validateServices(composition, violations);
            default -> throw new IllegalStateException("Unexpected kind: " + composition.kind());
        }
        return new ValidationResult(composition.kind(), violations);
    }

    // --- Config ---

    private void validateConfig(Composition composition, List<Violation> violations) {
        Iterator<Map.Entry<String, JsonNode>> fields = composition.tree().fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            requireDeclarative(
                    composition, field.getKey(), field.getValue(), composition.originOf(field.getKey()), violations);
        }
    }

    // --- Routes ---

    private void validateRoutes(Composition composition, List<Violation> violations) {
        Iterator<Map.Entry<String, JsonNode>> fields = composition.tree().fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String path = field.getKey();
            JsonNode entry = field.getValue();
            Optional<Layer> origin = composition.originOf(path);
            if (RouteTable.PATTERN_KEY.equals(path)) {
                validatePatternRoutes(composition, entry, origin, violations);
                continue;
            }
            if (!entry.isObject()) {
                violations.add(
                        violation(composition, path, origin, "route entry must be a mapping, got " + typeName(entry)));
                continue;
            }
            requireRouteFields(composition, path, entry, origin, violations);
        }
    }

    private void validatePatternRoutes(
            Composition composition, JsonNode list, Optional<Layer> origin, List<Violation> violations) {
        if (!list.isArray()) {
            String detail = "pattern routes must be a list, got " + typeName(list);
            violations.add(violation(composition, RouteTable.PATTERN_KEY, origin, detail));
            return;
        }
        for (int i = 0; i < list.size(); i++) {
            String key = RouteTable.PATTERN_KEY + "[" + i + "]";
            JsonNode item = list.get(i);
            if (!item.isObject()) {
                violations.add(
                        violation(composition, key, origin, "pattern route must be a mapping, got " + typeName(item)));
                continue;
            }
            if (!isNonBlankText(item.get(PatternRoute.PATTERN))) {
                violations.add(violation(composition, key, origin, "missing or empty '" + PatternRoute.PATTERN + "'"));
            }
            requireRouteFields(composition, key, item, origin, violations);
        }
    }

    private void requireRouteFields(
            Composition composition,
            String key,
            JsonNode entry,
            Optional<Layer> origin,
            List<Violation> violations) {
        if (!isNonBlankText(entry.get(RouteEntry.CONTROLLER))) {
            violations.add(violation(composition, key, origin, "missing or empty '" + RouteEntry.CONTROLLER + "'"));
        }
        if (!isNonBlankText(entry.get(RouteEntry.ACTION))) {
            violations.add(violation(composition, key, origin, "missing or empty '" + RouteEntry.ACTION + "'"));
        }
        if (!hasMethods(entry.get(RouteEntry.METHODS))) {
            String detail = "missing or empty '" + RouteEntry.METHODS + "' (expected a non-empty list of method names)";
            violations.add(violation(composition, key, origin, detail));
        }
    }

    private static boolean hasMethods(JsonNode methods) {
        if (methods == null) {
            return false;
        }
        if (methods.isTextual()) {
            return !methods.asText().isBlank();
        }
        if (!methods.isArray() || methods.isEmpty()) {
            return false;
        }
        for (JsonNode method : methods) {
            if (!isNonBlankText(method)) {
                return false;
            }
        }
        return true;
    }

    // --- Services ---

    private void validateServices(Composition composition, List<Violation> violations) {
        Iterator<Map.Entry<String, JsonNode>> fields = composition.tree().fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String id = field.getKey();
            JsonNode definition = field.getValue();
            Optional<Layer> origin = composition.originOf(id);

            if (id.isBlank()) {
                violations.add(violation(composition, id, origin, "service identifier must not be blank"));
            }
            if (definition.isTextual()) {
                if (definition.asText().isBlank()) {
                    violations.add(violation(composition, id, origin, "class reference must not be blank"));
                }
                continue;
            }
            if (!definition.isObject()) {
                String detail = "definition must be a class name or a {" + ServiceDefinition.CLASS + ", "
                        + ServiceDefinition.OPTIONS + "} mapping, got " + typeName(definition);
                violations.add(violation(composition, id, origin, detail));
                continue;
            }
            definition.fieldNames().forEachRemaining(key -> {
                if (!SERVICE_KEYS.contains(key)) {
                    String detail = "unknown key '" + key + "', recognized keys are: " + SERVICE_KEYS;
                    violations.add(violation(composition, id, origin, detail));
                }
            });
            if (!isNonBlankText(definition.get(ServiceDefinition.CLASS))) {
                String detail = "missing or empty '" + ServiceDefinition.CLASS + "' reference";
                violations.add(violation(composition, id, origin, detail));
            }
            JsonNode options = definition.get(ServiceDefinition.OPTIONS);
            if (options != null && !options.isNull()) {
                String optionsKey = id + "." + ServiceDefinition.OPTIONS;
                if (!options.isObject()) {
                    String detail = "options must be a mapping, got " + typeName(options);
                    violations.add(violation(composition, optionsKey, origin, detail));
                } else {
                    requireDeclarative(composition, optionsKey, options, origin, violations);
                }
            }
        }
    }

    /** Inert data only: scalars, lists and mappings thereof, nothing opaque. */
    private void requireDeclarative(
            Composition composition, String key, JsonNode node, Optional<Layer> origin, List<Violation> violations) {
        if (node.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                requireDeclarative(composition, key + "." + field.getKey(), field.getValue(), origin, violations);
            }
        } else if (node.isArray()) {
            for (int i = 0; i < node.size(); i++) {
                requireDeclarative(composition, key + "[" + i + "]", node.get(i), origin, violations);
            }
        } else if (!(node.isTextual() || node.isNumber() || node.isBoolean() || node.isNull())) {
            String detail = "value must be a scalar, list or mapping, got " + typeName(node);
            violations.add(violation(composition, key, origin, detail));
        }
    }

    // --- Helpers ---

    private static boolean isNonBlankText(JsonNode node) {
        return node != null && node.isTextual() && !node.asText().isBlank();
    }

    private static String typeName(JsonNode node) {
        return node.getNodeType().name().toLowerCase(Locale.ROOT);
    }

    private static Violation violation(Composition composition, String key, Optional<Layer> origin, String detail) {
        ArtifactKind kind = composition.kind();
        return origin.map(layer -> new Violation(kind, layer.order(), layer.id(), key, detail))
                .orElseGet(() -> new Violation(kind, null, null, key, detail));
    }
}

package io.layerwarm.core.validate;

import io.layerwarm.core.error.MalformedPayloadException;
import io.layerwarm.core.error.MissingRouteFieldException;
import io.layerwarm.core.error.UnresolvableServiceDefinitionException;
import io.layerwarm.core.error.ValidationException;
import io.layerwarm.core.model.ArtifactKind;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Outcome of validating one composed artifact: either valid, or the complete list of
 * violations.
 *
 * @param kind       artifact kind
 * @param violations every violation found, in discovery order
 */
public record ValidationResult(ArtifactKind kind, List<Violation> violations) {

    public ValidationResult {
        Objects.requireNonNull(kind, "kind must not be null");
        violations = List.copyOf(violations);
    }

    public boolean isValid() {
        return violations.isEmpty();
    }

    /**
     * Throws the kind-specific validation exception carrying every violation.
     *
     * @throws MissingRouteFieldException             for invalid routes
     * @throws UnresolvableServiceDefinitionException for invalid services
     * @throws MalformedPayloadException              for invalid configuration
     */
    public void throwIfInvalid() {
        if (isValid()) {
            return;
        }
        throw toException();
    }

    /** Builds the kind-specific exception. Only meaningful when invalid. */
    public ValidationException toException() {
        String message = kind + " build failed with " + violations.size() + " violation(s):\n"
                + violations.stream().map(v -> "  - " + v.describe()).collect(Collectors.joining("\n"));
        return switch (kind) {
            case ROUTES -> new MissingRouteFieldException(message, violations);
            case SERVICES -> new UnresolvableServiceDefinitionException(message, violations);
            case CONFIG -> new MalformedPayloadException(message, kind, violations);
        };
    }
}

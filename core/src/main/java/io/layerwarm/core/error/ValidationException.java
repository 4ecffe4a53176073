package io.layerwarm.core.error;

import io.layerwarm.core.model.ArtifactKind;
import io.layerwarm.core.validate.Violation;
import java.util.List;

/**
 * Abstract parent for structural validation failures. Validation is exhaustive, so the
 * exception carries every violation found in one pass, not just the first.
 */
public abstract class ValidationException extends CompositionException {

    private static final long serialVersionUID = 1L;

    private final List<Violation> violations;

    protected ValidationException(String message, ArtifactKind kind, List<Violation> violations) {
        super(message, kind, Phase.BUILD);
        this.violations = List.copyOf(violations);
    }

    /** All violations found, in discovery order. Never empty. */
    public List<Violation> violations() {
        return violations;
    }
}

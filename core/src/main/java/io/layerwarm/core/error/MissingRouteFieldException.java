package io.layerwarm.core.error;

import io.layerwarm.core.model.ArtifactKind;
import io.layerwarm.core.validate.Violation;
import java.util.List;

/** Thrown when one or more route entries lack {@code controller}, {@code action} or {@code methods}. */
public final class MissingRouteFieldException extends ValidationException {

    private static final long serialVersionUID = 1L;

    public MissingRouteFieldException(String message, List<Violation> violations) {
        super(message, ArtifactKind.ROUTES, violations);
    }
}

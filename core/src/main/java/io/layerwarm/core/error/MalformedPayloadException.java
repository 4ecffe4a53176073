package io.layerwarm.core.error;

import io.layerwarm.core.model.ArtifactKind;
import io.layerwarm.core.validate.Violation;
import java.util.List;

/**
 * Thrown when a payload is not a mapping where one is required: a layer slot whose top level is
 * a list or scalar, or a composed route or service entry that is not a mapping.
 */
public final class MalformedPayloadException extends ValidationException {

    private static final long serialVersionUID = 1L;

    public MalformedPayloadException(String message, ArtifactKind kind, List<Violation> violations) {
        super(message, kind, violations);
    }
}

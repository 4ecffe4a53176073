package io.layerwarm.core.error;

import io.layerwarm.core.model.ArtifactKind;
import io.layerwarm.core.validate.Violation;
import java.util.List;

/**
 * Thrown when one or more service definitions lack a usable class reference or carry an option
 * value that is not plain data.
 */
public final class UnresolvableServiceDefinitionException extends ValidationException {

    private static final long serialVersionUID = 1L;

    public UnresolvableServiceDefinitionException(String message, List<Violation> violations) {
        super(message, ArtifactKind.SERVICES, violations);
    }
}

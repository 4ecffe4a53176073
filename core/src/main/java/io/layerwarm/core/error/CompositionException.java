package io.layerwarm.core.error;

import io.layerwarm.core.model.ArtifactKind;

/**
 * Abstract base for all layerwarm exceptions. Never thrown directly; use the concrete
 * subclasses under {@link LayerException}, {@link ValidationException}, or the persistence and
 * load exceptions.
 */
public abstract class CompositionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        BUILD,
        PERSIST,
        LOAD
    }

    private final ArtifactKind kind;
    private final Phase phase;

    protected CompositionException(String message, ArtifactKind kind, Phase phase) {
        super(message);
        this.kind = kind;
        this.phase = phase;
    }

    protected CompositionException(String message, Throwable cause, ArtifactKind kind, Phase phase) {
        super(message, cause);
        this.kind = kind;
        this.phase = phase;
    }

    /** The artifact kind being built, persisted or loaded, or {@code null} if not known. */
    public ArtifactKind kind() {
        return kind;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}

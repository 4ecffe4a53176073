package io.layerwarm.core.model;

import java.util.Locale;

/** The three independently composed artifacts of an application. */
public enum ArtifactKind {
    CONFIG("config"),
    ROUTES("routes"),
    SERVICES("services");

    private final String token;

    ArtifactKind(String token) {
        this.token = token;
    }

    /** Slot and file-name token, e.g. {@code routes}. */
    public String token() {
        return token;
    }

    /**
     * Resolves a kind from its token (case-insensitive).
     *
     * @param token the token
     * @return the matching kind
     * @throws IllegalArgumentException if no kind matches
     */
    public static ArtifactKind fromToken(String token) {
        if (token != null) {
            String normalized = token.trim().toLowerCase(Locale.ROOT);
            for (ArtifactKind kind : values()) {
                if (kind.token.equals(normalized)) {
                    return kind;
                }
            }
        }
        throw new IllegalArgumentException("Unknown artifact kind: '" + token + "'");
    }

    @Override
    public String toString() {
        return token;
    }
}

package io.layerwarm.core.model;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Execution mode token. Each mode is an independent universe: its layers are read, composed,
 * cached and loaded separately and are never merged with another mode's.
 *
 * <p>
 * The token becomes part of artifact file names, so it is restricted to lower-case letters,
 * digits, {@code _} and {@code -}, starting with a letter.
 *
 * @param token the mode token, e.g. {@code http}
 */
public record Mode(String token) {

    private static final Pattern TOKEN = Pattern.compile("[a-z][a-z0-9_-]*");

    /** Request-handling universe. */
    public static final Mode HTTP = new Mode("http");

    /** Command-line universe. */
    public static final Mode CLI = new Mode("cli");

    public Mode {
        Objects.requireNonNull(token, "token must not be null");
        if (!isValidToken(token)) {
            throw new IllegalArgumentException(
                    "Invalid mode token '" + token + "': expected lower-case [a-z][a-z0-9_-]*");
        }
    }

    /**
     * Parses a mode token, trimming surrounding whitespace.
     *
     * @param token raw token
     * @return the mode
     * @throws IllegalArgumentException if the token is not a valid mode token
     */
    public static Mode of(String token) {
        Objects.requireNonNull(token, "token must not be null");
        return new Mode(token.trim());
    }

    /** Returns {@code true} if {@code token} is usable as a mode or environment token. */
    public static boolean isValidToken(String token) {
        return token != null && TOKEN.matcher(token).matches();
    }

    @Override
    public String toString() {
        return token;
    }
}

package io.layerwarm.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Objects;

/**
 * Final, immutable merged structure for one artifact kind and mode.
 *
 * <p>
 * The tree is held in canonical form and never handed out directly: {@link #tree()} and
 * {@link #get(String)} return copies. A result is replaced wholesale by the next build, never
 * patched.
 *
 * <p>
 * Thread-safe: all state is private, final and never exposed.
 */
public final class CompositionResult {

    private final ArtifactKind kind;
    private final Mode mode;
    private final ObjectNode tree;
    private final String fingerprint;

    public CompositionResult(ArtifactKind kind, Mode mode, ObjectNode tree) {
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.mode = Objects.requireNonNull(mode, "mode must not be null");
        this.tree = CanonicalJson.canonicalize(Objects.requireNonNull(tree, "tree must not be null"));
        this.fingerprint = CanonicalJson.fingerprint(this.tree);
    }

    public ArtifactKind kind() {
        return kind;
    }

    public Mode mode() {
        return mode;
    }

    /** Returns a deep copy of the canonical tree. */
    public ObjectNode tree() {
        return tree.deepCopy();
    }

    /**
     * Returns a copy of the value stored under a top-level key.
     *
     * @param key top-level key
     * @return the value copy, or null if absent
     */
    public JsonNode get(String key) {
        JsonNode node = tree.get(key);
        return node != null ? node.deepCopy() : null;
    }

    /** Returns {@code true} if the top-level key is present. */
    public boolean has(String key) {
        return tree.has(key);
    }

    /** Number of top-level entries. */
    public int size() {
        return tree.size();
    }

    /** SHA-256 hex digest of the canonical tree. */
    public String fingerprint() {
        return fingerprint;
    }

    /** Canonical pretty-printed bytes of the tree. */
    public byte[] toCanonicalBytes() {
        return CanonicalJson.toPrettyBytes(tree);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CompositionResult other)) {
            return false;
        }
        return kind == other.kind && mode.equals(other.mode) && tree.equals(other.tree);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, mode, fingerprint);
    }

    @Override
    public String toString() {
        return "CompositionResult[kind=" + kind + ", mode=" + mode + ", entries=" + tree.size() + ", fingerprint="
                + fingerprint + "]";
    }
}

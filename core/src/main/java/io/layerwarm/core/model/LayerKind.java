package io.layerwarm.core.model;

/** Role of a layer in the fixed composition order. */
public enum LayerKind {
    /** Vendor defaults, always first. */
    BASELINE,
    /** Optional feature package, in the order the application lists them. */
    PROVIDER,
    /** Application base layer. */
    APP_BASE,
    /** Per-environment application overlay, always last when present. */
    APP_ENV
}

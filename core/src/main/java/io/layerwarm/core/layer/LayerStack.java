package io.layerwarm.core.layer;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Explicit declaration of an application's ordered layers: vendor baseline, providers in the
 * order the application lists them, application base, optional environment overlay.
 *
 * <p>
 * The order is never inferred (e.g. alphabetically); it is exactly the order given here.
 * Provider references are resolved lazily, at read time, through the {@link ProviderResolver}.
 *
 * @param baseline  vendor baseline source
 * @param providers provider references in listed order
 * @param resolver  resolves provider references to sources
 * @param appBase   application base source
 * @param appEnv    environment overlay source, or null if none
 */
public record LayerStack(
        LayerSource baseline,
        List<String> providers,
        ProviderResolver resolver,
        LayerSource appBase,
        LayerSource appEnv) {

    public LayerStack {
        Objects.requireNonNull(baseline, "baseline must not be null");
        Objects.requireNonNull(resolver, "resolver must not be null");
        Objects.requireNonNull(appBase, "appBase must not be null");
        providers = List.copyOf(providers);
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < providers.size(); i++) {
            String provider = providers.get(i);
            if (provider.isBlank()) {
                throw new IllegalArgumentException("Provider #" + i + " has a blank reference");
            }
            if (!seen.add(provider)) {
                throw new IllegalArgumentException("Provider '" + provider + "' is listed more than once (#" + i + ")");
            }
        }
    }

    /** The environment overlay, if configured. */
    public Optional<LayerSource> appEnvOverlay() {
        return Optional.ofNullable(appEnv);
    }

    /** Layer position of the application base: after the baseline and every provider. */
    public int appBasePosition() {
        return 1 + providers.size();
    }

    /** Layer position of the environment overlay. */
    public int appEnvPosition() {
        return 2 + providers.size();
    }

    /**
     * Returns a new {@link Builder}.
     *
     * @return a fresh builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link LayerStack}. */
    public static final class Builder {

        private LayerSource baseline = ClasspathLayerSource.bundledBaseline();
        private final List<String> providers = new ArrayList<>();
        private ProviderResolver resolver = name -> Optional.empty();
        private LayerSource appBase;
        private LayerSource appEnv;

        Builder() {}

        /** Replaces the bundled vendor baseline. */
        public Builder baseline(LayerSource baseline) {
            this.baseline = baseline;
            return this;
        }

        /** Appends a provider reference; call order is layer order. */
        public Builder provider(String providerName) {
            this.providers.add(Objects.requireNonNull(providerName, "providerName must not be null"));
            return this;
        }

        /** Appends provider references in the given order. */
        public Builder providers(List<String> providerNames) {
            providerNames.forEach(this::provider);
            return this;
        }

        public Builder resolver(ProviderResolver resolver) {
            this.resolver = resolver;
            return this;
        }

        public Builder appBase(LayerSource appBase) {
            this.appBase = appBase;
            return this;
        }

        public Builder appEnv(LayerSource appEnv) {
            this.appEnv = appEnv;
            return this;
        }

        public LayerStack build() {
            return new LayerStack(baseline, providers, resolver, appBase, appEnv);
        }
    }
}

package io.layerwarm.core.layer;

import java.util.Optional;

/** Resolves a provider reference, as listed by the application, to its layer source. */
@FunctionalInterface
public interface ProviderResolver {

    /**
     * @param providerName the provider reference
     * @return the provider's source, or empty if the reference cannot be resolved
     */
    Optional<LayerSource> resolve(String providerName);
}

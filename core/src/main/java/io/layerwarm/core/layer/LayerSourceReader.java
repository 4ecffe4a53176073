package io.layerwarm.core.layer;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.layerwarm.core.error.LayerResolutionException;
import io.layerwarm.core.error.MalformedPayloadException;
import io.layerwarm.core.model.ArtifactKind;
import io.layerwarm.core.model.Layer;
import io.layerwarm.core.model.LayerKind;
import io.layerwarm.core.model.Mode;
import io.layerwarm.core.validate.Violation;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Retrieves the ordered layer payloads for one mode and artifact kind. Performs no merging.
 *
 * <p>
 * Layers come back in the fixed order baseline, providers in listed order, application base,
 * environment overlay. Absent slots are omitted rather than replaced with empty placeholders.
 * Each layer's {@link Layer#order()} is its declared position in the {@link LayerStack}
 * (baseline 0, provider {@code i} at {@code 1 + i}, and so on), so positions stay stable
 * whether or not earlier layers contribute to a kind.
 *
 * <p>
 * The environment overlay does not contribute to {@link ArtifactKind#SERVICES}: services compose
 * from the baseline, the providers and the application base only. A services slot present in
 * the overlay is logged at WARN and left out.
 *
 * <p>
 * Thread-safe if the configured sources are.
 */
public final class LayerSourceReader {

    private static final Logger LOG = LoggerFactory.getLogger(LayerSourceReader.class);

    private final LayerStack stack;

    public LayerSourceReader(LayerStack stack) {
        this.stack = Objects.requireNonNull(stack, "stack must not be null");
    }

    public LayerStack stack() {
        return stack;
    }

    /**
     * Collects the ordered layers for a mode and kind.
     *
     * @param mode execution mode
     * @param kind artifact kind
     * @return ordered, unmodifiable list of contributing layers
     * @throws LayerResolutionException  if a listed provider cannot be resolved or a slot cannot
     *                                   be read
     * @throws MalformedPayloadException if a slot's top level is not a mapping
     */
    public List<Layer> collectLayers(Mode mode, ArtifactKind kind) {
        Objects.requireNonNull(mode, "mode must not be null");
        Objects.requireNonNull(kind, "kind must not be null");

        List<Layer> layers = new ArrayList<>();
        addSlot(layers, stack.baseline(), LayerKind.BASELINE, 0, mode, kind);

        List<String> providers = stack.providers();
        for (int i = 0; i < providers.size(); i++) {
            String name = providers.get(i);
            int providerIndex = i;
            int position = 1 + i;
            LayerSource source = stack.resolver()
                    .resolve(name)
                    .orElseThrow(() -> new LayerResolutionException(
                            "Layer #" + position + " (provider #" + providerIndex + ") '" + name
                                    + "' cannot be resolved to a layer source",
                            kind,
                            position,
                            name));
            addSlot(layers, source, LayerKind.PROVIDER, position, mode, kind);
        }

        addSlot(layers, stack.appBase(), LayerKind.APP_BASE, stack.appBasePosition(), mode, kind);
        Optional<LayerSource> overlay = stack.appEnvOverlay();
        if (overlay.isPresent()) {
            if (kind == ArtifactKind.SERVICES) {
                warnIgnoredServicesOverlay(overlay.get(), mode);
            } else {
                addSlot(layers, overlay.get(), LayerKind.APP_ENV, stack.appEnvPosition(), mode, kind);
            }
        }

        LOG.debug("Collected {} {} layer(s) for mode {}", layers.size(), kind, mode);
        return Collections.unmodifiableList(layers);
    }

    /** Services take no environment overlay; a slot found there is reported, never merged. */
    private static void warnIgnoredServicesOverlay(LayerSource overlay, Mode mode) {
        boolean present;
        try {
            present = overlay.slot(mode, ArtifactKind.SERVICES).isPresent();
        } catch (RuntimeException e) {
            LOG.warn(
                    "Ignoring unreadable services slot of layer '{}' for mode {}: services have no environment overlay",
                    overlay.id(),
                    mode,
                    e);
            return;
        }
        if (present) {
            LOG.warn(
                    "Ignoring services slot of layer '{}' for mode {}: services have no environment overlay",
                    overlay.id(),
                    mode);
        }
    }

    private void addSlot(
            List<Layer> layers,
            LayerSource source,
            LayerKind layerKind,
            int position,
            Mode mode,
            ArtifactKind kind) {
        Optional<JsonNode> slot;
        try {
            slot = source.slot(mode, kind);
        } catch (LayerResolutionException e) {
            throw new LayerResolutionException(e.getMessage(), e, kind, position, source.id());
        } catch (UncheckedIOException e) {
            throw new LayerResolutionException(
                    "Layer #" + position + " '" + source.id() + "' cannot be read: " + e.getMessage(),
                    e,
                    kind,
                    position,
                    source.id());
        }
        if (slot.isEmpty()) {
            return;
        }
        JsonNode payload = slot.get();
        if (!payload.isObject()) {
            Violation violation = new Violation(
                    kind,
                    position,
                    source.id(),
                    kind.token(),
                    "slot payload must be a mapping, got " + payload.getNodeType().name().toLowerCase(Locale.ROOT));
            throw new MalformedPayloadException(
                    "Malformed " + kind + " payload: " + violation.describe(), kind, List.of(violation));
        }
        layers.add(new Layer(layerKind, position, source.id(), (ObjectNode) payload));
    }
}

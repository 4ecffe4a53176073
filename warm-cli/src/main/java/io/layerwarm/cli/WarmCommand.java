package io.layerwarm.cli;

import io.layerwarm.cli.config.WarmConfig;
import io.layerwarm.core.cache.ArtifactInvalidator;
import io.layerwarm.core.cache.ArtifactStore;
import io.layerwarm.core.cache.CacheWriter;
import io.layerwarm.core.engine.CompositionEngine;
import io.layerwarm.core.error.CompositionException;
import io.layerwarm.core.error.LayerException;
import io.layerwarm.core.error.ValidationException;
import io.layerwarm.core.layer.ClasspathLayerSource;
import io.layerwarm.core.layer.DirectoryLayerSource;
import io.layerwarm.core.layer.DirectoryProviderResolver;
import io.layerwarm.core.layer.LayerSource;
import io.layerwarm.core.layer.LayerSourceReader;
import io.layerwarm.core.layer.LayerStack;
import io.layerwarm.core.model.CacheArtifact;
import io.layerwarm.core.model.Mode;
import io.layerwarm.core.spi.CompositionListener;
import io.layerwarm.core.validate.Violation;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wires a {@link CompositionEngine} from the tool configuration and runs the warm step.
 *
 * <p>
 * Layer stack: the baseline directory (or the bundled baseline), the configured providers
 * resolved under the providers directory, the application directory, and the application
 * directory's {@code <kind>.<environment>.yaml} overlay.
 */
final class WarmCommand {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;

    private static final Logger LOG = LoggerFactory.getLogger(WarmCommand.class);

    /** A separate process holds no loaded artifacts, so invalidation is only recorded. */
    private static final ArtifactInvalidator LOGGING_INVALIDATOR =
            identity -> LOG.info("Invalidation signalled for {}", identity);

    private final WarmConfig config;
    private final WarmOptions options;
    private final PrintStream out;

    WarmCommand(WarmConfig config, WarmOptions options, PrintStream out) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.out = Objects.requireNonNull(out, "out must not be null");
    }

    static LayerStack layerStack(WarmConfig config) {
        LayerSource baseline = config.baselineDir() != null
                ? new DirectoryLayerSource("baseline", config.baselineDir())
                : ClasspathLayerSource.bundledBaseline();
        return LayerStack.builder()
                .baseline(baseline)
                .providers(config.providers())
                .resolver(new DirectoryProviderResolver(config.providersDir()))
                .appBase(new DirectoryLayerSource("app", config.appDir()))
                .appEnv(new DirectoryLayerSource("app:" + config.environment(), config.appDir(), config.environment()))
                .build();
    }

    List<Mode> modes() {
        return options.modes().isEmpty() ? config.modes() : options.modes();
    }

    /**
     * Warms every selected mode. Prints one line per written artifact to {@code out}; failures
     * are reported through the log.
     *
     * @return {@link #EXIT_OK} or {@link #EXIT_FAILED}
     */
    int run() {
        boolean overwrite = config.overwrite() && !options.noOverwrite();
        boolean invalidate = config.invalidate() && !options.noInvalidate();
        ArtifactStore store = new ArtifactStore(config.cacheDir());
        LayerStack stack;
        try {
            stack = layerStack(config);
        } catch (IllegalArgumentException e) {
            LOG.error("Invalid layer stack: {}", e.getMessage());
            return EXIT_FAILED;
        }
        CompositionEngine engine = new CompositionEngine(
                new LayerSourceReader(stack), new CacheWriter(store, LOGGING_INVALIDATOR), CompositionListener.NONE);

        LOG.info(
                "Warming modes={}, environment={}, providers={}, cache={}, overwrite={}, invalidate={}",
                modes(),
                config.environment(),
                config.providers(),
                store.cacheDir(),
                overwrite,
                invalidate);

        List<CacheArtifact> written;
        try {
            written = engine.warmAll(modes(), overwrite, invalidate);
        } catch (CompositionException e) {
            for (String line : report(e)) {
                LOG.error(line);
            }
            return EXIT_FAILED;
        }
        for (CacheArtifact artifact : written) {
            out.println(artifact.kind().token() + " " + artifact.mode() + " " + artifact.identity() + " "
                    + artifact.fingerprint());
        }
        LOG.info("Warm finished: {} artifact(s) written", written.size());
        return EXIT_OK;
    }

    /**
     * Renders a failure as report lines: one per violation, naming kind, layer position, layer
     * id and key. Suppressed failures of other kinds follow.
     */
    static List<String> report(CompositionException error) {
        List<String> lines = new ArrayList<>();
        appendReport(error, lines);
        for (Throwable suppressed : error.getSuppressed()) {
            if (suppressed instanceof CompositionException other) {
                appendReport(other, lines);
            }
        }
        return lines;
    }

    private static void appendReport(CompositionException error, List<String> lines) {
        String kind = error.kind() != null ? error.kind().token() : "unknown";
        if (error instanceof ValidationException invalid) {
            lines.add(kind + " build failed with " + invalid.violations().size() + " violation(s)");
            for (Violation v : invalid.violations()) {
                lines.add("  - " + describe(v));
            }
        } else if (error instanceof LayerException layer) {
            lines.add(kind + " build failed at layer " + position(layer.layerPosition()) + " '" + layer.layerId()
                    + "': " + firstLine(error.getMessage()));
        } else {
            lines.add(kind + " " + error.phase().name().toLowerCase(Locale.ROOT) + " failed: "
                    + firstLine(error.getMessage()));
        }
    }

    private static String describe(Violation v) {
        return "kind=" + v.kind().token() + " layer=" + position(v.layerPosition()) + " id='" + v.layerId()
                + "' key='" + v.key() + "': " + v.detail();
    }

    private static String position(Integer position) {
        return position != null ? "#" + position : "?";
    }

    private static String firstLine(String message) {
        if (message == null) {
            return "";
        }
        int newline = message.indexOf('\n');
        return newline < 0 ? message : message.substring(0, newline);
    }
}

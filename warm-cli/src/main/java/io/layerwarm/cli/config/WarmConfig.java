package io.layerwarm.cli.config;

import io.layerwarm.core.model.Mode;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration of the warm tool.
 *
 * <p>
 * Every field has a default. Use {@link #builder()} to construct instances.
 *
 * @param environment   environment name selecting the application overlay files
 *                      ({@code <kind>.<environment>.yaml})
 * @param modes         modes to warm, in order
 * @param baselineDir   vendor baseline directory, or null for the bundled classpath baseline
 * @param providersDir  directory holding one sub-directory per provider
 * @param providers     provider names in merge order
 * @param appDir        application layer directory
 * @param cacheDir      artifact cache directory
 * @param overwrite     rewrite artifacts that already exist
 * @param invalidate    signal cache invalidation after each swap
 * @param loggingFormat json or text
 * @param loggingLevel  root log level
 * @param loggerLevels  per-logger levels applied on top of the root level, keyed by logger name
 */
public record WarmConfig(
        String environment,
        List<Mode> modes,
        Path baselineDir,
        Path providersDir,
        List<String> providers,
        Path appDir,
        Path cacheDir,
        boolean overwrite,
        boolean invalidate,
        String loggingFormat,
        String loggingLevel,
        Map<String, String> loggerLevels) {

    public WarmConfig {
        modes = List.copyOf(modes);
        providers = List.copyOf(providers);
        loggerLevels = Map.copyOf(loggerLevels);
    }

    /** Creates a new builder with the documented defaults. */
    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link WarmConfig}. */
    public static final class Builder {
        private String environment = "prod";
        private List<Mode> modes = List.of(Mode.HTTP, Mode.CLI);
        private Path baselineDir;
        private Path providersDir = Path.of("vendor");
        private List<String> providers = new ArrayList<>();
        private Path appDir = Path.of("config");
        private Path cacheDir = Path.of("var", "cache");
        private boolean overwrite = true;
        private boolean invalidate = true;
        private String loggingFormat = "text";
        private String loggingLevel = "INFO";
        private Map<String, String> loggerLevels = new LinkedHashMap<>();

        Builder() {}

        public Builder environment(String environment) {
            this.environment = environment;
            return this;
        }

        public Builder modes(List<Mode> modes) {
            this.modes = modes;
            return this;
        }

        public Builder baselineDir(Path baselineDir) {
            this.baselineDir = baselineDir;
            return this;
        }

        public Builder providersDir(Path providersDir) {
            this.providersDir = providersDir;
            return this;
        }

        public Builder providers(List<String> providers) {
            this.providers = providers;
            return this;
        }

        public Builder appDir(Path appDir) {
            this.appDir = appDir;
            return this;
        }

        public Builder cacheDir(Path cacheDir) {
            this.cacheDir = cacheDir;
            return this;
        }

        public Builder overwrite(boolean overwrite) {
            this.overwrite = overwrite;
            return this;
        }

        public Builder invalidate(boolean invalidate) {
            this.invalidate = invalidate;
            return this;
        }

        public Builder loggingFormat(String loggingFormat) {
            this.loggingFormat = loggingFormat;
            return this;
        }

        public Builder loggingLevel(String loggingLevel) {
            this.loggingLevel = loggingLevel;
            return this;
        }

        public Builder loggerLevels(Map<String, String> loggerLevels) {
            this.loggerLevels = loggerLevels;
            return this;
        }

        public WarmConfig build() {
            return new WarmConfig(
                    environment,
                    modes,
                    baselineDir,
                    providersDir,
                    providers,
                    appDir,
                    cacheDir,
                    overwrite,
                    invalidate,
                    loggingFormat,
                    loggingLevel,
                    loggerLevels);
        }
    }
}

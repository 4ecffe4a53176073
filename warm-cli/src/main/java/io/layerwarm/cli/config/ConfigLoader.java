package io.layerwarm.cli.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.layerwarm.core.model.Mode;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Loads {@link WarmConfig} from a YAML file with an environment variable overlay.
 *
 * <p>
 * Supports two invocation patterns:
 * <ul>
 * <li>Default: loads {@code layerwarm.yaml} from the current directory if it exists, otherwise
 * starts from the builder defaults</li>
 * <li>{@code --config /path/to/layerwarm.yaml}: loads from the given path, which must exist</li>
 * </ul>
 *
 * <p>
 * Env vars take precedence over YAML values. An env var is considered "set" if and only if it
 * is defined AND its trimmed value is non-empty; empty or whitespace-only values leave the YAML
 * value in place.
 *
 * <table>
 * <caption>Environment overlay</caption>
 * <tr><th>YAML key</th><th>Env var</th></tr>
 * <tr><td>environment</td><td>APP_ENVIRONMENT</td></tr>
 * <tr><td>modes</td><td>WARM_MODES (comma-separated)</td></tr>
 * <tr><td>layers.baseline</td><td>WARM_BASELINE_DIR</td></tr>
 * <tr><td>layers.providers-dir</td><td>WARM_PROVIDERS_DIR</td></tr>
 * <tr><td>layers.app-dir</td><td>WARM_APP_DIR</td></tr>
 * <tr><td>cache.dir</td><td>WARM_CACHE_DIR</td></tr>
 * <tr><td>cache.overwrite</td><td>WARM_OVERWRITE</td></tr>
 * <tr><td>cache.invalidate</td><td>WARM_INVALIDATE</td></tr>
 * <tr><td>logging.format</td><td>LOG_FORMAT</td></tr>
 * <tr><td>logging.level</td><td>LOG_LEVEL</td></tr>
 * </table>
 *
 * <p>
 * {@code logging.loggers} maps logger names to levels (for example
 * {@code io.layerwarm.core.cache: DEBUG}) and has no environment counterpart.
 */
public final class ConfigLoader {

    static final String DEFAULT_CONFIG_FILE = "layerwarm.yaml";

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private static final Map<String, Set<String>> KNOWN_KEYS = Map.of(
            "environment", Set.of(),
            "modes", Set.of(),
            "layers", Set.of("baseline", "providers-dir", "providers", "app-dir"),
            "cache", Set.of("dir", "overwrite", "invalidate"),
            "logging", Set.of("format", "level", "loggers"));

    private static final Set<String> LOGGING_FORMATS = Set.of("json", "text");

    private static final Set<String> LOG_LEVELS = Set.of("TRACE", "DEBUG", "INFO", "WARN", "ERROR", "OFF");

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads a {@link WarmConfig} from the given file, applying overrides from
     * {@link System#getenv}.
     *
     * @param configPath path to the YAML configuration file
     * @return the validated configuration
     * @throws ConfigLoadException if the file is missing, unparseable or invalid
     */
    public static WarmConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads a {@link WarmConfig} from the given file, applying overrides from the supplied
     * lookup function. Returning {@code null} from the lookup means the variable is not defined.
     *
     * @param configPath path to the YAML configuration file
     * @param envLookup  environment variable lookup function
     * @return the validated configuration
     * @throws ConfigLoadException if the file is missing, unparseable or invalid
     */
    public static WarmConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException(
                    "Configuration file not found: " + configPath + ". Use --config <path> to specify a config file.");
        }
        JsonNode root;
        try (InputStream in = Files.newInputStream(configPath)) {
            root = YAML_MAPPER.readTree(in);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        }
        return fromTree(root, envLookup);
    }

    /**
     * Builds the configuration from defaults and the environment only, for when no file exists.
     *
     * @param envLookup environment variable lookup function
     * @return the validated configuration
     */
    public static WarmConfig defaults(Function<String, String> envLookup) {
        return fromTree(null, envLookup);
    }

    /**
     * Loads the configuration named by {@code --config}, or the default file if present, or
     * defaults plus environment.
     *
     * @param args      command-line arguments
     * @param envLookup environment variable lookup function
     * @return the validated configuration
     */
    public static WarmConfig resolve(String[] args, Function<String, String> envLookup) {
        Path explicit = explicitConfigPath(args);
        if (explicit != null) {
            return load(explicit, envLookup);
        }
        Path fallback = Path.of(DEFAULT_CONFIG_FILE);
        return Files.exists(fallback) ? load(fallback, envLookup) : defaults(envLookup);
    }

    /**
     * Returns the path following {@code --config}, or null if the flag is absent.
     *
     * @throws IllegalArgumentException if the flag has no value
     */
    static Path explicitConfigPath(String[] args) {
        for (int i = 0; i < args.length; i++) {
            if ("--config".equals(args[i])) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("--config requires a file path argument");
                }
                return Path.of(args[i + 1]);
            }
        }
        return null;
    }

    private static WarmConfig fromTree(JsonNode root, Function<String, String> envLookup) {
        WarmConfig.Builder builder = WarmConfig.builder();
        if (root != null && !root.isMissingNode() && !root.isNull()) {
            if (!root.isObject()) {
                throw new ConfigLoadException("Configuration root must be a mapping");
            }
            rejectUnknownKeys(root);
            mapYaml(root, builder);
        }
        applyEnvOverrides(builder, envLookup);
        WarmConfig config = builder.build();
        validate(config);
        return config;
    }

    private static void mapYaml(JsonNode root, WarmConfig.Builder builder) {
        if (root.has("environment")) builder.environment(root.get("environment").asText());
        if (root.has("modes")) builder.modes(parseModes(root.get("modes"), "modes"));

        JsonNode layers = root.path("layers");
        if (layers.hasNonNull("baseline")) builder.baselineDir(Path.of(layers.get("baseline").asText()));
        if (layers.has("providers-dir"))
            builder.providersDir(Path.of(layers.get("providers-dir").asText()));
        if (layers.has("providers")) builder.providers(parseStrings(layers.get("providers"), "layers.providers"));
        if (layers.has("app-dir")) builder.appDir(Path.of(layers.get("app-dir").asText()));

        JsonNode cache = root.path("cache");
        if (cache.has("dir")) builder.cacheDir(Path.of(cache.get("dir").asText()));
        if (cache.has("overwrite")) builder.overwrite(requireBoolean(cache.get("overwrite"), "cache.overwrite"));
        if (cache.has("invalidate"))
            builder.invalidate(requireBoolean(cache.get("invalidate"), "cache.invalidate"));

        JsonNode logging = root.path("logging");
        if (logging.has("format")) builder.loggingFormat(logging.get("format").asText());
        if (logging.has("level")) builder.loggingLevel(logging.get("level").asText());
        if (logging.has("loggers")) builder.loggerLevels(parseLoggerLevels(logging.get("loggers")));
    }

    /**
     * Applies environment variable overrides to the builder. {@code layers.providers} has no
     * environment counterpart.
     */
    private static void applyEnvOverrides(WarmConfig.Builder builder, Function<String, String> envLookup) {
        envString(envLookup, "APP_ENVIRONMENT", builder::environment);
        envString(envLookup, "WARM_MODES", value -> builder.modes(parseModeList(value, "WARM_MODES")));
        envString(envLookup, "WARM_BASELINE_DIR", value -> builder.baselineDir(Path.of(value)));
        envString(envLookup, "WARM_PROVIDERS_DIR", value -> builder.providersDir(Path.of(value)));
        envString(envLookup, "WARM_APP_DIR", value -> builder.appDir(Path.of(value)));
        envString(envLookup, "WARM_CACHE_DIR", value -> builder.cacheDir(Path.of(value)));
        envBool(envLookup, "WARM_OVERWRITE", builder::overwrite);
        envBool(envLookup, "WARM_INVALIDATE", builder::invalidate);
        envString(envLookup, "LOG_FORMAT", builder::loggingFormat);
        envString(envLookup, "LOG_LEVEL", builder::loggingLevel);
    }

    private static void validate(WarmConfig config) {
        if (!Mode.isValidToken(config.environment())) {
            throw new ConfigLoadException("environment must be a lower-case token, got: '" + config.environment()
                    + "'");
        }
        if (config.modes().isEmpty()) {
            throw new ConfigLoadException("modes must list at least one mode");
        }
        Set<String> seen = new HashSet<>();
        for (String provider : config.providers()) {
            if (!seen.add(provider)) {
                throw new ConfigLoadException("layers.providers lists '" + provider + "' more than once");
            }
        }
        if (config.cacheDir() == null || config.cacheDir().toString().isBlank()) {
            throw new ConfigLoadException("cache.dir is required");
        }
        if (config.loggingFormat() == null
                || !LOGGING_FORMATS.contains(config.loggingFormat().toLowerCase(Locale.ROOT))) {
            throw new ConfigLoadException(
                    "logging.format must be one of " + LOGGING_FORMATS + ", got: '" + config.loggingFormat() + "'");
        }
        requireLevel(config.loggingLevel(), "logging.level");
        config.loggerLevels().forEach((logger, level) -> requireLevel(level, "logging.loggers." + logger));
    }

    private static void rejectUnknownKeys(JsonNode root) {
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            Set<String> children = KNOWN_KEYS.get(field.getKey());
            if (children == null) {
                throw new ConfigLoadException("Unknown configuration key: " + field.getKey());
            }
            if (!children.isEmpty()) {
                if (!field.getValue().isObject()) {
                    throw new ConfigLoadException(field.getKey() + " must be a mapping");
                }
                field.getValue().fieldNames().forEachRemaining(child -> {
                    if (!children.contains(child)) {
                        throw new ConfigLoadException("Unknown configuration key: " + field.getKey() + "." + child);
                    }
                });
            }
        }
    }

    // --- Value helpers ---

    private static List<Mode> parseModes(JsonNode node, String key) {
        List<Mode> modes = new ArrayList<>();
        for (String token : parseStrings(node, key)) {
            modes.add(parseMode(token, key));
        }
        return modes;
    }

    private static List<Mode> parseModeList(String value, String key) {
        List<Mode> modes = new ArrayList<>();
        for (String token : value.split(",")) {
            if (!token.isBlank()) {
                modes.add(parseMode(token, key));
            }
        }
        return modes;
    }

    private static Mode parseMode(String token, String key) {
        try {
            return Mode.of(token);
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException(key + ": " + e.getMessage(), e);
        }
    }

    private static List<String> parseStrings(JsonNode node, String key) {
        if (!node.isArray()) {
            throw new ConfigLoadException(key + " must be a list");
        }
        List<String> values = new ArrayList<>();
        for (JsonNode item : node) {
            if (!item.isTextual() || item.asText().isBlank()) {
                throw new ConfigLoadException(key + " entries must be non-blank strings");
            }
            values.add(item.asText().trim());
        }
        return values;
    }

    private static Map<String, String> parseLoggerLevels(JsonNode node) {
        if (!node.isObject()) {
            throw new ConfigLoadException("logging.loggers must be a mapping of logger name to level");
        }
        Map<String, String> levels = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!field.getValue().isTextual()) {
                throw new ConfigLoadException("logging.loggers." + field.getKey() + " must be a level name");
            }
            levels.put(field.getKey(), field.getValue().asText().trim());
        }
        return levels;
    }

    private static void requireLevel(String level, String key) {
        if (level == null || !LOG_LEVELS.contains(level.toUpperCase(Locale.ROOT))) {
            throw new ConfigLoadException(key + " must be one of " + LOG_LEVELS + ", got: '" + level + "'");
        }
    }

    private static boolean requireBoolean(JsonNode node, String key) {
        if (!node.isBoolean()) {
            throw new ConfigLoadException(key + " must be true or false, got: " + node);
        }
        return node.booleanValue();
    }

    // --- Env var helpers ---

    /**
     * Returns {@code true} if the env var is "set": defined AND non-blank after trimming.
     */
    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    /** Applies a string env var override if set. */
    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }

    /** Applies a boolean env var override if set. Only {@code true} and {@code false} are accepted. */
    private static void envBool(Function<String, String> envLookup, String envVar, Consumer<Boolean> setter) {
        if (isSet(envLookup, envVar)) {
            String value = envLookup.apply(envVar).trim().toLowerCase(Locale.ROOT);
            if (!"true".equals(value) && !"false".equals(value)) {
                throw new ConfigLoadException(envVar + " must be true or false, got: '" + value + "'");
            }
            setter.accept(Boolean.parseBoolean(value));
        }
    }
}

package io.layerwarm.cli;

import io.layerwarm.cli.config.ConfigLoadException;
import io.layerwarm.cli.config.ConfigLoader;
import io.layerwarm.cli.config.WarmConfig;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the warm tool.
 *
 * <p>
 * Loads the configuration, configures logging, and warms every selected mode. Exits with status
 * 0 on success and 1 on any failure, after logging a report that names the artifact kind, layer
 * position, layer id and offending key of each violation.
 */
public final class WarmMain {

    private static final Logger LOG = LoggerFactory.getLogger(WarmMain.class);

    private WarmMain() {
        // utility class
    }

    /**
     * Application entry point.
     *
     * @param args command-line arguments (e.g. {@code --config layerwarm.yaml --mode http})
     */
    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        System.exit(run(args, System::getenv));
    }

    /**
     * Runs the tool without exiting the JVM.
     *
     * @param args      command-line arguments
     * @param envLookup environment variable lookup function
     * @return the process exit status
     */
    static int run(String[] args, Function<String, String> envLookup) {
        WarmOptions options;
        WarmConfig config;
        try {
            options = WarmOptions.parse(args);
            config = ConfigLoader.resolve(args, envLookup);
        } catch (ConfigLoadException | IllegalArgumentException e) {
            LOG.error("Startup failed: {}", e.getMessage());
            return WarmCommand.EXIT_FAILED;
        }
        LogbackConfigurator.configure(config);
        return new WarmCommand(config, options, System.out).run();
    }
}

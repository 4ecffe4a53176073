package io.layerwarm.cli;

import io.layerwarm.core.model.Mode;
import java.util.ArrayList;
import java.util.List;

/**
 * Command-line flags of the warm tool. Flags override the loaded configuration.
 *
 * <pre>
 * WarmMain [--config path] [--mode m]... [--no-overwrite] [--no-invalidate]
 * </pre>
 *
 * @param modes        modes given with {@code --mode}; empty means use the configured modes
 * @param noOverwrite  {@code --no-overwrite} was given
 * @param noInvalidate {@code --no-invalidate} was given
 */
record WarmOptions(List<Mode> modes, boolean noOverwrite, boolean noInvalidate) {

    static final String USAGE = "Usage: WarmMain [--config path] [--mode m]... [--no-overwrite] [--no-invalidate]";

    WarmOptions {
        modes = List.copyOf(modes);
    }

    /**
     * Parses command-line flags. {@code --config} is consumed by the config loader and skipped
     * here.
     *
     * @throws IllegalArgumentException on an unknown flag or a missing value
     */
    static WarmOptions parse(String[] args) {
        List<Mode> modes = new ArrayList<>();
        boolean noOverwrite = false;
        boolean noInvalidate = false;
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--config" -> i++;
                case "--mode" -> {
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("--mode requires a mode argument");
                    }
                    modes.add(Mode.of(args[++i]));
                }
                case "--no-overwrite" -> noOverwrite = true;
                case "--no-invalidate" -> noInvalidate = true;
                default -> throw new IllegalArgumentException("Unknown argument: " + args[i] + "\n" + USAGE);
            }
        }
        return new WarmOptions(modes, noOverwrite, noInvalidate);
    }
}

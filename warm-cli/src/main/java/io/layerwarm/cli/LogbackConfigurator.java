package io.layerwarm.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.JsonEncoder;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.encoder.Encoder;
import io.layerwarm.cli.config.WarmConfig;
import java.util.Map;
import org.slf4j.LoggerFactory;

/**
 * Programmatic Logback configuration for the warm tool.
 *
 * <p>
 * Called once the tool configuration is loaded. The root logger gets a single stderr appender,
 * so stdout carries only the list of written artifacts and can be piped. {@code logging.level}
 * sets the root level; {@code logging.loggers} then overrides it per logger, e.g. DEBUG for
 * {@code io.layerwarm.core.cache} to trace every write and invalidation.
 */
public final class LogbackConfigurator {

    /** Human-readable pattern for text mode. */
    static final String TEXT_PATTERN = "%d{HH:mm:ss.SSS} %-5level %logger{36} - %msg%n";

    static final String APPENDER_NAME = "STDERR";

    private LogbackConfigurator() {
        // utility class
    }

    /** Configures Logback from the logging section of the tool configuration. */
    public static void configure(WarmConfig config) {
        configure(config.loggingFormat(), config.loggingLevel(), config.loggerLevels());
    }

    /**
     * Configures the Logback root logger and the given per-logger levels.
     *
     * @param format       "json" for Logback's {@link JsonEncoder}, anything else for the text pattern
     * @param level        root level name, INFO if unrecognized
     * @param loggerLevels level name per logger name; previously set logger levels are cleared
     */
    public static void configure(String format, String level, Map<String, String> loggerLevels) {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        Logger rootLogger = context.getLogger(Logger.ROOT_LOGGER_NAME);

        for (Logger logger : context.getLoggerList()) {
            if (logger != rootLogger) {
                logger.setLevel(null);
            }
        }
        Level rootLevel = Level.toLevel(level, Level.INFO);
        rootLogger.setLevel(rootLevel);
        loggerLevels.forEach((name, value) -> context.getLogger(name).setLevel(Level.toLevel(value, rootLevel)));

        rootLogger.detachAndStopAllAppenders();
        ConsoleAppender<ILoggingEvent> appender = new ConsoleAppender<>();
        appender.setContext(context);
        appender.setName(APPENDER_NAME);
        appender.setTarget("System.err");
        appender.setEncoder(encoder(context, format));
        appender.start();
        rootLogger.addAppender(appender);
    }

    private static Encoder<ILoggingEvent> encoder(LoggerContext context, String format) {
        if ("json".equalsIgnoreCase(format)) {
            JsonEncoder encoder = new JsonEncoder();
            encoder.setContext(context);
            encoder.start();
            return encoder;
        }
        PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(context);
        encoder.setPattern(TEXT_PATTERN);
        encoder.start();
        return encoder;
    }
}

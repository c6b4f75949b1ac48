package org.smpels.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;
import org.slf4j.LoggerFactory;
import org.smpels.mcs.diagnostics.AnalysisLogger;

import java.util.Map;

/**
 * Applies logging settings from HOCON configuration and from the command line's verbosity to Logback.
 *
 * <h3>Configuration Structure:</h3>
 * <pre>
 * smpe.lint.logging {
 *   default-level = "WARN"  # Default log level for all loggers
 *   levels {
 *     "org.smpels.mcs.frontend" = "DEBUG"
 *   }
 * }
 * </pre>
 */
public final class LoggingConfigurator {

    private static final org.slf4j.Logger LOGGER = LoggerFactory.getLogger(LoggingConfigurator.class);
    private static final String LOGGING_CONFIG_PATH = "smpe.lint.logging";
    private static final String DEFAULT_LEVEL_KEY = "default-level";
    private static final String LEVELS_KEY = "levels";
    private static final String BASE_LOGGER = "org.smpels";

    private LoggingConfigurator() {}

    /**
     * Configures logger levels from the configuration.
     * @param config The merged linter configuration.
     */
    public static void configure(Config config) {
        if (!config.hasPath(LOGGING_CONFIG_PATH)) {
            LOGGER.debug("No logging configuration found, using Logback defaults.");
            return;
        }
        Config loggingConfig = config.getConfig(LOGGING_CONFIG_PATH);
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

        if (loggingConfig.hasPath(DEFAULT_LEVEL_KEY)) {
            Level level = Level.toLevel(loggingConfig.getString(DEFAULT_LEVEL_KEY), Level.WARN);
            context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(level);
            LOGGER.debug("Configured default log level: {}", level);
        }

        if (loggingConfig.hasPath(LEVELS_KEY)) {
            for (Map.Entry<String, ConfigValue> entry : loggingConfig.getConfig(LEVELS_KEY).root().entrySet()) {
                String loggerName = entry.getKey();
                String levelName = entry.getValue().unwrapped().toString();
                context.getLogger(loggerName).setLevel(Level.toLevel(levelName, Level.INFO));
                LOGGER.debug("Configured logger '{}' to level: {}", loggerName, levelName);
            }
        }
    }

    /**
     * Raises the level of the application loggers and of the analysis tracing.
     * @param verbosity The number of {@code -v} flags: 0 keeps the defaults, 1 means INFO, 2 DEBUG, 3 or more TRACE.
     */
    public static void applyVerbosity(int verbosity) {
        if (verbosity <= 0) {
            return;
        }
        Level level = switch (verbosity) {
            case 1 -> Level.INFO;
            case 2 -> Level.DEBUG;
            default -> Level.TRACE;
        };
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        context.getLogger(BASE_LOGGER).setLevel(level);
        AnalysisLogger.setLevel(AnalysisLogger.WARN + verbosity);
    }
}

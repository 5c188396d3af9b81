package org.tfviewer.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigValue;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Applies the {@code logging} block of the application config to Logback.
 * <pre>
 * logging {
 *   format = "PLAIN"          # PLAIN or JSON, selects the appender in logback.xml
 *   default-level = "WARN"    # root logger level
 *   levels {
 *     "org.tfviewer.datapipeline.services.ingestion" = "INFO"
 *   }
 * }
 * </pre>
 * The format has to be known before Logback reads logback.xml, so {@link #formatProperty(Config)}
 * is applied separately from {@link #configure(Config)}, which only changes levels.
 */
public final class LoggingConfigurator {

    /**
     * System property read by logback.xml to pick the console appender.
     */
    public static final String FORMAT_PROPERTY = "tfviewer.logging.format";

    private static final org.slf4j.Logger LOGGER = LoggerFactory.getLogger(LoggingConfigurator.class);
    private static final String LOGGING_PATH = "logging";

    private static boolean configured = false;

    private LoggingConfigurator() {
    }

    /**
     * @return The appender name for the configured format: {@code STDOUT_PLAIN} for PLAIN,
     *         {@code STDOUT} (JSON) otherwise.
     */
    public static String formatProperty(Config config) {
        String format = config.hasPath(LOGGING_PATH + ".format") ? config.getString(LOGGING_PATH + ".format") : "PLAIN";
        return "PLAIN".equalsIgnoreCase(format) ? "STDOUT_PLAIN" : "STDOUT";
    }

    /**
     * Sets the root level and the per-logger levels. Only the first call has an effect.
     */
    public static synchronized void configure(Config config) {
        if (configured) {
            LOGGER.debug("Logging already configured, skipping.");
            return;
        }
        configured = true;
        if (!config.hasPath(LOGGING_PATH)) {
            LOGGER.debug("No logging configuration found, using Logback defaults.");
            return;
        }
        Config logging = config.getConfig(LOGGING_PATH);
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        try {
            if (logging.hasPath("default-level")) {
                Level level = Level.toLevel(logging.getString("default-level"), Level.WARN);
                context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(level);
            }
            if (logging.hasPath("levels")) {
                for (Map.Entry<String, ConfigValue> entry : logging.getConfig("levels").root().entrySet()) {
                    String name = entry.getKey();
                    String levelName = String.valueOf(entry.getValue().unwrapped());
                    context.getLogger(name).setLevel(Level.toLevel(levelName, Level.INFO));
                    LOGGER.debug("Logger '{}' set to {}", name, levelName);
                }
            }
        } catch (ConfigException e) {
            LOGGER.warn("Ignoring invalid logging configuration: {}", e.getMessage());
        }
    }

    /**
     * Allows {@link #configure(Config)} to run again. For tests.
     */
    public static synchronized void reset() {
        configured = false;
    }
}

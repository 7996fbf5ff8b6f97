package org.gridsnake.node.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;
import org.slf4j.LoggerFactory;

import java.net.URL;
import java.util.Locale;
import java.util.Map;

/**
 * Applies the {@code logging} block of the application configuration to Logback.
 *
 * <pre>
 * logging {
 *   format = PLAIN            # PLAIN or JSON
 *   default-level = WARN      # root logger
 *   levels {
 *     "org.gridsnake.runtime.systems" = DEBUG
 *   }
 * }
 * </pre>
 *
 * The format is handed to logback.xml through {@link #FORMAT_PROPERTY}, which names the console
 * appender the root logger writes to.
 */
public final class LoggingConfigurator {

    private static final org.slf4j.Logger LOG = LoggerFactory.getLogger(LoggingConfigurator.class);

    /**
     * System and context property read by logback.xml to pick the console appender.
     */
    public static final String FORMAT_PROPERTY = "gridsnake.logging.format";

    private static final String LOGGING_PATH = "logging";
    private static final String LOGBACK_RESOURCE = "logback.xml";

    /**
     * Console output formats and the logback.xml appender each one maps to.
     */
    public enum LogFormat {
        PLAIN("STDOUT"),
        JSON("STDOUT_JSON");

        private final String appender;

        LogFormat(String appender) {
            this.appender = appender;
        }

        public String appender() {
            return appender;
        }

        /**
         * @param name a format name in any case; unknown names fall back to PLAIN
         */
        public static LogFormat parse(String name) {
            if (name != null && "JSON".equals(name.trim().toUpperCase(Locale.ROOT))) {
                return JSON;
            }
            return PLAIN;
        }
    }

    private static boolean applied = false;

    private LoggingConfigurator() {
    }

    /**
     * Applies format, root level and per-logger levels. Only the first call after startup (or
     * after {@link #reset()}) has an effect.
     *
     * @param config the resolved application configuration
     */
    public static synchronized void configure(final Config config) {
        if (applied) {
            return;
        }
        applied = true;
        if (!config.hasPath(LOGGING_PATH)) {
            LOG.debug("No logging block configured, keeping Logback defaults");
            return;
        }
        final Config logging = config.getConfig(LOGGING_PATH);
        final LoggerContext context = context();
        try {
            final LogFormat format = LogFormat.parse(logging.hasPath("format") ? logging.getString("format") : null);
            context.putProperty(FORMAT_PROPERTY, format.appender());
            System.setProperty(FORMAT_PROPERTY, format.appender());

            if (logging.hasPath("default-level")) {
                final Level rootLevel = Level.toLevel(logging.getString("default-level"), Level.WARN);
                context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(rootLevel);
            }
            if (logging.hasPath("levels")) {
                for (final Map.Entry<String, ConfigValue> entry : logging.getConfig("levels").root().entrySet()) {
                    final String levelName = String.valueOf(entry.getValue().unwrapped());
                    context.getLogger(entry.getKey()).setLevel(Level.toLevel(levelName, Level.INFO));
                }
            }
            LOG.debug("Logging configured: format {}", format);
        } catch (final RuntimeException e) {
            LOG.error("Invalid logging configuration, keeping Logback defaults", e);
        }
    }

    /**
     * @param format "PLAIN" or "JSON" in any case; anything else counts as PLAIN
     * @return the logback.xml appender name for the format
     */
    public static String appenderFor(final String format) {
        return LogFormat.parse(format).appender();
    }

    /**
     * Re-reads logback.xml with the given format selected. Logback resolves the appender
     * reference only while parsing, so switching to JSON after startup needs a reload.
     *
     * @param format the format to switch to
     */
    public static synchronized void reload(final LogFormat format) {
        System.setProperty(FORMAT_PROPERTY, format.appender());
        final URL configuration = LoggingConfigurator.class.getClassLoader().getResource(LOGBACK_RESOURCE);
        if (configuration == null) {
            LOG.warn("{} not found on the classpath, keeping the current Logback setup", LOGBACK_RESOURCE);
            return;
        }
        final LoggerContext context = context();
        final JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);
        context.reset();
        try {
            configurator.doConfigure(configuration);
        } catch (final JoranException e) {
            // Logback is unusable at this point, so stderr is the only channel left.
            System.err.println("Failed to reload " + LOGBACK_RESOURCE + ": " + e.getMessage());
        }
        applied = false;
    }

    /**
     * Allows {@link #configure(Config)} to run again. Used by tests.
     */
    public static synchronized void reset() {
        applied = false;
    }

    private static LoggerContext context() {
        return (LoggerContext) LoggerFactory.getILoggerFactory();
    }
}

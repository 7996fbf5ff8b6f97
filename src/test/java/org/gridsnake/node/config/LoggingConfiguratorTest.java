package org.gridsnake.node.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the LoggingConfigurator class.
 */
@Tag("unit")
class LoggingConfiguratorTest {

    private static final String PROBE_LOGGER = "org.gridsnake.probe";

    private LoggerContext context;
    private Level rootLevel;

    @BeforeEach
    void setUp() {
        LoggingConfigurator.reset();
        context = (LoggerContext) LoggerFactory.getILoggerFactory();
        rootLevel = context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel();
    }

    @AfterEach
    void tearDown() {
        LoggingConfigurator.reset();
        context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(rootLevel);
        context.getLogger(PROBE_LOGGER).setLevel(null);
        context.putProperty(LoggingConfigurator.FORMAT_PROPERTY, "STDOUT");
        System.clearProperty(LoggingConfigurator.FORMAT_PROPERTY);
    }

    @Test
    void configure_withJsonFormat_selectsJsonAppender() {
        final Config config = ConfigFactory.parseString("""
            logging {
              format = "JSON"
            }
            """);

        LoggingConfigurator.configure(config);

        assertEquals("STDOUT_JSON", context.getProperty(LoggingConfigurator.FORMAT_PROPERTY));
        assertEquals("STDOUT_JSON", System.getProperty(LoggingConfigurator.FORMAT_PROPERTY));
    }

    @Test
    void configure_appliesDefaultAndSpecificLevels() {
        final Config config = ConfigFactory.parseString("""
            logging {
              default-level = "ERROR"
              levels {
                "org.gridsnake.probe" = "DEBUG"
              }
            }
            """);

        LoggingConfigurator.configure(config);

        assertEquals(Level.ERROR, context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel());
        assertEquals(Level.DEBUG, context.getLogger(PROBE_LOGGER).getLevel());
    }

    @Test
    void configure_isIdempotentUntilReset() {
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.levels { \"org.gridsnake.probe\" = WARN }"));
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.levels { \"org.gridsnake.probe\" = TRACE }"));

        assertEquals(Level.WARN, context.getLogger(PROBE_LOGGER).getLevel());

        LoggingConfigurator.reset();
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.levels { \"org.gridsnake.probe\" = TRACE }"));

        assertEquals(Level.TRACE, context.getLogger(PROBE_LOGGER).getLevel());
    }

    @Test
    void configure_withoutLoggingBlock_changesNothing() {
        LoggingConfigurator.configure(ConfigFactory.empty());

        assertEquals(rootLevel, context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel());
    }

    @Test
    void appenderFor_mapsFormats() {
        assertEquals("STDOUT_JSON", LoggingConfigurator.appenderFor("json"));
        assertEquals("STDOUT", LoggingConfigurator.appenderFor("PLAIN"));
        assertEquals("STDOUT", LoggingConfigurator.appenderFor("anything"));
    }
}

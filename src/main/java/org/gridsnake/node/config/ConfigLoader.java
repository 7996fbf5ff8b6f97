package org.gridsnake.node.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Builds the application configuration from layered HOCON sources. Higher layers win:
 * <ol>
 *   <li>environment variables</li>
 *   <li>system properties, e.g. {@code -Dgridsnake.arena.width=20}</li>
 *   <li>the configuration file ({@value #CONFIG_FILE_NAME} or the one given with {@code --config})</li>
 *   <li>reference.conf on the classpath</li>
 * </ol>
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    /**
     * Name of the configuration file looked up in the working directory.
     */
    public static final String CONFIG_FILE_NAME = "gridsnake.conf";

    private static final String DEFAULTS_RESOURCE = "reference.conf";

    private ConfigLoader() {
    }

    /**
     * @return the configuration with {@value #CONFIG_FILE_NAME} from the working directory as file layer
     */
    public static Config load() {
        return load(new File(CONFIG_FILE_NAME));
    }

    /**
     * @param configFile the file layer; skipped if it does not exist
     * @return the resolved configuration
     */
    public static Config load(final File configFile) {
        final Config fileLayer;
        if (configFile != null && configFile.isFile()) {
            LOG.info("Reading configuration file {}", configFile.getAbsolutePath());
            fileLayer = ConfigFactory.parseFile(configFile);
        } else {
            LOG.info("No configuration file at {}, using defaults",
                configFile == null ? CONFIG_FILE_NAME : configFile.getPath());
            fileLayer = ConfigFactory.empty();
        }
        return ConfigFactory.systemEnvironment()
            .withFallback(ConfigFactory.systemProperties())
            .withFallback(fileLayer)
            .withFallback(defaults())
            .resolve();
    }

    private static Config defaults() {
        return ConfigFactory.parseResources(DEFAULTS_RESOURCE);
    }
}

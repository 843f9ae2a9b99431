package org.seanet.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigParseOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.nio.file.Path;

/**
 * Responsible for loading the compiler configuration from various sources.
 * The loader respects a specific precedence order to allow for flexible configuration.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    static final String CONFIG_FILE_NAME = "seanet.conf";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the configuration, respecting the precedence order:
     * 1. Environment Variables ({@code CONFIG_FORCE_} overrides)
     * 2. Java System Properties, e.g. {@code -Dseanet.compiler.dump-ast=true}
     * 3. Configuration file (the explicit file, else seanet.conf in the working directory)
     * 4. Default values (from reference.conf on the classpath)
     *
     * @param explicitConfigFile The file given on the command line, or null.
     * @return A resolved {@link Config} object containing the merged configuration.
     * @throws com.typesafe.config.ConfigException if the explicit file is missing or a file cannot be parsed.
     */
    public static Config load(final File explicitConfigFile) {
        return load(explicitConfigFile, Path.of(""));
    }

    static Config load(final File explicitConfigFile, final Path workingDirectory) {
        final Config envConfig = ConfigFactory.systemEnvironmentOverrides();
        final Config sysPropConfig = ConfigFactory.systemProperties();

        final Config fileConfig;
        if (explicitConfigFile != null) {
            LOG.debug("Loading configuration from file specified via --config: {}", explicitConfigFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(explicitConfigFile, ConfigParseOptions.defaults().setAllowMissing(false));
        } else {
            final File cwdConfigFile = workingDirectory.resolve(CONFIG_FILE_NAME).toFile();
            if (cwdConfigFile.isFile()) {
                LOG.debug("Loading configuration from file: {}", cwdConfigFile.getAbsolutePath());
                fileConfig = ConfigFactory.parseFile(cwdConfigFile);
            } else {
                LOG.debug("Configuration file '{}' not found. Using defaults.", cwdConfigFile.getPath());
                fileConfig = ConfigFactory.empty();
            }
        }

        final Config defaultConfig = ConfigFactory.parseResources("reference.conf");

        // The one provided first wins.
        return envConfig
                .withFallback(sysPropConfig)
                .withFallback(fileConfig)
                .withFallback(defaultConfig)
                .resolve();
    }
}

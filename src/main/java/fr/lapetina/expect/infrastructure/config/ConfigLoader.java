package fr.lapetina.expect.infrastructure.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;

/**
 * Configuration loader.
 *
 * Supports:
 * - Loading from the file system, then from the classpath
 * - Falling back to built-in defaults when no configuration exists
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    public static final String DEFAULT_LOCATION = "expect.yaml";
    public static final String LOCATION_PROPERTY = "expect.config";

    private final String location;
    private final Yaml yaml;

    public ConfigLoader(String location) {
        this.location = location;
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new Constructor(ExpectationConfig.class, loaderOptions));
    }

    /**
     * Creates a loader for the location given by the {@code expect.config} system property,
     * or {@code expect.yaml} if it is not set.
     */
    public static ConfigLoader fromSystemProperties() {
        return new ConfigLoader(System.getProperty(LOCATION_PROPERTY, DEFAULT_LOCATION));
    }

    /**
     * Loads configuration from file or classpath.
     *
     * @return The loaded configuration
     * @throws ConfigurationException if the configuration is missing or cannot be read
     */
    public ExpectationConfig load() {
        return tryLoad().orElseThrow(() -> new ConfigurationException("Configuration file not found: " + location));
    }

    /**
     * Loads configuration from file or classpath, using defaults if none exists.
     *
     * @throws ConfigurationException if a configuration exists but cannot be read
     */
    public ExpectationConfig loadOrDefault() {
        return tryLoad().orElseGet(() -> {
            log.debug("No expectation configuration at {}, using defaults", location);
            return createDefault();
        });
    }

    private Optional<ExpectationConfig> tryLoad() {
        // Try file system first
        Path path = toPath(location);
        if (path != null && Files.isRegularFile(path)) {
            return Optional.of(loadFromFile(path));
        }

        // Try classpath
        String classpathResource = location.startsWith("/") ? location.substring(1) : location;
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(classpathResource)) {
            if (is != null) {
                log.info("Loading expectation configuration from classpath: {}", classpathResource);
                return Optional.of(parse(is, classpathResource));
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load from classpath: " + classpathResource, e);
        }
        return Optional.empty();
    }

    private ExpectationConfig loadFromFile(Path path) {
        log.info("Loading expectation configuration from file: {}", path);
        try (InputStream is = Files.newInputStream(path)) {
            return parse(is, path.toString());
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    /**
     * Loads configuration from an input stream.
     */
    public ExpectationConfig loadFromStream(InputStream inputStream) {
        return parse(inputStream, "stream");
    }

    private ExpectationConfig parse(InputStream inputStream, String source) {
        ExpectationConfig config;
        try {
            config = yaml.load(inputStream);
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid configuration in " + source + ": " + e.getMessage(), e);
        }
        try {
            // An empty document yields null
            return validate(config != null ? config : createDefault());
        } catch (ConfigurationException e) {
            throw new ConfigurationException("Invalid configuration in " + source + ": " + e.getMessage(), e);
        }
    }

    /**
     * Validates a configuration. Empty sections get their defaults.
     *
     * @return The given configuration
     * @throws ConfigurationException if a setting is missing or out of range
     */
    public static ExpectationConfig validate(ExpectationConfig config) {
        if (config.getReporter() == null) {
            config.setReporter(new ExpectationConfig.ReporterConfig());
        }
        if (config.getFormatter() == null) {
            config.setFormatter(new ExpectationConfig.FormatterConfig());
        }

        ExpectationConfig.ReporterConfig reporter = config.getReporter();
        requireText(reporter.getType(), "reporter.type");
        requireText(reporter.getVerb(), "reporter.verb");
        requireText(reporter.getThrownVerb(), "reporter.thrownVerb");
        requireText(reporter.getRootBullet(), "reporter.rootBullet");
        requireText(reporter.getNestedBullet(), "reporter.nestedBullet");
        requireText(reporter.getFeatureArrow(), "reporter.featureArrow");
        requireText(reporter.getExplanationBullet(), "reporter.explanationBullet");
        if (reporter.getIndent() < 0) {
            throw new ConfigurationException("reporter.indent must not be negative: " + reporter.getIndent());
        }

        if (config.getFormatter().getNotAvailablePrefix() == null) {
            throw new ConfigurationException("formatter.notAvailablePrefix is required");
        }
        return config;
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new ConfigurationException(name + " is required");
        }
    }

    private static Path toPath(String location) {
        try {
            return Paths.get(location);
        } catch (InvalidPathException e) {
            log.debug("Not a file system path, trying classpath only: {}", location);
            return null;
        }
    }

    /**
     * Creates a default configuration.
     */
    public static ExpectationConfig createDefault() {
        return new ExpectationConfig();
    }

    /**
     * Exception for configuration errors.
     */
    public static class ConfigurationException extends RuntimeException {
        public ConfigurationException(String message) {
            super(message);
        }

        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}

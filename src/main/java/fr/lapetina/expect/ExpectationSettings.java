package fr.lapetina.expect;

import fr.lapetina.expect.infrastructure.config.ConfigLoader;
import fr.lapetina.expect.infrastructure.config.ExpectationConfig;
import fr.lapetina.expect.infrastructure.reporting.Reporter;
import fr.lapetina.expect.infrastructure.reporting.ReporterFactory;
import fr.lapetina.expect.infrastructure.reporting.TextReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Configuration and reporter used by the expectation verbs.
 *
 * <p>The settings are loaded lazily on first use, from {@code expect.yaml} or the location in the
 * {@code expect.config} system property. Tests may replace them with {@link #use(ExpectationConfig)}
 * and go back to the loaded ones with {@link #reset()}.
 */
public final class ExpectationSettings {

    private static final Logger log = LoggerFactory.getLogger(ExpectationSettings.class);

    private static final AtomicReference<ExpectationSettings> CURRENT = new AtomicReference<>();

    private final ExpectationConfig config;
    private final Reporter reporter;

    private ExpectationSettings(ExpectationConfig config) {
        this.config = config;
        this.reporter = ReporterFactory.create(config.getReporter().getType(), config)
                .orElseGet(() -> {
                    log.warn("Unknown reporter type '{}', falling back to '{}'",
                            config.getReporter().getType(), TextReporter.NAME);
                    return new TextReporter(config);
                });
        log.debug("Using reporter: {}", reporter.getName());
    }

    /**
     * Returns the active settings, loading them on first use.
     */
    public static ExpectationSettings current() {
        ExpectationSettings settings = CURRENT.get();
        if (settings != null) {
            return settings;
        }
        ExpectationSettings loaded = new ExpectationSettings(ConfigLoader.fromSystemProperties().loadOrDefault());
        return CURRENT.compareAndSet(null, loaded) ? loaded : CURRENT.get();
    }

    /**
     * Replaces the active settings with ones built from the given configuration.
     *
     * @throws ConfigLoader.ConfigurationException if the configuration is invalid
     */
    public static ExpectationSettings use(ExpectationConfig config) {
        Objects.requireNonNull(config, "Config is required");
        ExpectationSettings settings = new ExpectationSettings(ConfigLoader.validate(config));
        CURRENT.set(settings);
        return settings;
    }

    /**
     * Drops the active settings; the next expectation loads them again.
     */
    public static void reset() {
        CURRENT.set(null);
    }

    public ExpectationConfig getConfig() {
        return config;
    }

    public Reporter getReporter() {
        return reporter;
    }
}

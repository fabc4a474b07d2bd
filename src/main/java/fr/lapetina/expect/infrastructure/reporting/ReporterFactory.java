package fr.lapetina.expect.infrastructure.reporting;

import fr.lapetina.expect.infrastructure.config.ExpectationConfig;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Factory for creating reporters by the name used in configuration.
 */
public final class ReporterFactory {

    private static final Map<String, Function<ExpectationConfig, Reporter>> REGISTRY = new ConcurrentHashMap<>();

    static {
        register(TextReporter.NAME, TextReporter::new);
    }

    private ReporterFactory() {
        // Utility class
    }

    /**
     * Registers a custom reporter.
     *
     * @param name Reporter name (used in configuration)
     * @param factory Creates the reporter from the active configuration
     */
    public static void register(String name, Function<ExpectationConfig, Reporter> factory) {
        REGISTRY.put(name.toLowerCase(Locale.ROOT), factory);
    }

    /**
     * Creates a reporter by name.
     *
     * @return Reporter instance, or empty if no reporter is registered under the name
     */
    public static Optional<Reporter> create(String name, ExpectationConfig config) {
        Objects.requireNonNull(name, "Reporter name is required");
        Function<ExpectationConfig, Reporter> factory = REGISTRY.get(name.toLowerCase(Locale.ROOT));
        if (factory == null) {
            return Optional.empty();
        }
        return Optional.of(factory.apply(config));
    }

    /**
     * Returns all registered reporter names.
     */
    public static Iterable<String> getRegisteredNames() {
        return REGISTRY.keySet();
    }
}

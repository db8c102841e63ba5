package com.viffx.Parsers.Utils;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Objects;
import java.util.Properties;

/**
 * Resource ceilings for table construction and parse simulation.
 * <p>
 * {@link #load()} reads {@value #RESOURCE} from the classpath; any key may be overridden by a
 * system property of the same name prefixed with {@value #SYSTEM_PREFIX}.
 *
 * @param maxStates the largest automaton (in states) a builder may construct
 * @param maxParseSteps the largest number of trace steps a single parse may record
 */
public record ParserSettings(int maxStates, int maxParseSteps) {
    public static final String RESOURCE = "parse-tables.properties";
    public static final String SYSTEM_PREFIX = "parse-tables.";
    public static final String MAX_STATES = "automaton.max-states";
    public static final String MAX_PARSE_STEPS = "parser.max-steps";

    public static final int DEFAULT_MAX_STATES = 5000;
    public static final int DEFAULT_MAX_PARSE_STEPS = 100_000;

    private static final ParserSettings DEFAULTS = new ParserSettings(DEFAULT_MAX_STATES, DEFAULT_MAX_PARSE_STEPS);

    public ParserSettings {
        if (maxStates < 1) throw new IllegalArgumentException("maxStates must be positive, got " + maxStates);
        if (maxParseSteps < 1) throw new IllegalArgumentException("maxParseSteps must be positive, got " + maxParseSteps);
    }

    public static ParserSettings defaults() {
        return DEFAULTS;
    }

    /**
     * Loads the settings from the classpath resource, falling back to the defaults for missing
     * keys or a missing resource, then applies system property overrides.
     *
     * @return the effective settings
     * @throws IllegalArgumentException if a configured value is not a positive integer
     */
    @NotNull
    public static ParserSettings load() {
        Properties properties = loadProperties(RESOURCE);
        for (String key : new String[]{MAX_STATES, MAX_PARSE_STEPS}) {
            String override = System.getProperty(SYSTEM_PREFIX + key);
            if (override != null) properties.setProperty(key, override);
        }
        return fromProperties(properties);
    }

    @NotNull
    @Contract("_ -> new")
    public static ParserSettings fromProperties(@NotNull Properties properties) {
        Objects.requireNonNull(properties, "properties cannot be null");
        return new ParserSettings(
                intProperty(properties, MAX_STATES, DEFAULT_MAX_STATES),
                intProperty(properties, MAX_PARSE_STEPS, DEFAULT_MAX_PARSE_STEPS)
        );
    }

    public ParserSettings withMaxStates(int maxStates) {
        return new ParserSettings(maxStates, maxParseSteps);
    }

    public ParserSettings withMaxParseSteps(int maxParseSteps) {
        return new ParserSettings(maxStates, maxParseSteps);
    }

    static Properties loadProperties(String resource) {
        Properties properties = new Properties();
        ClassLoader loader = ParserSettings.class.getClassLoader();
        try (InputStream in = loader.getResourceAsStream(resource)) {
            if (in != null) properties.load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot read " + resource, e);
        }
        return properties;
    }

    private static int intProperty(Properties properties, String key, int fallback) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) return fallback;
        try {
            return Integer.parseInt(value.strip());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer, got '" + value + "'", e);
        }
    }
}

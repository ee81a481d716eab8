package io.typedrecord.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.typedrecord.core.engine.ValidationSettings;
import io.typedrecord.core.model.ValidationMode;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads {@link ValidationSettings} from YAML with an environment variable overlay.
 *
 * <pre>
 * validation:
 *   enabled: true          # TYPED_RECORD_VALIDATION_ENABLED
 *   default-mode: loose    # TYPED_RECORD_DEFAULT_MODE (strict | loose)
 *   neighbor-excerpt: 2    # TYPED_RECORD_NEIGHBOR_EXCERPT
 * </pre>
 *
 * <p>
 * Missing keys keep the values of {@link ValidationSettings#DEFAULT}. Environment variables win
 * over YAML; a variable is "set" only if it is defined and non-blank after trimming.
 */
public final class SettingsLoader {

    private static final Logger LOG = LoggerFactory.getLogger(SettingsLoader.class);

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /** Classpath resource read by {@link #loadDefaults()}. */
    public static final String DEFAULT_RESOURCE = "typed-record.yaml";

    static final String ENV_ENABLED = "TYPED_RECORD_VALIDATION_ENABLED";
    static final String ENV_DEFAULT_MODE = "TYPED_RECORD_DEFAULT_MODE";
    static final String ENV_NEIGHBOR_EXCERPT = "TYPED_RECORD_NEIGHBOR_EXCERPT";

    private SettingsLoader() {
        // utility class
    }

    /**
     * Loads settings from {@code configPath}, applying overrides from {@link System#getenv}.
     *
     * @throws ConfigLoadException if the file is missing or invalid
     */
    public static ValidationSettings load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads settings from {@code configPath}, applying overrides from {@code envLookup}.
     * {@code envLookup} returns {@code null} for undefined variables.
     *
     * @throws ConfigLoadException if the file is missing or invalid
     */
    public static ValidationSettings load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException("Configuration file not found: " + configPath);
        }
        try (InputStream in = Files.newInputStream(configPath)) {
            ValidationSettings settings = fromYaml(YAML_MAPPER.readTree(in), envLookup, configPath.toString());
            LOG.info("Loaded validation settings from {}: {}", configPath, settings);
            return settings;
        } catch (ConfigLoadException e) {
            throw e;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        }
    }

    /** Reads {@value #DEFAULT_RESOURCE} from the classpath if present, with the process environment. */
    public static ValidationSettings loadDefaults() {
        return loadDefaults(System::getenv);
    }

    /**
     * Reads {@value #DEFAULT_RESOURCE} from the classpath if present, otherwise starts from
     * {@link ValidationSettings#DEFAULT}; then applies the environment overlay.
     */
    public static ValidationSettings loadDefaults(Function<String, String> envLookup) {
        ClassLoader loader = SettingsLoader.class.getClassLoader();
        try (InputStream in = loader.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                LOG.debug("No {} on classpath, using defaults", DEFAULT_RESOURCE);
                return applyEnv(ValidationSettings.DEFAULT, envLookup);
            }
            ValidationSettings settings = fromYaml(YAML_MAPPER.readTree(in), envLookup, "classpath:" + DEFAULT_RESOURCE);
            LOG.info("Loaded validation settings from classpath:{}: {}", DEFAULT_RESOURCE, settings);
            return settings;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: classpath:" + DEFAULT_RESOURCE, e);
        }
    }

    private static ValidationSettings fromYaml(JsonNode root, Function<String, String> envLookup, String source) {
        ValidationSettings settings = ValidationSettings.DEFAULT;
        JsonNode validation = root != null ? root.get("validation") : null;
        if (validation != null && !validation.isNull()) {
            if (!validation.isObject()) {
                throw new ConfigLoadException("'validation' must be a mapping in " + source);
            }
            if (validation.has("enabled")) {
                JsonNode enabled = validation.get("enabled");
                if (!enabled.isBoolean()) {
                    throw new ConfigLoadException("'validation.enabled' must be a boolean in " + source);
                }
                settings = settings.withEnabled(enabled.asBoolean());
            }
            if (validation.has("default-mode")) {
                settings = settings.withDefaultMode(parseMode(validation.get("default-mode").asText(), source));
            }
            if (validation.has("neighbor-excerpt")) {
                JsonNode excerpt = validation.get("neighbor-excerpt");
                if (!excerpt.canConvertToInt() || !excerpt.isIntegralNumber()) {
                    throw new ConfigLoadException("'validation.neighbor-excerpt' must be an integer in " + source);
                }
                settings = withExcerpt(settings, excerpt.asInt(), source);
            }
        }
        return applyEnv(settings, envLookup);
    }

    private static ValidationSettings applyEnv(ValidationSettings settings, Function<String, String> envLookup) {
        if (isSet(envLookup, ENV_ENABLED)) {
            settings = settings.withEnabled(Boolean.parseBoolean(envLookup.apply(ENV_ENABLED).trim()));
        }
        if (isSet(envLookup, ENV_DEFAULT_MODE)) {
            settings = settings.withDefaultMode(parseMode(envLookup.apply(ENV_DEFAULT_MODE).trim(), ENV_DEFAULT_MODE));
        }
        if (isSet(envLookup, ENV_NEIGHBOR_EXCERPT)) {
            String raw = envLookup.apply(ENV_NEIGHBOR_EXCERPT).trim();
            try {
                settings = withExcerpt(settings, Integer.parseInt(raw), ENV_NEIGHBOR_EXCERPT);
            } catch (NumberFormatException e) {
                throw new ConfigLoadException(ENV_NEIGHBOR_EXCERPT + " must be an integer, got '" + raw + "'", e);
            }
        }
        return settings;
    }

    private static ValidationSettings withExcerpt(ValidationSettings settings, int excerpt, String source) {
        try {
            return settings.withNeighborExcerpt(excerpt);
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException("Invalid neighbor excerpt in " + source + ": " + e.getMessage(), e);
        }
    }

    private static ValidationMode parseMode(String raw, String source) {
        try {
            return ValidationMode.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException(
                    "Unknown validation mode '" + raw + "' in " + source + ", expected 'strict' or 'loose'", e);
        }
    }

    /** True if the variable is defined and non-blank after trimming. */
    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }
}

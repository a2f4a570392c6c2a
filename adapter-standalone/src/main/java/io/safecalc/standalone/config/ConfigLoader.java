package io.safecalc.standalone.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.DoubleConsumer;
import java.util.function.Function;
import java.util.function.IntConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads {@link ServiceConfig} from YAML with an environment variable overlay.
 *
 * <p>
 * File selection:
 * <ul>
 * <li>{@code --config /path/to/config.yaml}: the file must exist</li>
 * <li>otherwise {@code safecalc.yaml} in the working directory, if present</li>
 * <li>otherwise built-in defaults (plus environment overrides)</li>
 * </ul>
 *
 * <p>
 * Every key can be overridden by an environment variable, which wins over the
 * YAML value. A variable counts as set only when it is defined and not blank
 * after trimming.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    static final String DEFAULT_CONFIG_FILE = "safecalc.yaml";

    private ConfigLoader() {
        // utility class
    }

    /**
     * Resolves the configuration for the given command line, reading the real
     * process environment.
     *
     * @param args command-line arguments
     * @return the effective configuration
     * @throws ConfigLoadException if loading fails
     */
    public static ServiceConfig load(String[] args) {
        return load(args, System::getenv);
    }

    /**
     * Resolves the configuration for the given command line.
     *
     * @param args      command-line arguments
     * @param envLookup environment lookup; {@code null} means undefined
     * @return the effective configuration
     * @throws ConfigLoadException if loading fails
     */
    public static ServiceConfig load(String[] args, Function<String, String> envLookup) {
        Optional<Path> explicit = explicitConfigPath(args);
        if (explicit.isPresent()) {
            return load(explicit.get(), envLookup);
        }
        Path fallback = Path.of(DEFAULT_CONFIG_FILE);
        if (Files.exists(fallback)) {
            return load(fallback, envLookup);
        }
        LOG.info("No {} found, using built-in defaults", DEFAULT_CONFIG_FILE);
        return mapToConfig(MissingNode.getInstance(), envLookup);
    }

    /**
     * Loads a {@link ServiceConfig} from the given YAML file, applying
     * environment overrides from {@link System#getenv}.
     *
     * @param configPath path to the YAML file
     * @throws ConfigLoadException if the file is missing, unreadable or invalid
     */
    public static ServiceConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads a {@link ServiceConfig} from the given YAML file, applying
     * environment overrides from {@code envLookup}.
     *
     * @param configPath path to the YAML file
     * @param envLookup  environment lookup; {@code null} means undefined
     * @throws ConfigLoadException if the file is missing, unreadable or invalid
     */
    public static ServiceConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException(
                    "Configuration file not found: " + configPath + ". Use --config <path> to specify a config file.");
        }

        JsonNode root;
        try (InputStream in = Files.newInputStream(configPath)) {
            root = YAML_MAPPER.readTree(in);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        }
        if (root == null || root.isNull() || root.isMissingNode()) {
            root = MissingNode.getInstance();
        } else if (!root.isObject()) {
            throw new ConfigLoadException("Configuration root must be a mapping: " + configPath);
        }
        return mapToConfig(root, envLookup);
    }

    /**
     * Returns the value following {@code --config}, if that flag is present.
     *
     * @throws ConfigLoadException if {@code --config} is the last argument
     */
    static Optional<Path> explicitConfigPath(String[] args) {
        for (int i = 0; i < args.length; i++) {
            if ("--config".equals(args[i])) {
                if (i + 1 >= args.length) {
                    throw new ConfigLoadException("--config requires a file path argument");
                }
                return Optional.of(Path.of(args[i + 1]));
            }
        }
        return Optional.empty();
    }

    private static ServiceConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        ServiceConfig.Builder builder = ServiceConfig.builder();

        JsonNode server = root.path("server");
        yamlString(server, "server", "host", builder::host);
        yamlInt(server, "server", "port", builder::port);
        yamlInt(server, "server", "max-body-bytes", builder::maxBodyBytes);

        JsonNode endpoints = root.path("endpoints");
        yamlString(endpoints, "endpoints", "evaluate-path", builder::evaluatePath);

        JsonNode health = root.path("health");
        yamlBool(health, "health", "enabled", builder::healthEnabled);
        yamlString(health, "health", "path", builder::healthPath);

        JsonNode logging = root.path("logging");
        yamlString(logging, "logging", "format", builder::loggingFormat);
        yamlString(logging, "logging", "level", builder::loggingLevel);

        JsonNode input = root.path("input");
        yamlBool(input, "input", "caret-as-power", builder::caretAsPower);

        JsonNode display = root.path("display");
        yamlInt(display, "display", "precision", builder::displayPrecision);

        JsonNode limits = root.path("limits");
        yamlDouble(limits, "limits", "max-pow-base", builder::maxPowBase);
        yamlDouble(limits, "limits", "max-pow-exponent", builder::maxPowExponent);
        yamlInt(limits, "limits", "max-depth", builder::maxDepth);
        yamlInt(limits, "limits", "max-input-length", builder::maxInputLength);

        applyEnvOverrides(builder, envLookup);

        try {
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException("Invalid configuration: " + e.getMessage(), e);
        }
    }

    private static void applyEnvOverrides(ServiceConfig.Builder builder, Function<String, String> envLookup) {
        envString(envLookup, "SERVER_HOST", builder::host);
        envString(envLookup, "EVALUATE_PATH", builder::evaluatePath);
        envString(envLookup, "HEALTH_PATH", builder::healthPath);
        envString(envLookup, "LOG_FORMAT", builder::loggingFormat);
        envString(envLookup, "LOG_LEVEL", builder::loggingLevel);

        envInt(envLookup, "SERVER_PORT", builder::port);
        envInt(envLookup, "SERVER_MAX_BODY_BYTES", builder::maxBodyBytes);
        envInt(envLookup, "DISPLAY_PRECISION", builder::displayPrecision);
        envInt(envLookup, "LIMIT_MAX_DEPTH", builder::maxDepth);
        envInt(envLookup, "LIMIT_MAX_INPUT_LENGTH", builder::maxInputLength);

        envDouble(envLookup, "LIMIT_MAX_POW_BASE", builder::maxPowBase);
        envDouble(envLookup, "LIMIT_MAX_POW_EXPONENT", builder::maxPowExponent);

        envBool(envLookup, "HEALTH_ENABLED", builder::healthEnabled);
        envBool(envLookup, "INPUT_CARET_AS_POWER", builder::caretAsPower);
    }

    // --- Env var helpers ---

    /** Returns the trimmed value if the variable is defined and not blank. */
    private static Optional<String> envValue(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        if (value == null || value.trim().isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(value.trim());
    }

    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        envValue(envLookup, envVar).ifPresent(setter);
    }

    private static void envInt(Function<String, String> envLookup, String envVar, IntConsumer setter) {
        envValue(envLookup, envVar).ifPresent(value -> setter.accept(parseInt(envVar, value)));
    }

    private static void envDouble(Function<String, String> envLookup, String envVar, DoubleConsumer setter) {
        envValue(envLookup, envVar).ifPresent(value -> setter.accept(parseDouble(envVar, value)));
    }

    private static void envBool(Function<String, String> envLookup, String envVar, Consumer<Boolean> setter) {
        envValue(envLookup, envVar).ifPresent(value -> setter.accept(parseBoolean(envVar, value)));
    }

    // --- YAML helpers ---

    private static void yamlString(JsonNode section, String prefix, String field, Consumer<String> setter) {
        JsonNode value = section.get(field);
        if (value == null || value.isNull()) {
            return;
        }
        if (!value.isValueNode()) {
            throw invalid(prefix + "." + field, value.toString());
        }
        setter.accept(value.asText());
    }

    private static void yamlInt(JsonNode section, String prefix, String field, IntConsumer setter) {
        JsonNode value = section.get(field);
        if (value == null || value.isNull()) {
            return;
        }
        if (value.isIntegralNumber() && value.canConvertToInt()) {
            setter.accept(value.intValue());
        } else if (value.isTextual()) {
            setter.accept(parseInt(prefix + "." + field, value.asText().trim()));
        } else {
            throw invalid(prefix + "." + field, value.toString());
        }
    }

    private static void yamlDouble(JsonNode section, String prefix, String field, DoubleConsumer setter) {
        JsonNode value = section.get(field);
        if (value == null || value.isNull()) {
            return;
        }
        if (value.isNumber()) {
            setter.accept(value.doubleValue());
        } else if (value.isTextual()) {
            // YAML 1.1 reads exponent forms without a dot (1e6) as strings
            setter.accept(parseDouble(prefix + "." + field, value.asText().trim()));
        } else {
            throw invalid(prefix + "." + field, value.toString());
        }
    }

    private static void yamlBool(JsonNode section, String prefix, String field, Consumer<Boolean> setter) {
        JsonNode value = section.get(field);
        if (value == null || value.isNull()) {
            return;
        }
        if (value.isBoolean()) {
            setter.accept(value.booleanValue());
        } else if (value.isTextual()) {
            setter.accept(parseBoolean(prefix + "." + field, value.asText().trim()));
        } else {
            throw invalid(prefix + "." + field, value.toString());
        }
    }

    // --- Parsing ---

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new ConfigLoadException("Invalid value for " + key + ": '" + value + "'", e);
        }
    }

    private static double parseDouble(String key, String value) {
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new ConfigLoadException("Invalid value for " + key + ": '" + value + "'", e);
        }
    }

    private static boolean parseBoolean(String key, String value) {
        if ("true".equalsIgnoreCase(value)) {
            return true;
        }
        if ("false".equalsIgnoreCase(value)) {
            return false;
        }
        throw invalid(key, value);
    }

    private static ConfigLoadException invalid(String key, String value) {
        return new ConfigLoadException("Invalid value for " + key + ": '" + value + "'");
    }
}

package io.tablexform.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.LongConsumer;

/**
 * Loads {@link PipelineConfig} from a YAML file with an environment variable overlay.
 *
 * <p>
 * File layout (every key optional):
 *
 * <pre>
 * engine:
 *   id: columnar
 * pipeline:
 *   incremental: true
 *   slow-step-warn-ms: 1000
 * </pre>
 *
 * <p>
 * Environment variables {@code TABLEXFORM_ENGINE}, {@code TABLEXFORM_INCREMENTAL} and
 * {@code TABLEXFORM_SLOW_STEP_WARN_MS} take precedence over the file. A variable counts as set
 * only if it is defined and its trimmed value is non-empty.
 */
public final class ConfigLoader {

    /** File name looked up when no path is given. */
    public static final String DEFAULT_CONFIG_FILE = "table-xform.yaml";

    static final String ENV_ENGINE = "TABLEXFORM_ENGINE";
    static final String ENV_INCREMENTAL = "TABLEXFORM_INCREMENTAL";
    static final String ENV_SLOW_STEP_WARN_MS = "TABLEXFORM_SLOW_STEP_WARN_MS";

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads configuration from {@code configPath}, applying overrides from {@link System#getenv}.
     *
     * @throws ConfigLoadException if the file is missing, is not valid YAML, or holds an invalid
     *                             value
     */
    public static PipelineConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads configuration from {@code configPath}, applying overrides from {@code envLookup}. The
     * lookup returns {@code null} for an undefined variable.
     *
     * @throws ConfigLoadException if the file is missing, is not valid YAML, or holds an invalid
     *                             value
     */
    public static PipelineConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException("Configuration file not found: " + configPath);
        }
        JsonNode root;
        try (InputStream in = Files.newInputStream(configPath)) {
            root = YAML_MAPPER.readTree(in);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        }
        if (root != null && !root.isMissingNode() && !root.isNull() && !root.isObject()) {
            throw new ConfigLoadException("Configuration root must be a mapping: " + configPath);
        }
        return mapToConfig(root, envLookup);
    }

    /**
     * Builds configuration from defaults and environment variables only, for hosts without a
     * configuration file.
     */
    public static PipelineConfig fromEnvironment(Function<String, String> envLookup) {
        return mapToConfig(null, envLookup);
    }

    private static PipelineConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        PipelineConfig.Builder builder = PipelineConfig.builder();

        if (root != null) {
            JsonNode engine = root.path("engine");
            if (engine.has("id")) {
                builder.engine(requireText(engine.get("id"), "engine.id"));
            }
            JsonNode pipeline = root.path("pipeline");
            if (pipeline.has("incremental")) {
                builder.incremental(requireBoolean(pipeline.get("incremental"), "pipeline.incremental"));
            }
            if (pipeline.has("slow-step-warn-ms")) {
                builder.slowStepWarnMs(requireLong(pipeline.get("slow-step-warn-ms"), "pipeline.slow-step-warn-ms"));
            }
        }

        envString(envLookup, ENV_ENGINE, builder::engine);
        envBool(envLookup, ENV_INCREMENTAL, builder::incremental);
        envLong(envLookup, ENV_SLOW_STEP_WARN_MS, builder::slowStepWarnMs);

        try {
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException("Invalid configuration: " + e.getMessage(), e);
        }
    }

    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }

    private static void envBool(Function<String, String> envLookup, String envVar, Consumer<Boolean> setter) {
        if (isSet(envLookup, envVar)) {
            String value = envLookup.apply(envVar).trim().toLowerCase(Locale.ROOT);
            if (!value.equals("true") && !value.equals("false")) {
                throw new ConfigLoadException(
                        "Environment variable " + envVar + " must be 'true' or 'false', got: '" + value + "'");
            }
            setter.accept(Boolean.parseBoolean(value));
        }
    }

    private static void envLong(Function<String, String> envLookup, String envVar, LongConsumer setter) {
        if (isSet(envLookup, envVar)) {
            String value = envLookup.apply(envVar).trim();
            try {
                setter.accept(Long.parseLong(value));
            } catch (NumberFormatException e) {
                throw new ConfigLoadException(
                        "Environment variable " + envVar + " must be an integer, got: '" + value + "'", e);
            }
        }
    }

    private static String requireText(JsonNode node, String field) {
        if (!node.isTextual()) {
            throw new ConfigLoadException("'" + field + "' must be a string, got: " + node.getNodeType());
        }
        return node.asText();
    }

    private static boolean requireBoolean(JsonNode node, String field) {
        if (!node.isBoolean()) {
            throw new ConfigLoadException("'" + field + "' must be a boolean, got: " + node.getNodeType());
        }
        return node.booleanValue();
    }

    private static long requireLong(JsonNode node, String field) {
        if (!node.isIntegralNumber()) {
            throw new ConfigLoadException("'" + field + "' must be an integer, got: " + node.getNodeType());
        }
        return node.longValue();
    }
}

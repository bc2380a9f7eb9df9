package io.arithma.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Consumer;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads {@link EngineConfig} from a YAML file with an optional environment variable overlay.
 *
 * <p>YAML layout:
 *
 * <pre>
 * simplifier:
 *   max-unroll-terms: 10
 *   inline-bound-variables: false
 * integrator:
 *   constant-suffix: " + C"
 * evaluator:
 *   summation-max-terms: 1000000
 * </pre>
 *
 * <p>Missing keys receive the defaults from {@link EngineConfig.Builder}. Every key can be
 * overridden by an environment variable ({@code ARITHMA_MAX_UNROLL_TERMS}, {@code
 * ARITHMA_INLINE_BOUND_VARIABLES}, {@code ARITHMA_INTEGRATION_CONSTANT}, {@code
 * ARITHMA_SUMMATION_MAX_TERMS}). An env var counts as set only if it is defined and its trimmed
 * value is non-empty.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    static final String ENV_MAX_UNROLL_TERMS = "ARITHMA_MAX_UNROLL_TERMS";
    static final String ENV_INLINE_BOUND_VARIABLES = "ARITHMA_INLINE_BOUND_VARIABLES";
    static final String ENV_INTEGRATION_CONSTANT = "ARITHMA_INTEGRATION_CONSTANT";
    static final String ENV_SUMMATION_MAX_TERMS = "ARITHMA_SUMMATION_MAX_TERMS";

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads configuration from the given YAML file, applying overrides from {@link System#getenv}.
     *
     * @throws ConfigLoadException if the file is missing, is not valid YAML or holds invalid values
     */
    public static EngineConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads configuration from the given YAML file, applying overrides from the supplied lookup.
     * The lookup returns {@code null} for undefined variables.
     *
     * @throws ConfigLoadException if the file is missing, is not valid YAML or holds invalid values
     */
    public static EngineConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException("Configuration file not found: " + configPath);
        }
        try (InputStream in = Files.newInputStream(configPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            EngineConfig config = mapToConfig(root == null ? YAML_MAPPER.createObjectNode() : root, envLookup);
            LOG.info("Loaded engine configuration from {}: {}", configPath, config);
            return config;
        } catch (ConfigLoadException e) {
            throw e;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        }
    }

    /** Builds configuration from the defaults and environment variables only. */
    public static EngineConfig fromEnvironment(Function<String, String> envLookup) {
        return mapToConfig(YAML_MAPPER.createObjectNode(), envLookup);
    }

    private static EngineConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        EngineConfig.Builder builder = EngineConfig.builder();

        JsonNode simplifier = root.path("simplifier");
        if (simplifier.has("max-unroll-terms")) {
            builder.maxUnrollTerms(intValue(simplifier, "max-unroll-terms"));
        }
        if (simplifier.has("inline-bound-variables")) {
            builder.inlineBoundVariables(simplifier.get("inline-bound-variables").asBoolean());
        }
        JsonNode integrator = root.path("integrator");
        if (integrator.has("constant-suffix")) {
            builder.integrationConstant(integrator.get("constant-suffix").asText());
        }
        JsonNode evaluator = root.path("evaluator");
        if (evaluator.has("summation-max-terms")) {
            builder.summationMaxTerms(longValue(evaluator, "summation-max-terms"));
        }

        envInt(envLookup, ENV_MAX_UNROLL_TERMS, builder::maxUnrollTerms);
        envBool(envLookup, ENV_INLINE_BOUND_VARIABLES, builder::inlineBoundVariables);
        if (isSet(envLookup, ENV_INTEGRATION_CONSTANT)) {
            // not trimmed: the suffix usually starts with a space
            builder.integrationConstant(envLookup.apply(ENV_INTEGRATION_CONSTANT));
        }
        envLong(envLookup, ENV_SUMMATION_MAX_TERMS, builder::summationMaxTerms);

        try {
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException("Invalid engine configuration: " + e.getMessage(), e);
        }
    }

    // --- Env helpers ---

    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static void envInt(Function<String, String> envLookup, String envVar, Consumer<Integer> setter) {
        if (isSet(envLookup, envVar)) {
            String value = envLookup.apply(envVar).trim();
            try {
                setter.accept(Integer.parseInt(value));
            } catch (NumberFormatException e) {
                throw new ConfigLoadException(
                        "Environment variable " + envVar + " must be an integer, got: " + value, e);
            }
        }
    }

    private static void envLong(Function<String, String> envLookup, String envVar, Consumer<Long> setter) {
        if (isSet(envLookup, envVar)) {
            String value = envLookup.apply(envVar).trim();
            try {
                setter.accept(Long.parseLong(value));
            } catch (NumberFormatException e) {
                throw new ConfigLoadException(
                        "Environment variable " + envVar + " must be an integer, got: " + value, e);
            }
        }
    }

    private static void envBool(Function<String, String> envLookup, String envVar, Consumer<Boolean> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(Boolean.parseBoolean(envLookup.apply(envVar).trim()));
        }
    }

    // --- YAML helpers ---

    private static int intValue(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (!value.canConvertToInt()) {
            throw new ConfigLoadException("Configuration key '" + field + "' must be an integer, got: " + value);
        }
        return value.asInt();
    }

    private static long longValue(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (!value.canConvertToLong()) {
            throw new ConfigLoadException("Configuration key '" + field + "' must be an integer, got: " + value);
        }
        return value.asLong();
    }
}

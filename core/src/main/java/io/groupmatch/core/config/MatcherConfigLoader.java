package io.groupmatch.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.groupmatch.core.error.ConfigLoadException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Set;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads {@link MatcherConfig} from YAML with an environment variable overlay.
 *
 * <pre>
 * matcher:
 *   check-failure-policy: record   # or propagate
 *   suggestions: true
 * </pre>
 *
 * <p>
 * {@code GROUPMATCH_CHECK_FAILURE_POLICY} and {@code GROUPMATCH_SUGGESTIONS} override the file.
 * A variable counts as set only if it is defined and not blank. Missing keys keep the defaults of
 * {@link MatcherConfig.Builder}.
 */
public final class MatcherConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(MatcherConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /** Classpath resource consulted by {@link #loadDefault()}. */
    public static final String DEFAULT_RESOURCE = "group-match.yaml";

    static final String ENV_CHECK_FAILURE_POLICY = "GROUPMATCH_CHECK_FAILURE_POLICY";
    static final String ENV_SUGGESTIONS = "GROUPMATCH_SUGGESTIONS";

    private static final Set<String> KNOWN_ROOT_KEYS = Set.of("matcher");
    private static final Set<String> KNOWN_MATCHER_KEYS = Set.of("check-failure-policy", "suggestions");

    private MatcherConfigLoader() {
        // utility class
    }

    /**
     * Loads the given YAML file, applying overrides from {@link System#getenv}.
     *
     * @throws ConfigLoadException if the file is missing or invalid
     */
    public static MatcherConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads the given YAML file, applying overrides from {@code envLookup}, which returns {@code
     * null} for undefined variables.
     *
     * @throws ConfigLoadException if the file is missing or invalid
     */
    public static MatcherConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException("Configuration file not found: " + configPath);
        }
        try (InputStream in = Files.newInputStream(configPath)) {
            MatcherConfig config = mapToConfig(YAML_MAPPER.readTree(in), envLookup, configPath.toString());
            LOG.debug("Loaded matcher configuration from {}: {}", configPath, config);
            return config;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        }
    }

    /**
     * Loads {@value #DEFAULT_RESOURCE} from the context class loader when present, otherwise the
     * defaults; environment overrides apply either way.
     */
    public static MatcherConfig loadDefault() {
        return loadDefault(System::getenv);
    }

    /** {@link #loadDefault()} with environment variables read through {@code envLookup}. */
    public static MatcherConfig loadDefault(Function<String, String> envLookup) {
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = MatcherConfigLoader.class.getClassLoader();
        }
        try (InputStream in = loader.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                return mapToConfig(null, envLookup, "<defaults>");
            }
            return mapToConfig(YAML_MAPPER.readTree(in), envLookup, DEFAULT_RESOURCE);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to read classpath resource " + DEFAULT_RESOURCE, e);
        }
    }

    /**
     * Parses YAML text; used for inline configuration and tests.
     *
     * @throws ConfigLoadException if the YAML is invalid
     */
    public static MatcherConfig parse(String yaml, Function<String, String> envLookup) {
        try {
            return mapToConfig(YAML_MAPPER.readTree(yaml), envLookup, "<inline>");
        } catch (JsonProcessingException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration", e);
        }
    }

    private static MatcherConfig mapToConfig(JsonNode root, Function<String, String> envLookup, String source) {
        MatcherConfig.Builder builder = MatcherConfig.builder();

        if (root != null && !root.isMissingNode() && !root.isNull()) {
            rejectUnknownKeys(root, KNOWN_ROOT_KEYS, "configuration root", source);
            JsonNode matcher = root.path("matcher");
            if (!matcher.isMissingNode()) {
                rejectUnknownKeys(matcher, KNOWN_MATCHER_KEYS, "matcher", source);
                if (matcher.has("check-failure-policy")) {
                    builder.checkFailurePolicy(parsePolicy(matcher.get("check-failure-policy").asText(), source));
                }
                if (matcher.has("suggestions")) {
                    JsonNode suggestions = matcher.get("suggestions");
                    if (!suggestions.isBoolean()) {
                        throw new ConfigLoadException(
                                source + ": matcher.suggestions must be a boolean, got: " + suggestions);
                    }
                    builder.suggestions(suggestions.booleanValue());
                }
            }
        }

        String policy = envValue(envLookup, ENV_CHECK_FAILURE_POLICY);
        if (policy != null) {
            builder.checkFailurePolicy(parsePolicy(policy, ENV_CHECK_FAILURE_POLICY));
        }
        String suggestions = envValue(envLookup, ENV_SUGGESTIONS);
        if (suggestions != null) {
            builder.suggestions(parseBoolean(suggestions, ENV_SUGGESTIONS));
        }
        return builder.build();
    }

    private static CheckFailurePolicy parsePolicy(String value, String source) {
        try {
            return CheckFailurePolicy.parse(value);
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException(source + ": " + e.getMessage(), e);
        }
    }

    private static boolean parseBoolean(String value, String source) {
        String trimmed = value.trim();
        if (trimmed.equalsIgnoreCase("true")) {
            return true;
        }
        if (trimmed.equalsIgnoreCase("false")) {
            return false;
        }
        throw new ConfigLoadException(source + ": expected 'true' or 'false', got: '" + value + "'");
    }

    private static String envValue(Function<String, String> envLookup, String name) {
        String value = envLookup.apply(name);
        return value == null || value.isBlank() ? null : value;
    }

    private static void rejectUnknownKeys(JsonNode node, Set<String> known, String block, String source) {
        if (!node.isObject()) {
            throw new ConfigLoadException(source + ": " + block + " must be a mapping");
        }
        Iterator<String> names = node.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (!known.contains(name)) {
                throw new ConfigLoadException(
                        source + ": unknown key '" + name + "' in " + block + ", expected one of " + known);
            }
        }
    }
}

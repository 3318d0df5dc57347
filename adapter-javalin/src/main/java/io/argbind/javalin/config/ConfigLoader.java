package io.argbind.javalin.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.IntConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads {@link BinderConfig} from a YAML file with an environment variable overlay.
 *
 * <pre>
 * scan:
 *   namespace: form            # SCAN_NAMESPACE
 * tree:
 *   max-depth: 32              # TREE_MAX_DEPTH
 *   case-insensitive-properties: true   # TREE_CASE_INSENSITIVE_PROPERTIES
 *   fail-on-unknown-properties: false   # TREE_FAIL_ON_UNKNOWN_PROPERTIES
 * </pre>
 *
 * <p>
 * Env vars take precedence over YAML values. An env var is "set" if and only if it is defined and
 * its trimmed value is non-empty; blank values leave the YAML value in place. Keys missing from both
 * take the defaults of {@link BinderConfig#DEFAULT}.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads configuration from a YAML file, applying overrides from {@link System#getenv}.
     *
     * @param configPath path to the YAML configuration file
     * @return the loaded configuration
     * @throws ConfigLoadException if the file is missing, is not valid YAML, or holds an invalid value
     */
    public static BinderConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads configuration from a YAML file, applying overrides from the supplied lookup function.
     * The function returns {@code null} for undefined variables.
     *
     * @param configPath path to the YAML configuration file
     * @param envLookup  environment variable lookup function
     * @return the loaded configuration
     * @throws ConfigLoadException if the file is missing, is not valid YAML, or holds an invalid value
     */
    public static BinderConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException(
                    "Configuration file not found: " + configPath);
        }

        JsonNode root;
        try (InputStream in = Files.newInputStream(configPath)) {
            root = YAML_MAPPER.readTree(in);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        }

        try {
            BinderConfig config = mapToConfig(root == null ? YAML_MAPPER.createObjectNode() : root, envLookup);
            LOG.info(
                    "Loaded argbind configuration from {}: namespace={}, maxDepth={}",
                    configPath,
                    config.scanNamespace(),
                    config.maxDepth());
            return config;
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException("Invalid configuration in " + configPath + ": " + e.getMessage(), e);
        }
    }

    private static BinderConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        BinderConfig.Builder builder = BinderConfig.builder();

        // --- YAML mapping ---

        JsonNode scan = root.path("scan");
        if (scan.has("namespace")) builder.scanNamespace(ScanNamespace.parse(scan.get("namespace").asText()));

        JsonNode tree = root.path("tree");
        if (tree.has("max-depth")) builder.maxDepth(yamlInt(tree, "tree", "max-depth"));
        if (tree.has("case-insensitive-properties"))
            builder.caseInsensitiveProperties(yamlBool(tree, "tree", "case-insensitive-properties"));
        if (tree.has("fail-on-unknown-properties"))
            builder.failOnUnknownProperties(yamlBool(tree, "tree", "fail-on-unknown-properties"));

        // --- Environment variable overlay ---

        envString(envLookup, "SCAN_NAMESPACE", value -> builder.scanNamespace(ScanNamespace.parse(value)));
        envInt(envLookup, "TREE_MAX_DEPTH", builder::maxDepth);
        envBool(envLookup, "TREE_CASE_INSENSITIVE_PROPERTIES", builder::caseInsensitiveProperties);
        envBool(envLookup, "TREE_FAIL_ON_UNKNOWN_PROPERTIES", builder::failOnUnknownProperties);

        return builder.build();
    }

    // --- Env var helpers ---

    /** Returns {@code true} if the env var is defined and non-blank after trimming. */
    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }

    private static void envInt(Function<String, String> envLookup, String envVar, IntConsumer setter) {
        if (isSet(envLookup, envVar)) {
            String value = envLookup.apply(envVar).trim();
            try {
                setter.accept(Integer.parseInt(value));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(envVar + " must be an integer, got '" + value + "'", e);
            }
        }
    }

    private static void envBool(Function<String, String> envLookup, String envVar, Consumer<Boolean> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(parseBool(envVar, envLookup.apply(envVar).trim()));
        }
    }

    // --- YAML helpers ---

    private static int yamlInt(JsonNode node, String section, String field) {
        JsonNode value = node.get(field);
        if (!value.isIntegralNumber() || !value.canConvertToInt()) {
            throw new IllegalArgumentException(
                    section + "." + field + " must be an integer, got '" + value.asText() + "'");
        }
        return value.intValue();
    }

    private static boolean yamlBool(JsonNode node, String section, String field) {
        JsonNode value = node.get(field);
        return value.isBoolean() ? value.booleanValue() : parseBool(section + "." + field, value.asText());
    }

    private static boolean parseBool(String key, String value) {
        if ("true".equalsIgnoreCase(value)) {
            return true;
        }
        if ("false".equalsIgnoreCase(value)) {
            return false;
        }
        throw new IllegalArgumentException(key + " must be true or false, got '" + value + "'");
    }
}

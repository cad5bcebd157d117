package io.nlpqlresolver.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.UnsupportedCharsetException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Function;

/**
 * Loads {@link ResolverConfig} from a YAML file with an optional environment variable overlay.
 *
 * <pre>
 * resolver:
 *   trace: true
 *   charset: UTF-8
 * </pre>
 *
 * <p>
 * Missing keys keep the defaults of {@link ResolverConfig#defaults()}. Environment variables
 * {@value #ENV_TRACE} and {@value #ENV_CHARSET} take precedence over YAML values. A variable is
 * considered "set" if and only if it is defined AND its trimmed value is non-empty.
 */
public final class ConfigLoader {

    static final String ENV_TRACE = "NLPQL_RESOLVER_TRACE";
    static final String ENV_CHARSET = "NLPQL_RESOLVER_CHARSET";

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads a {@link ResolverConfig} from the given YAML file, applying overrides from {@link
     * System#getenv}.
     *
     * @throws ConfigLoadException if the file is missing, is not valid YAML, or names an
     *                             unknown charset
     */
    public static ResolverConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads a {@link ResolverConfig} from the given YAML file, applying overrides from the
     * supplied lookup function. Returning {@code null} from the lookup means the variable is not
     * defined.
     *
     * @throws ConfigLoadException if the file is missing, is not valid YAML, or names an
     *                             unknown charset
     */
    public static ResolverConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException("Configuration file not found: " + configPath);
        }

        JsonNode root;
        try (InputStream in = Files.newInputStream(configPath)) {
            root = YAML_MAPPER.readTree(in);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            root = YAML_MAPPER.createObjectNode();
        } else if (!root.isObject()) {
            throw new ConfigLoadException("Configuration root must be a mapping: " + configPath);
        }
        return mapToConfig(root, envLookup);
    }

    /** Defaults overlaid with environment variables only, for callers without a config file. */
    public static ResolverConfig fromEnvironment(Function<String, String> envLookup) {
        return mapToConfig(YAML_MAPPER.createObjectNode(), envLookup);
    }

    private static ResolverConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        ResolverConfig defaults = ResolverConfig.defaults();
        JsonNode resolver = root.path("resolver");

        boolean trace = boolOrDefault(resolver, "trace", defaults.trace());
        String charsetName = textOrDefault(resolver, "charset", defaults.charset().name());

        if (isSet(envLookup, ENV_TRACE)) {
            trace = Boolean.parseBoolean(envLookup.apply(ENV_TRACE).trim());
        }
        if (isSet(envLookup, ENV_CHARSET)) {
            charsetName = envLookup.apply(ENV_CHARSET).trim();
        }

        return ResolverConfig.builder()
                .trace(trace)
                .charset(toCharset(charsetName))
                .build();
    }

    private static Charset toCharset(String name) {
        try {
            return Charset.forName(name);
        } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
            throw new ConfigLoadException("Unknown charset: " + name, e);
        }
    }

    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static String textOrDefault(JsonNode node, String field, String defaultValue) {
        return node.has(field) ? node.get(field).asText() : defaultValue;
    }

    private static boolean boolOrDefault(JsonNode node, String field, boolean defaultValue) {
        return node.has(field) ? node.get(field).asBoolean() : defaultValue;
    }
}

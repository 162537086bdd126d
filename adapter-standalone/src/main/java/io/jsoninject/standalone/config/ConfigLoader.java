package io.jsoninject.standalone.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.jsoninject.core.engine.InjectionSettings;
import io.jsoninject.core.engine.PayloadValidationMode;
import io.jsoninject.core.json.NullPolicy;
import io.jsoninject.core.model.PathValidationMode;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Locale;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.IntConsumer;

/**
 * Loads {@link ServerConfig} from a YAML file with an environment variable overlay.
 *
 * <p>Supports two invocation patterns:
 *
 * <ul>
 *   <li>Default: loads {@code json-inject.yaml} from the current directory
 *   <li>{@code --config /path/to/config.yaml}: loads from the specified path
 * </ul>
 *
 * <p>Missing keys receive the defaults of {@link ServerConfig.Builder} and {@link
 * InjectionSettings.Builder}. Every key can be overridden by an environment variable; env vars win
 * over YAML. An env var counts as set only if it is defined and non-blank after trimming.
 *
 * <pre>
 * SERVER_HOST  SERVER_PORT  SERVER_CSP_NONCE  PAGES_DIR
 * DB_URL  DB_USERNAME  DB_PASSWORD  DB_MAX_POOL_SIZE  DB_CONNECTION_TIMEOUT_MS  DB_READ_ONLY
 * INJECT_CHUNK_SIZE  INJECT_NULL_POLICY  INJECT_PATH_VALIDATION  INJECT_PAYLOAD_VALIDATION
 * INJECT_GLOBAL_OBJECT  HEALTH_ENABLED  HEALTH_PATH  LOG_FORMAT  LOG_LEVEL
 * </pre>
 */
public final class ConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    static final String DEFAULT_CONFIG_FILE = "json-inject.yaml";

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads configuration from {@code configPath}, applying overrides from {@link System#getenv}.
     *
     * @throws ConfigLoadException if the file is missing, not valid YAML, or holds invalid values
     */
    public static ServerConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads configuration from {@code configPath}, applying overrides from {@code envLookup}.
     * Returning {@code null} from the lookup means the variable is not defined.
     *
     * @throws ConfigLoadException if the file is missing, not valid YAML, or holds invalid values
     */
    public static ServerConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException(
                    "Configuration file not found: " + configPath + ". Use --config <path> to specify a config file.");
        }

        try (InputStream in = Files.newInputStream(configPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            return mapToConfig(root == null ? YAML_MAPPER.createObjectNode() : root, envLookup);
        } catch (ConfigLoadException e) {
            throw e;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        } catch (RuntimeException e) {
            throw new ConfigLoadException(
                    "Invalid configuration in " + configPath + ": " + e.getMessage(), e);
        }
    }

    /**
     * Resolves the config file path from CLI arguments.
     *
     * @throws IllegalArgumentException if {@code --config} has no value
     */
    public static Path resolveConfigPath(String[] args) {
        for (int i = 0; i < args.length; i++) {
            if ("--config".equals(args[i])) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("--config requires a file path argument");
                }
                return Path.of(args[i + 1]);
            }
        }
        return Path.of(DEFAULT_CONFIG_FILE);
    }

    private static ServerConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        ServerConfig.Builder builder = ServerConfig.builder();

        // Server
        JsonNode server = root.path("server");
        if (server.has("host")) builder.host(server.get("host").asText());
        if (server.has("port")) builder.port(server.get("port").asInt());
        if (server.has("csp-nonce")) builder.cspNonce(server.get("csp-nonce").asBoolean());

        // Pages
        JsonNode pages = root.path("pages");
        if (pages.has("dir")) builder.pagesDir(pages.get("dir").asText());

        // Health
        JsonNode health = root.path("health");
        if (health.has("enabled")) builder.healthEnabled(health.get("enabled").asBoolean());
        if (health.has("path")) builder.healthPath(health.get("path").asText());

        // Logging
        JsonNode logging = root.path("logging");
        if (logging.has("format")) builder.loggingFormat(logging.get("format").asText());
        if (logging.has("level")) builder.loggingLevel(logging.get("level").asText());

        // Simple overrides
        envString(envLookup, "SERVER_HOST", builder::host);
        envInt(envLookup, "SERVER_PORT", builder::port);
        envBool(envLookup, "SERVER_CSP_NONCE", builder::cspNonce);
        envString(envLookup, "PAGES_DIR", builder::pagesDir);
        envBool(envLookup, "HEALTH_ENABLED", builder::healthEnabled);
        envString(envLookup, "HEALTH_PATH", builder::healthPath);
        envString(envLookup, "LOG_FORMAT", builder::loggingFormat);
        envString(envLookup, "LOG_LEVEL", builder::loggingLevel);

        // Records are immutable: rebuild them with YAML values, then env overrides
        builder.dataSource(dataSource(root.path("datasource"), envLookup));
        builder.injection(injection(root.path("injection"), envLookup));

        return builder.build();
    }

    private static DataSourceConfig dataSource(JsonNode node, Function<String, String> envLookup) {
        DataSourceConfig defaults = DataSourceConfig.NONE;
        return new DataSourceConfig(
                envStringOrDefault(envLookup, "DB_URL", textOrDefault(node, "url", defaults.url())),
                envStringOrDefault(envLookup, "DB_USERNAME", textOrDefault(node, "username", defaults.username())),
                envStringOrDefault(envLookup, "DB_PASSWORD", textOrDefault(node, "password", defaults.password())),
                envIntOrDefault(envLookup, "DB_MAX_POOL_SIZE", intOrDefault(node, "max-pool-size", defaults.maxPoolSize())),
                envIntOrDefault(
                        envLookup,
                        "DB_CONNECTION_TIMEOUT_MS",
                        intOrDefault(node, "connection-timeout-ms", defaults.connectionTimeoutMs())),
                envBoolOrDefault(envLookup, "DB_READ_ONLY", boolOrDefault(node, "read-only", defaults.readOnly())));
    }

    private static InjectionSettings injection(JsonNode node, Function<String, String> envLookup) {
        InjectionSettings defaults = InjectionSettings.DEFAULT;
        return InjectionSettings.builder()
                .chunkSize(envIntOrDefault(envLookup, "INJECT_CHUNK_SIZE", intOrDefault(node, "chunk-size", defaults.chunkSize())))
                .nullPolicy(enumValue(
                        NullPolicy.class,
                        envStringOrDefault(envLookup, "INJECT_NULL_POLICY", textOrDefault(node, "null-policy", null)),
                        defaults.nullPolicy(),
                        "injection.null-policy"))
                .pathValidation(enumValue(
                        PathValidationMode.class,
                        envStringOrDefault(envLookup, "INJECT_PATH_VALIDATION", textOrDefault(node, "path-validation", null)),
                        defaults.pathValidation(),
                        "injection.path-validation"))
                .payloadValidation(enumValue(
                        PayloadValidationMode.class,
                        envStringOrDefault(
                                envLookup, "INJECT_PAYLOAD_VALIDATION", textOrDefault(node, "payload-validation", null)),
                        defaults.payloadValidation(),
                        "injection.payload-validation"))
                .globalObject(envStringOrDefault(
                        envLookup, "INJECT_GLOBAL_OBJECT", textOrDefault(node, "global-object", defaults.globalObject())))
                .build();
    }

    /** Maps {@code json-null} / {@code JSON_NULL} style values onto enum constants. */
    private static <E extends Enum<E>> E enumValue(Class<E> type, String value, E defaultValue, String key) {
        if (value == null) {
            return defaultValue;
        }
        String normalized = value.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        try {
            return Enum.valueOf(type, normalized);
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException("Invalid value '" + value + "' for " + key + "; expected one of "
                    + Arrays.toString(type.getEnumConstants()).toLowerCase(Locale.ROOT).replace('_', '-'));
        }
    }

    // --- Env var helpers ---

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
            setter.accept(parseInt(envVar, envLookup.apply(envVar)));
        }
    }

    private static void envBool(Function<String, String> envLookup, String envVar, Consumer<Boolean> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(Boolean.parseBoolean(envLookup.apply(envVar).trim()));
        }
    }

    private static String envStringOrDefault(Function<String, String> envLookup, String envVar, String yamlDefault) {
        return isSet(envLookup, envVar) ? envLookup.apply(envVar).trim() : yamlDefault;
    }

    private static boolean envBoolOrDefault(Function<String, String> envLookup, String envVar, boolean yamlDefault) {
        return isSet(envLookup, envVar) ? Boolean.parseBoolean(envLookup.apply(envVar).trim()) : yamlDefault;
    }

    private static int envIntOrDefault(Function<String, String> envLookup, String envVar, int yamlDefault) {
        return isSet(envLookup, envVar) ? parseInt(envVar, envLookup.apply(envVar)) : yamlDefault;
    }

    private static int parseInt(String envVar, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigLoadException("Environment variable " + envVar + " is not an integer: '" + value + "'", e);
        }
    }

    // --- YAML helpers ---

    private static String textOrDefault(JsonNode node, String field, String defaultValue) {
        return node.hasNonNull(field) ? node.get(field).asText() : defaultValue;
    }

    private static boolean boolOrDefault(JsonNode node, String field, boolean defaultValue) {
        return node.has(field) ? node.get(field).asBoolean() : defaultValue;
    }

    private static int intOrDefault(JsonNode node, String field, int defaultValue) {
        return node.has(field) ? node.get(field).asInt() : defaultValue;
    }
}

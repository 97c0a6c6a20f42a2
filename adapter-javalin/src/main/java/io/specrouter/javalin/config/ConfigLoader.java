package io.specrouter.javalin.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.IntConsumer;

/**
 * Loads {@link ServerConfig} from a YAML file with an environment variable overlay.
 *
 * <p>Two invocation patterns:
 * <ul>
 *   <li>default: loads {@code spec-router.yaml} from the current directory;
 *   <li>{@code --config /path/to/config.yaml}: loads the given file.
 * </ul>
 *
 * <p>Every key can be overridden by a {@code SPEC_ROUTER_*} environment variable, which takes
 * precedence over the YAML value. A variable counts as set only if it is defined and non-blank
 * after trimming; otherwise the YAML value stands.
 *
 * <pre>
 * server:
 *   host: 0.0.0.0
 *   port: 8000
 * contracts:
 *   path: ./contracts
 *   validators: [standards]
 *   strict: false
 *   artifact-dir: ./build/models
 * openapi:
 *   path: /openapi.json
 *   title: Spec Router
 *   version: 0.1.0
 * health:
 *   enabled: true
 *   path: /health
 * logging:
 *   format: text
 *   level: INFO
 * </pre>
 */
public final class ConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final String DEFAULT_CONFIG_FILE = "spec-router.yaml";
    static final String ENV_PREFIX = "SPEC_ROUTER_";

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads the configuration, applying overrides from {@link System#getenv}.
     *
     * @throws ConfigLoadException if the file is missing or contains invalid YAML
     */
    public static ServerConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads the configuration, applying overrides from the supplied lookup. The lookup maps
     * variable names to values; {@code null} means undefined.
     *
     * @throws ConfigLoadException if the file is missing or contains invalid YAML
     */
    public static ServerConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException(
                    "Configuration file not found: " + configPath + ". Use --config <path> to specify a config file.");
        }

        try (InputStream in = Files.newInputStream(configPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            return mapToConfig(root != null ? root : YAML_MAPPER.createObjectNode(), envLookup);
        } catch (ConfigLoadException e) {
            throw e;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        } catch (RuntimeException e) {
            throw new ConfigLoadException("Failed to load configuration from: " + configPath, e);
        }
    }

    /**
     * Resolves the config file path from command-line arguments.
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

        // --- YAML mapping ---

        JsonNode server = root.path("server");
        if (server.has("host")) builder.host(server.get("host").asText());
        if (server.has("port")) builder.port(requireInt(server.get("port"), "server.port"));

        JsonNode contracts = root.path("contracts");
        if (contracts.has("path")) builder.contractsPath(contracts.get("path").asText());
        if (contracts.has("validators")) builder.validators(stringList(contracts.get("validators")));
        if (contracts.has("strict")) builder.strict(contracts.get("strict").asBoolean());
        if (contracts.has("artifact-dir")) builder.artifactDir(contracts.get("artifact-dir").asText());

        JsonNode openapi = root.path("openapi");
        if (openapi.has("path")) builder.openapiPath(openapi.get("path").asText());
        if (openapi.has("title")) builder.openapiTitle(openapi.get("title").asText());
        if (openapi.has("version")) builder.openapiVersion(openapi.get("version").asText());

        JsonNode health = root.path("health");
        if (health.has("enabled")) builder.healthEnabled(health.get("enabled").asBoolean());
        if (health.has("path")) builder.healthPath(health.get("path").asText());

        JsonNode logging = root.path("logging");
        if (logging.has("format")) builder.loggingFormat(logging.get("format").asText());
        if (logging.has("level")) builder.loggingLevel(logging.get("level").asText());

        // --- Environment variable overlay ---

        envString(envLookup, "HOST", builder::host);
        envInt(envLookup, "PORT", builder::port);
        envString(envLookup, "CONTRACTS", builder::contractsPath);
        envString(envLookup, "VALIDATORS", value -> builder.validators(splitList(value)));
        envBool(envLookup, "STRICT", builder::strict);
        envString(envLookup, "ARTIFACT_DIR", builder::artifactDir);
        envString(envLookup, "OPENAPI_PATH", builder::openapiPath);
        envString(envLookup, "OPENAPI_TITLE", builder::openapiTitle);
        envString(envLookup, "OPENAPI_VERSION", builder::openapiVersion);
        envBool(envLookup, "HEALTH_ENABLED", builder::healthEnabled);
        envString(envLookup, "HEALTH_PATH", builder::healthPath);
        envString(envLookup, "LOG_FORMAT", builder::loggingFormat);
        envString(envLookup, "LOG_LEVEL", builder::loggingLevel);

        return builder.build();
    }

    // --- Env var helpers ---

    /** {@code true} if the variable is defined and non-blank after trimming. */
    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static void envString(Function<String, String> envLookup, String key, Consumer<String> setter) {
        String envVar = ENV_PREFIX + key;
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }

    private static void envInt(Function<String, String> envLookup, String key, IntConsumer setter) {
        String envVar = ENV_PREFIX + key;
        if (isSet(envLookup, envVar)) {
            String value = envLookup.apply(envVar).trim();
            try {
                setter.accept(Integer.parseInt(value));
            } catch (NumberFormatException e) {
                throw new ConfigLoadException(envVar + " must be an integer, got: " + value, e);
            }
        }
    }

    private static void envBool(Function<String, String> envLookup, String key, Consumer<Boolean> setter) {
        String envVar = ENV_PREFIX + key;
        if (isSet(envLookup, envVar)) {
            setter.accept(Boolean.parseBoolean(envLookup.apply(envVar).trim()));
        }
    }

    // --- YAML helpers ---

    private static int requireInt(JsonNode node, String key) {
        if (node.isIntegralNumber() && node.canConvertToInt()) {
            return node.asInt();
        }
        if (node.isTextual()) {
            try {
                return Integer.parseInt(node.asText().trim());
            } catch (NumberFormatException e) {
                throw new ConfigLoadException(key + " must be an integer, got: " + node, e);
            }
        }
        throw new ConfigLoadException(key + " must be an integer, got: " + node);
    }

    private static List<String> stringList(JsonNode node) {
        if (node.isTextual()) {
            return splitList(node.asText());
        }
        List<String> values = new ArrayList<>();
        node.forEach(item -> values.add(item.asText().trim()));
        return values;
    }

    private static List<String> splitList(String value) {
        return Arrays.stream(value.split(",")).map(String::trim).filter(s -> !s.isEmpty()).toList();
    }
}

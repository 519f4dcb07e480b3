package io.templateemit.core.config;

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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads {@link EmitterSettings} from a JSON or YAML configuration file with an optional
 * environment variable overlay.
 *
 * <p>Recognized keys:
 *
 * <pre>
 * experimentalFeaturesEnabled:
 *   symbolicNameCodegen: true
 * emit:
 *   moduleDeploymentApiVersion: "2020-10-01"
 * </pre>
 *
 * <p>Files ending in {@code .yaml} or {@code .yml} are read as YAML, everything else as JSON. Keys
 * that are absent keep their defaults.
 *
 * <p>Environment overlay: {@value #ENV_SYMBOLIC_NAME_CODEGEN} and {@value #ENV_MODULE_API_VERSION}
 * take precedence over file values. A variable counts as set only when it is defined and non-blank
 * after trimming.
 */
public final class EmitterSettingsLoader {

    private static final Logger LOG = LoggerFactory.getLogger(EmitterSettingsLoader.class);

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    public static final String ENV_SYMBOLIC_NAME_CODEGEN = "TEMPLATE_EMIT_SYMBOLIC_NAME_CODEGEN";
    public static final String ENV_MODULE_API_VERSION = "TEMPLATE_EMIT_MODULE_API_VERSION";

    private EmitterSettingsLoader() {
        // utility class
    }

    /**
     * Loads settings from the given file, applying overrides from {@link System#getenv}.
     *
     * @param path JSON or YAML configuration file
     * @return the loaded settings
     * @throws SettingsLoadException if the file is missing or cannot be parsed
     */
    public static EmitterSettings load(Path path) {
        return load(path, System::getenv);
    }

    /**
     * Loads settings from the given file, applying overrides from the supplied lookup.
     *
     * @param path JSON or YAML configuration file
     * @param envLookup maps variable names to values; {@code null} means undefined
     * @return the loaded settings
     * @throws SettingsLoadException if the file is missing or cannot be parsed
     */
    public static EmitterSettings load(Path path, Function<String, String> envLookup) {
        if (!Files.exists(path)) {
            throw new SettingsLoadException("Settings file not found: " + path);
        }

        JsonNode root;
        try (InputStream in = Files.newInputStream(path)) {
            root = mapperFor(path).readTree(in);
        } catch (IOException e) {
            throw new SettingsLoadException("Failed to parse settings file: " + path, e);
        }

        EmitterSettings settings = fromTree(root, envLookup);
        LOG.info(
                "Emitter settings loaded: source={}, symbolic_name_codegen={}, module_api_version={}",
                path,
                settings.symbolicNameCodegen(),
                settings.moduleDeploymentApiVersion());
        return settings;
    }

    /**
     * Maps an already-parsed configuration tree, then applies the environment overlay. A
     * {@code null} or missing tree yields the defaults plus overrides.
     */
    public static EmitterSettings fromTree(JsonNode root, Function<String, String> envLookup) {
        EmitterSettings.Builder builder = EmitterSettings.builder();

        if (root != null && !root.isMissingNode() && !root.isNull()) {
            if (!root.isObject()) {
                throw new SettingsLoadException("Settings root must be an object, got " + root.getNodeType());
            }
            JsonNode features = root.path("experimentalFeaturesEnabled");
            if (features.has("symbolicNameCodegen")) {
                builder.symbolicNameCodegen(requireBoolean(features.get("symbolicNameCodegen"),
                        "experimentalFeaturesEnabled.symbolicNameCodegen"));
            }
            JsonNode emit = root.path("emit");
            if (emit.has("moduleDeploymentApiVersion")) {
                builder.moduleDeploymentApiVersion(emit.get("moduleDeploymentApiVersion").asText());
            }
        }

        envBool(envLookup, ENV_SYMBOLIC_NAME_CODEGEN, builder::symbolicNameCodegen);
        envString(envLookup, ENV_MODULE_API_VERSION, builder::moduleDeploymentApiVersion);

        try {
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new SettingsLoadException("Invalid emitter settings: " + e.getMessage(), e);
        }
    }

    private static ObjectMapper mapperFor(Path path) {
        String fileName = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return fileName.endsWith(".yaml") || fileName.endsWith(".yml") ? YAML_MAPPER : JSON_MAPPER;
    }

    private static boolean requireBoolean(JsonNode node, String key) {
        if (!node.isBoolean()) {
            throw new SettingsLoadException("Setting '" + key + "' must be a boolean, got " + node.getNodeType());
        }
        return node.booleanValue();
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

    private static void envBool(Function<String, String> envLookup, String envVar, Consumer<Boolean> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(Boolean.parseBoolean(envLookup.apply(envVar).trim()));
        }
    }
}

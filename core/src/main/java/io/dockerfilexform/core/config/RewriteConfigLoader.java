package io.dockerfilexform.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Loads {@link RewriteConfig} from a YAML file with an optional environment variable overlay.
 *
 * <pre>
 * build-args:
 *   - BASE=ubuntu
 *   - TAG
 * skip-stage-references: true
 * preserve-spacing: true
 * </pre>
 *
 * <p>
 * Environment variables take precedence over YAML values:
 * <ul>
 * <li>{@code DFX_BUILD_ARGS}: comma-separated build args, replacing the YAML list</li>
 * <li>{@code DFX_SKIP_STAGE_REFERENCES}: {@code true}/{@code false}</li>
 * <li>{@code DFX_PRESERVE_SPACING}: {@code true}/{@code false}</li>
 * </ul>
 * A variable counts as set only if it is defined and its trimmed value is non-empty.
 */
public final class RewriteConfigLoader {

    /** File name looked up by {@link #resolveConfigPath(Path)}. */
    public static final String DEFAULT_CONFIG_FILE = "dockerfile-xform.yaml";

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private RewriteConfigLoader() {
        // utility class
    }

    /**
     * Loads the configuration at {@code configPath}, applying overrides from {@link System#getenv}.
     *
     * @throws ConfigLoadException if the file is missing or invalid
     */
    public static RewriteConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads the configuration at {@code configPath}, applying overrides from {@code envLookup}
     * ({@code null} means the variable is not defined).
     *
     * @throws ConfigLoadException if the file is missing or invalid
     */
    public static RewriteConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException("Configuration file not found: " + configPath);
        }
        try (InputStream in = Files.newInputStream(configPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            return mapToConfig(root, envLookup, configPath.toString());
        } catch (ConfigLoadException e) {
            throw e;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        }
    }

    /** Builds a configuration from defaults and the environment only (no file). */
    public static RewriteConfig fromEnvironment(Function<String, String> envLookup) {
        RewriteConfig.Builder builder = RewriteConfig.builder();
        applyEnvOverrides(builder, envLookup);
        return builder.build();
    }

    /**
     * Returns {@code directory/dockerfile-xform.yaml} if it exists, otherwise {@code null}.
     */
    public static Path resolveConfigPath(Path directory) {
        Path candidate = directory.resolve(DEFAULT_CONFIG_FILE);
        return Files.isRegularFile(candidate) ? candidate : null;
    }

    private static RewriteConfig mapToConfig(JsonNode root, Function<String, String> envLookup, String source) {
        RewriteConfig.Builder builder = RewriteConfig.builder();

        if (root != null && !root.isMissingNode() && !root.isNull()) {
            if (!root.isObject()) {
                throw new ConfigLoadException("Configuration root must be a mapping: " + source);
            }
            JsonNode buildArgs = root.path("build-args");
            if (!buildArgs.isMissingNode() && !buildArgs.isNull()) {
                if (!buildArgs.isArray()) {
                    throw new ConfigLoadException("'build-args' must be a list of KEY=VALUE strings: " + source);
                }
                List<String> values = new ArrayList<>();
                buildArgs.forEach(arg -> values.add(arg.asText()));
                builder.buildArgs(values);
            }
            if (root.has("skip-stage-references")) {
                builder.skipStageReferences(root.get("skip-stage-references").asBoolean());
            }
            if (root.has("preserve-spacing")) {
                builder.preserveSpacing(root.get("preserve-spacing").asBoolean());
            }
        }

        applyEnvOverrides(builder, envLookup);
        return builder.build();
    }

    private static void applyEnvOverrides(RewriteConfig.Builder builder, Function<String, String> envLookup) {
        if (isSet(envLookup, "DFX_BUILD_ARGS")) {
            List<String> values = new ArrayList<>();
            for (String arg : envLookup.apply("DFX_BUILD_ARGS").split(",")) {
                if (!arg.isBlank()) {
                    values.add(arg.trim());
                }
            }
            builder.buildArgs(values);
        }
        envBool(envLookup, "DFX_SKIP_STAGE_REFERENCES", builder::skipStageReferences);
        envBool(envLookup, "DFX_PRESERVE_SPACING", builder::preserveSpacing);
    }

    /** An env var is "set" if it is non-null and non-empty after trimming. */
    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static void envBool(Function<String, String> envLookup, String envVar, Consumer<Boolean> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(Boolean.parseBoolean(envLookup.apply(envVar).trim()));
        }
    }
}

package net.cloudtolocalllm.relay.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.yaml.snakeyaml.Yaml;

public final class ConfigLoader {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);

    private ConfigLoader() {
    }

    /**
     * Load and validate the relay YAML configuration.
     * <p>
     * A missing file is replaced by the generated default and reported as an error so the
     * operator reviews it before the first start.
     */
    public static RelayConfig load(Path path) {
        if (path == null) {
            throw new ConfigException("Config path is required");
        }
        if (!Files.exists(path)) {
            writeDefaultConfig(path);
            throw new ConfigException("Config file did not exist, generated default at: " + path);
        }
        Object raw;
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            raw = new Yaml().load(reader);
        } catch (IOException e) {
            throw new ConfigException("Failed to read config: " + path, e);
        } catch (RuntimeException e) {
            throw new ConfigException("Config is not valid YAML: " + path, e);
        }
        if (raw == null) {
            throw new ConfigException("Config file is empty: " + path);
        }
        return parse(EnvExpander.expand(raw, path.toAbsolutePath().getParent()), path.toString());
    }

    /**
     * Map an already expanded YAML tree onto {@link RelayConfig} and validate it.
     */
    static RelayConfig parse(Object expanded, String source) {
        RelayConfig config;
        try {
            config = MAPPER.convertValue(expanded, RelayConfig.class);
        } catch (IllegalArgumentException e) {
            throw new ConfigException("Failed to parse config: " + source, e);
        }
        ConfigValidator.validate(config);
        return config;
    }

    private static void writeDefaultConfig(Path path) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(
                    path,
                    ConfigDefaults.defaultYaml(),
                    StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE_NEW
            );
        } catch (IOException e) {
            throw new ConfigException("Failed to write default config: " + path, e);
        }
    }
}

package net.cloudtolocalllm.relay.config;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Resolves {@code env:NAME} and {@code path:file} references in raw YAML values.
 */
final class EnvExpander {
    private static final String ENV_PREFIX = "env:";
    private static final String PATH_PREFIX = "path:";

    private final Path baseDir;
    private final Function<String, String> environment;

    EnvExpander(Path baseDir, Function<String, String> environment) {
        this.baseDir = baseDir;
        this.environment = environment;
    }

    static Object expand(Object value, Path baseDir) {
        return new EnvExpander(baseDir, System::getenv).expand(value);
    }

    Object expand(Object value) {
        if (value instanceof Map) {
            Map<Object, Object> expanded = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                expanded.put(entry.getKey(), expand(entry.getValue()));
            }
            return expanded;
        }
        if (value instanceof List) {
            List<?> raw = (List<?>) value;
            List<Object> expanded = new ArrayList<>(raw.size());
            for (Object item : raw) {
                expanded.add(expand(item));
            }
            return expanded;
        }
        if (value instanceof String) {
            String raw = (String) value;
            if (raw.startsWith(ENV_PREFIX)) {
                return readEnvironment(raw.substring(ENV_PREFIX.length()).trim());
            }
            if (raw.startsWith(PATH_PREFIX)) {
                return readFile(raw.substring(PATH_PREFIX.length()).trim());
            }
        }
        return value;
    }

    private String readEnvironment(String key) {
        if (key.isEmpty()) {
            throw new ConfigException("Environment reference has no variable name");
        }
        String envValue = environment.apply(key);
        if (envValue == null) {
            throw new ConfigException("Missing required environment variable: " + key);
        }
        return envValue;
    }

    private String readFile(String location) {
        if (location.isEmpty()) {
            throw new ConfigException("Path value is empty");
        }
        Path resolved = resolvePath(location);
        try {
            String content = Files.readString(resolved, StandardCharsets.UTF_8).strip();
            if (content.isEmpty()) {
                throw new ConfigException("Path value is empty: " + resolved);
            }
            return content;
        } catch (IOException e) {
            throw new ConfigException("Failed to read config path: " + resolved, e);
        }
    }

    private Path resolvePath(String rawValue) {
        try {
            Path path = Paths.get(rawValue);
            if (baseDir != null && !path.isAbsolute()) {
                return baseDir.resolve(path).normalize();
            }
            return path;
        } catch (InvalidPathException e) {
            throw new ConfigException("Invalid path value: " + rawValue, e);
        }
    }
}

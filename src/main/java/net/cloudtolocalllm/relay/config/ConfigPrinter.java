package net.cloudtolocalllm.relay.config;

import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

/**
 * Renders the effective configuration with sensitive values redacted.
 */
public final class ConfigPrinter {
    private static final String REDACTED = "<redacted>";
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    private ConfigPrinter() {
    }

    public static String toYaml(RelayConfig config) {
        Map<String, Object> data = MAPPER.convertValue(config, new TypeReference<Map<String, Object>>() {
        });
        redact(data);
        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        return new Yaml(options).dump(data);
    }

    @SuppressWarnings("unchecked")
    private static void redact(Object node) {
        if (node instanceof Map) {
            Map<String, Object> map = (Map<String, Object>) node;
            for (Map.Entry<String, Object> entry : map.entrySet()) {
                if (isSensitive(entry.getKey()) && entry.getValue() != null) {
                    entry.setValue(REDACTED);
                } else {
                    redact(entry.getValue());
                }
            }
        } else if (node instanceof List) {
            for (Object item : (List<?>) node) {
                redact(item);
            }
        }
    }

    private static boolean isSensitive(String key) {
        if (key == null) {
            return false;
        }
        String lower = key.toLowerCase(Locale.ROOT);
        return lower.contains("token") || lower.contains("secret") || lower.contains("password");
    }
}

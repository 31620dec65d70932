package io.mnemo.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.mnemo.core.config.model.StorageConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Loads {@link StorageConfig} from a snake_case JSON file layered over the built-in defaults.
 */
public final class ConfigService {
    private final ObjectMapper mapper;

    public ConfigService() {
        mapper = new ObjectMapper();
        mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
    }

    public StorageConfig load(Path configPath) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        if (!Files.exists(configPath)) {
            return StorageConfig.defaults();
        }
        String json = Files.readString(configPath);
        if (json.isBlank()) {
            return StorageConfig.defaults();
        }

        ObjectNode defaultsNode = mapper.valueToTree(StorageConfig.defaults());
        ObjectNode layered = layerOverDefaults(defaultsNode, mapper.readTree(json), "config");
        return mapper.treeToValue(layered, StorageConfig.class).validate();
    }

    public void save(Path configPath, StorageConfig config) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        Objects.requireNonNull(config, "config must not be null");
        Path parent = configPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(configPath, toPrettyJson(config) + System.lineSeparator());
    }

    public String toPrettyJson(StorageConfig config) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize storage config", e);
        }
    }

    // null or absent fields keep the built-in value; nested objects such as retention_policies layer key by key
    private static ObjectNode layerOverDefaults(ObjectNode defaults, JsonNode file, String where) {
        if (file == null || !file.isObject()) {
            throw new ConfigurationException(where + " must be a JSON object");
        }
        ObjectNode layered = defaults.deepCopy();
        file.fields().forEachRemaining(field -> {
            JsonNode value = field.getValue();
            if (value.isNull()) {
                return;
            }
            JsonNode current = layered.get(field.getKey());
            if (current instanceof ObjectNode nested && value.isObject()) {
                layered.set(field.getKey(), layerOverDefaults(nested, value, where + "." + field.getKey()));
            } else {
                layered.set(field.getKey(), value);
            }
        });
        return layered;
    }
}

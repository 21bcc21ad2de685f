package io.mirrorme.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.mirrorme.core.config.model.MirrorMeConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads and writes the JSON config file.
 *
 * <p>The file on disk is laid over {@link MirrorMeConfig#defaults()} key by key, so a file written by an
 * older version still loads with every newer setting present. Keys may be camelCase or snake_case.
 */
public final class ConfigService {
    private static final Logger LOG = LoggerFactory.getLogger(ConfigService.class);
    private static final Map<String, String> RENAMED_KEYS = Map.of("days_back", "windowDays", "url", "apiBase");
    private static final String VERBATIM_SECTION = "extraHeaders";

    private final ObjectMapper mapper;

    public ConfigService() {
        mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public MirrorMeConfig load(Path configPath) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        if (!Files.exists(configPath)) {
            LOG.debug("No config at {}, using defaults", configPath);
            return MirrorMeConfig.defaults();
        }

        JsonNode onDisk = normalizeKeys(mapper.readTree(Files.readString(configPath)));
        JsonNode merged = overlay(mapper.valueToTree(MirrorMeConfig.defaults()), onDisk);
        return mapper.treeToValue(merged, MirrorMeConfig.class);
    }

    public void save(Path configPath, MirrorMeConfig config) throws IOException {
        Objects.requireNonNull(config, "config must not be null");
        Path parent = Objects.requireNonNull(configPath, "configPath must not be null").toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(configPath, toPrettyJson(config) + System.lineSeparator());
    }

    /**
     * Writes the config file. An existing file is refreshed with any new default keys, or replaced
     * by the defaults when {@code overwrite} is set.
     */
    public InitResult init(Path configPath, boolean overwrite) throws IOException {
        if (!Files.exists(configPath)) {
            save(configPath, MirrorMeConfig.defaults());
            return new InitResult(configPath, true, false);
        }
        save(configPath, overwrite ? MirrorMeConfig.defaults() : load(configPath));
        return new InitResult(configPath, false, overwrite);
    }

    public String toPrettyJson(MirrorMeConfig config) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize config", e);
        }
    }

    private static JsonNode overlay(JsonNode defaults, JsonNode onDisk) {
        if (onDisk == null || onDisk.isNull()) {
            return defaults;
        }
        if (defaults == null || !defaults.isObject() || !onDisk.isObject()) {
            return onDisk;
        }
        ObjectNode merged = ((ObjectNode) defaults).deepCopy();
        for (Iterator<Map.Entry<String, JsonNode>> it = onDisk.fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> entry = it.next();
            merged.set(entry.getKey(), overlay(merged.get(entry.getKey()), entry.getValue()));
        }
        return merged;
    }

    private JsonNode normalizeKeys(JsonNode node) {
        if (node == null || !node.isObject()) {
            return node;
        }
        ObjectNode normalized = mapper.createObjectNode();
        for (Iterator<Map.Entry<String, JsonNode>> it = node.fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> entry = it.next();
            String key = RENAMED_KEYS.getOrDefault(entry.getKey(), camelCase(entry.getKey()));
            // header names are sent as written
            normalized.set(key, VERBATIM_SECTION.equals(key) ? entry.getValue() : normalizeKeys(entry.getValue()));
        }
        return normalized;
    }

    static String camelCase(String key) {
        if (key.indexOf('_') < 0) {
            return key;
        }
        StringBuilder out = new StringBuilder(key.length());
        boolean upper = false;
        for (char c : key.toCharArray()) {
            if (c == '_') {
                upper = out.length() > 0;
            } else {
                out.append(upper ? Character.toUpperCase(c) : c);
                upper = false;
            }
        }
        return out.toString();
    }
}

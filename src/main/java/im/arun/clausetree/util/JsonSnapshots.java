package im.arun.clausetree.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Diff-stable JSON for graphs, solutions and payloads: properties and map
 * entries sorted by key, enums by wire name, indented output. Identical
 * values always serialize to identical bytes, so snapshots can be compared
 * as golden fixtures.
 */
public class JsonSnapshots {
    private static final Logger logger = LoggerFactory.getLogger(JsonSnapshots.class);

    private final ObjectMapper objectMapper;

    public JsonSnapshots() {
        this.objectMapper = JsonMapper.builder()
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .enable(SerializationFeature.WRITE_ENUMS_USING_TO_STRING)
            .enable(SerializationFeature.INDENT_OUTPUT)
            .build();
    }

    public String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize " + value.getClass().getSimpleName(), e);
        }
    }

    public JsonNode toTree(Object value) {
        return objectMapper.valueToTree(value);
    }

    /**
     * Writes the snapshot with a trailing newline, creating parent directories as needed.
     */
    public void write(Path path, Object value) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(path, toJson(value) + "\n", StandardCharsets.UTF_8);
            logger.debug("Wrote snapshot to {}", path);
        } catch (IOException e) {
            logger.error("Failed to write snapshot: {}", path, e);
            throw new UncheckedIOException(e);
        }
    }
}

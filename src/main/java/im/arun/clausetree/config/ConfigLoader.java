package im.arun.clausetree.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Set;

public class ConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);
    static final String DEFAULT_RESOURCE = "clausetree.yaml";

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final ClauseTreeConfig defaultConfig;
    private final Set<String> knownKeys;

    public ConfigLoader() {
        this(null);
    }

    /**
     * @param configPath optional YAML file; it takes precedence over the classpath resource
     */
    public ConfigLoader(String configPath) {
        this.defaultConfig = loadDefaultConfig(configPath);
        this.knownKeys = yamlMapper.convertValue(new ClauseTreeConfig(),
            new TypeReference<Map<String, Object>>() { }).keySet();
    }

    private ClauseTreeConfig loadDefaultConfig(String configPath) {
        try {
            if (configPath != null) {
                Path path = Paths.get(configPath);
                if (Files.exists(path)) {
                    logger.debug("Loading configuration from {}", path);
                    return yamlMapper.readValue(path.toFile(), ClauseTreeConfig.class);
                }
                logger.warn("Config file {} does not exist, falling back to classpath", configPath);
            }

            try (InputStream resourceStream = getClass().getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
                if (resourceStream != null) {
                    return yamlMapper.readValue(resourceStream, ClauseTreeConfig.class);
                }
            }

            logger.warn("No {} found, using default configuration", DEFAULT_RESOURCE);
            return new ClauseTreeConfig();
        } catch (IOException e) {
            logger.warn("Failed to load configuration, using defaults: {}", e.getMessage());
            return new ClauseTreeConfig();
        }
    }

    public ClauseTreeConfig load() {
        return defaultConfig.copy();
    }

    /**
     * Returns a copy of the loaded configuration with the given overrides applied.
     * Keys may be snake_case ({@code beam_width}) or camelCase ({@code beamWidth});
     * unknown keys and unconvertible values are logged and skipped.
     */
    public ClauseTreeConfig load(Map<String, Object> userOptions) {
        ClauseTreeConfig config = defaultConfig.copy();

        if (userOptions == null || userOptions.isEmpty()) {
            return config;
        }

        userOptions.forEach((key, value) -> {
            String property = toSnakeCase(key);
            if (!knownKeys.contains(property)) {
                logger.warn("Unknown configuration key: {}", key);
                return;
            }
            if (value == null) {
                logger.warn("Ignoring null value for configuration key: {}", key);
                return;
            }
            try {
                yamlMapper.updateValue(config, Map.of(property, normalizeValue(value)));
            } catch (IOException | IllegalArgumentException e) {
                logger.error("Error setting config key {}: {}", key, e.getMessage());
            }
        });

        return config;
    }

    private Object normalizeValue(Object value) {
        if (value instanceof String) {
            String text = ((String) value).trim();
            if ("yes".equalsIgnoreCase(text)) {
                return Boolean.TRUE;
            }
            if ("no".equalsIgnoreCase(text)) {
                return Boolean.FALSE;
            }
            return text;
        }
        return value;
    }

    static String toSnakeCase(String key) {
        StringBuilder out = new StringBuilder(key.length() + 8);
        for (int i = 0; i < key.length(); i++) {
            char ch = key.charAt(i);
            if (ch == '-') {
                out.append('_');
            } else if (Character.isUpperCase(ch)) {
                if (out.length() > 0) {
                    out.append('_');
                }
                out.append(Character.toLowerCase(ch));
            } else {
                out.append(ch);
            }
        }
        return out.toString();
    }
}

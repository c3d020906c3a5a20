package im.arun.treereader.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public class ConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);
    private static final String CLASSPATH_CONFIG = "config.yaml";

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory())
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private final TreeReaderConfig defaultConfig;

    public ConfigLoader() {
        this(null);
    }

    /**
     * @param configPath optional YAML file; it takes precedence over the classpath {@code config.yaml}
     */
    public ConfigLoader(String configPath) {
        this.defaultConfig = loadDefaultConfig(configPath);
    }

    private TreeReaderConfig loadDefaultConfig(String configPath) {
        try {
            if (configPath != null) {
                Path path = Paths.get(configPath);
                if (Files.exists(path)) {
                    logger.debug("Loading configuration from {}", path);
                    return yamlMapper.readValue(path.toFile(), TreeReaderConfig.class);
                }
                logger.warn("Configuration file {} not found, falling back to classpath", configPath);
            }

            try (InputStream resourceStream = getClass().getClassLoader().getResourceAsStream(CLASSPATH_CONFIG)) {
                if (resourceStream != null) {
                    return yamlMapper.readValue(resourceStream, TreeReaderConfig.class);
                }
            }

            logger.warn("No {} found, using default configuration", CLASSPATH_CONFIG);
            return new TreeReaderConfig();
        } catch (IOException e) {
            logger.warn("Failed to load configuration, using defaults: {}", e.getMessage());
            return new TreeReaderConfig();
        }
    }

    public TreeReaderConfig load() {
        return load(null);
    }

    public TreeReaderConfig load(Map<String, Object> userOptions) {
        TreeReaderConfig config = copyConfig(defaultConfig);

        if (userOptions == null || userOptions.isEmpty()) {
            return config;
        }

        userOptions.forEach((key, value) -> {
            switch (key) {
                case "null_token":
                case "nullToken":
                    if (value instanceof String) config.setNullToken((String) value);
                    break;
                case "branch_glyphs":
                case "branchGlyphs":
                    if (value instanceof List) config.setBranchGlyphs(toStrings((List<?>) value));
                    break;
                case "output_format":
                case "outputFormat":
                    config.setOutputFormat(parseFormat(value));
                    break;
                case "charset":
                    if (value instanceof String) config.setCharset((String) value);
                    break;
                default:
                    logger.warn("Unknown configuration key: {}", key);
            }
        });

        return config;
    }

    private List<String> toStrings(List<?> values) {
        List<String> strings = new ArrayList<>();
        for (Object value : values) {
            strings.add(String.valueOf(value));
        }
        return strings;
    }

    private OutputFormat parseFormat(Object value) {
        if (value instanceof OutputFormat) {
            return (OutputFormat) value;
        }
        try {
            return OutputFormat.valueOf(String.valueOf(value).trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            logger.error("Unknown output format {}, keeping NONE", value);
            return OutputFormat.NONE;
        }
    }

    private TreeReaderConfig copyConfig(TreeReaderConfig source) {
        TreeReaderConfig copy = new TreeReaderConfig();
        copy.setNullToken(source.getNullToken());
        copy.setBranchGlyphs(new ArrayList<>(source.getBranchGlyphs()));
        copy.setOutputFormat(source.getOutputFormat());
        copy.setCharset(source.getCharset());
        return copy;
    }
}

package im.arun.netcop.config;

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
import java.util.Map;

/**
 * Loads {@link NetcopConfig} from YAML and merges user options onto it.
 */
public class ConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);
    static final String DEFAULT_RESOURCE = "netcop.yaml";

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory())
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private final NetcopConfig defaultConfig;

    public ConfigLoader() {
        this(null);
    }

    public ConfigLoader(String configPath) {
        this.defaultConfig = loadDefaultConfig(configPath);
    }

    private NetcopConfig loadDefaultConfig(String configPath) {
        try {
            // An explicit file wins over the bundled resource
            if (configPath != null) {
                Path path = Paths.get(configPath);
                if (Files.exists(path)) {
                    return yamlMapper.readValue(path.toFile(), NetcopConfig.class);
                }
                logger.warn("Config file {} not found, falling back to {}", configPath, DEFAULT_RESOURCE);
            }

            try (InputStream resourceStream = getClass().getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
                if (resourceStream != null) {
                    return yamlMapper.readValue(resourceStream, NetcopConfig.class);
                }
            }

            logger.warn("No {} found, using default configuration", DEFAULT_RESOURCE);
            return new NetcopConfig();
        } catch (IOException e) {
            logger.warn("Failed to load configuration, using defaults: {}", e.getMessage());
            return new NetcopConfig();
        }
    }

    public NetcopConfig getDefaultConfig() {
        return copyConfig(defaultConfig);
    }

    public NetcopConfig load(Map<String, Object> userOptions) {
        NetcopConfig config = copyConfig(defaultConfig);

        if (userOptions == null || userOptions.isEmpty()) {
            return config;
        }

        userOptions.forEach((key, value) -> {
            switch (key) {
                case "indent":
                    if (value instanceof String) config.setIndent((String) value);
                    else if (value instanceof Integer) config.setIndent(" ".repeat((Integer) value));
                    break;
                case "no_indent":
                case "noIndent":
                    config.setNoIndent(parseBoolean(value));
                    break;
                case "show_header":
                case "showHeader":
                    config.setShowHeader(parseBoolean(value));
                    break;
                case "use_original_text":
                case "useOriginalText":
                    config.setUseOriginalText(parseBoolean(value));
                    break;
                case "output_format":
                case "outputFormat":
                    if (value instanceof String) config.setOutputFormat((String) value);
                    break;
                default:
                    logger.warn("Unknown configuration key: {}", key);
            }
        });

        return config;
    }

    private boolean parseBoolean(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return "yes".equalsIgnoreCase((String) value) || "true".equalsIgnoreCase((String) value);
        }
        return false;
    }

    private NetcopConfig copyConfig(NetcopConfig source) {
        NetcopConfig copy = new NetcopConfig();
        copy.setIndent(source.getIndent());
        copy.setNoIndent(source.isNoIndent());
        copy.setShowHeader(source.isShowHeader());
        copy.setUseOriginalText(source.isUseOriginalText());
        copy.setOutputFormat(source.getOutputFormat());
        return copy;
    }
}

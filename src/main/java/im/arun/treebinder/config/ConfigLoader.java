package im.arun.treebinder.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import im.arun.treebinder.search.MatchMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Map;

/**
 * Loads {@link BinderConfig} from YAML and merges caller overrides on top.
 * An explicit file path wins over {@code treebinder.yaml} on the classpath;
 * with neither present the built-in defaults apply.
 */
public class ConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);
    static final String CLASSPATH_CONFIG = "treebinder.yaml";

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory())
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private final BinderConfig defaultConfig;

    public ConfigLoader() {
        this(null);
    }

    public ConfigLoader(String configPath) {
        this.defaultConfig = sanitize(loadDefaultConfig(configPath));
    }

    // YAML values bypass the clamps applied to user options
    private static BinderConfig sanitize(BinderConfig config) {
        if (config.getMaxUndoHistory() < 0) {
            logger.warn("maxUndoHistory {} is negative, using 0", config.getMaxUndoHistory());
            config.setMaxUndoHistory(0);
        }
        return config;
    }

    private BinderConfig loadDefaultConfig(String configPath) {
        try {
            if (configPath != null) {
                Path path = Paths.get(configPath);
                if (Files.exists(path)) {
                    logger.debug("Loading configuration from {}", path);
                    return yamlMapper.readValue(path.toFile(), BinderConfig.class);
                }
                logger.warn("Config file {} not found, falling back to classpath", configPath);
            }

            try (InputStream resourceStream = getClass().getClassLoader().getResourceAsStream(CLASSPATH_CONFIG)) {
                if (resourceStream != null) {
                    return yamlMapper.readValue(resourceStream, BinderConfig.class);
                }
            }

            logger.warn("No {} found, using default configuration", CLASSPATH_CONFIG);
            return new BinderConfig();
        } catch (IOException e) {
            logger.warn("Failed to load configuration, using defaults: {}", e.getMessage());
            return new BinderConfig();
        }
    }

    public BinderConfig load() {
        return load(null);
    }

    public BinderConfig load(Map<String, Object> userOptions) {
        BinderConfig config = copyConfig(defaultConfig);

        if (userOptions == null || userOptions.isEmpty()) {
            return config;
        }

        userOptions.forEach((key, value) -> {
            try {
                switch (key) {
                    case "root_label":
                    case "rootLabel":
                        if (value instanceof String) config.setRootLabel((String) value);
                        break;
                    case "index_template":
                    case "indexTemplate":
                        if (value instanceof String) config.setIndexTemplate((String) value);
                        break;
                    case "cyclic_label":
                    case "cyclicLabel":
                        if (value instanceof String) config.setCyclicLabel((String) value);
                        break;
                    case "unrepresentable_label":
                    case "unrepresentableLabel":
                        if (value instanceof String) config.setUnrepresentableLabel((String) value);
                        break;
                    case "filter_root_label":
                    case "filterRootLabel":
                        if (value instanceof String) config.setFilterRootLabel((String) value);
                        break;
                    case "no_matches_label":
                    case "noMatchesLabel":
                        if (value instanceof String) config.setNoMatchesLabel((String) value);
                        break;
                    case "match_mode":
                    case "matchMode":
                        config.setMatchMode(parseMatchMode(value));
                        break;
                    case "search_case_sensitive":
                    case "searchCaseSensitive":
                        config.setSearchCaseSensitive(parseBoolean(value));
                        break;
                    case "replace_case_sensitive":
                    case "replaceCaseSensitive":
                        config.setReplaceCaseSensitive(parseBoolean(value));
                        break;
                    case "filter_leaves_only":
                    case "filterLeavesOnly":
                        config.setFilterLeavesOnly(parseBoolean(value));
                        break;
                    case "select_on_navigate":
                    case "selectOnNavigate":
                        config.setSelectOnNavigate(parseBoolean(value));
                        break;
                    case "max_undo_history":
                    case "maxUndoHistory":
                        if (value instanceof Integer) config.setMaxUndoHistory(Math.max(0, (Integer) value));
                        break;
                    case "journal_dir":
                    case "journalDir":
                        config.setJournalDir(value == null ? null : value.toString());
                        break;
                    default:
                        logger.warn("Unknown configuration key: {}", key);
                }
            } catch (Exception e) {
                logger.error("Error setting config key {}: {}", key, e.getMessage());
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

    private MatchMode parseMatchMode(Object value) {
        if (value instanceof MatchMode) {
            return (MatchMode) value;
        }
        return MatchMode.valueOf(String.valueOf(value).trim().toUpperCase(Locale.ROOT));
    }

    private BinderConfig copyConfig(BinderConfig source) {
        BinderConfig copy = new BinderConfig();
        copy.setRootLabel(source.getRootLabel());
        copy.setIndexTemplate(source.getIndexTemplate());
        copy.setCyclicLabel(source.getCyclicLabel());
        copy.setUnrepresentableLabel(source.getUnrepresentableLabel());
        copy.setFilterRootLabel(source.getFilterRootLabel());
        copy.setNoMatchesLabel(source.getNoMatchesLabel());
        copy.setMatchMode(source.getMatchMode());
        copy.setSearchCaseSensitive(source.isSearchCaseSensitive());
        copy.setReplaceCaseSensitive(source.isReplaceCaseSensitive());
        copy.setFilterLeavesOnly(source.isFilterLeavesOnly());
        copy.setSelectOnNavigate(source.isSelectOnNavigate());
        copy.setMaxUndoHistory(source.getMaxUndoHistory());
        copy.setJournalDir(source.getJournalDir());
        return copy;
    }
}

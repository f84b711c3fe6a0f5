package im.arun.treebinder.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Reads JSON or YAML input into a Jackson tree the binder can project directly.
 * The format is chosen by file extension; anything other than .yaml/.yml is JSON.
 */
public class DataLoader {
    private static final Logger logger = LoggerFactory.getLogger(DataLoader.class);

    private final ObjectMapper jsonMapper = new ObjectMapper();
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    public JsonNode load(Path file) throws IOException {
        ObjectMapper mapper = isYaml(file) ? yamlMapper : jsonMapper;
        JsonNode root = mapper.readTree(file.toFile());
        if (root == null || root.isMissingNode()) {
            throw new IOException("No content in " + file);
        }
        logger.debug("Loaded {} ({})", file, root.getNodeType());
        return root;
    }

    public JsonNode parseJson(String json) throws IOException {
        return jsonMapper.readTree(json);
    }

    private boolean isYaml(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".yaml") || name.endsWith(".yml");
    }
}

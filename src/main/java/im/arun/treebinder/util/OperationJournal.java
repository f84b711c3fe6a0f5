package im.arun.treebinder.util;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Accumulates one structured entry per session operation (bind, find, replace,
 * rollback). When a directory is given, the whole journal is rewritten there as
 * indented JSON after every entry; otherwise entries are kept in memory only.
 */
public class OperationJournal {
    private static final Logger systemLogger = LoggerFactory.getLogger(OperationJournal.class);
    private final Path journalPath;
    private final List<Map<String, Object>> entries = new ArrayList<>();
    private final ObjectMapper objectMapper;

    public OperationJournal() {
        this(null, "session");
    }

    public OperationJournal(String journalDir, String sessionName) {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.journalPath = journalDir == null ? null : createJournalPath(journalDir, sessionName);
    }

    private Path createJournalPath(String journalDir, String sessionName) {
        String name = sanitize(sessionName == null ? "session" : sessionName);
        String timestamp = LocalDateTime.now().format(DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss"));
        Path dir = Paths.get(journalDir);
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            systemLogger.error("Failed to create journal directory {}", dir, e);
        }
        return dir.resolve(String.format("%s_%s.json", name, timestamp));
    }

    private String sanitize(String name) {
        int dotIndex = name.lastIndexOf('.');
        if (dotIndex > 0) {
            name = name.substring(0, dotIndex);
        }
        return name.replaceAll("[/\\\\:\\s]", "-");
    }

    public void record(String operation, Map<String, ?> details) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("operation", operation);
        if (details != null) {
            entry.putAll(details);
        }
        entries.add(entry);
        writeToFile();
    }

    public void record(String operation) {
        record(operation, null);
    }

    public void warn(String operation, String message) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("level", "WARNING");
        entry.put("message", message);
        record(operation, entry);
    }

    private void writeToFile() {
        if (journalPath == null) {
            return;
        }
        try {
            objectMapper.writeValue(journalPath.toFile(), entries);
        } catch (IOException e) {
            systemLogger.error("Failed to write journal file: {}", journalPath, e);
        }
    }

    public List<Map<String, Object>> getEntries() {
        return Collections.unmodifiableList(entries);
    }

    /**
     * @return the file being written, or null for an in-memory journal
     */
    public Path getJournalPath() {
        return journalPath;
    }
}

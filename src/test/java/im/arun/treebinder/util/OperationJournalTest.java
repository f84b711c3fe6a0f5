package im.arun.treebinder.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class OperationJournalTest {

    @Test
    void inMemoryJournalKeepsEntries() {
        OperationJournal journal = new OperationJournal();
        journal.record("bind", Map.of("nodes", 4));
        journal.warn("update", "No value at $.x");

        assertNull(journal.getJournalPath());
        assertEquals(2, journal.getEntries().size());
        assertEquals("bind", journal.getEntries().get(0).get("operation"));
        assertEquals(4, journal.getEntries().get(0).get("nodes"));
        assertEquals("WARNING", journal.getEntries().get(1).get("level"));
    }

    @Test
    void writesJsonFileWhenDirectoryGiven(@TempDir Path dir) throws Exception {
        OperationJournal journal = new OperationJournal(dir.resolve("journal").toString(), "data.json");
        journal.record("replace", Map.of("count", 80));
        journal.record("rollback");

        Path file = journal.getJournalPath();
        assertNotNull(file);
        assertTrue(Files.exists(file));
        assertTrue(file.getFileName().toString().startsWith("data_"));

        JsonNode written = new ObjectMapper().readTree(file.toFile());
        assertEquals(2, written.size());
        assertEquals("replace", written.get(0).get("operation").asText());
        assertEquals(80, written.get(0).get("count").asInt());
        assertEquals("rollback", written.get(1).get("operation").asText());
    }
}

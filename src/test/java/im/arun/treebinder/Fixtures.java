package im.arun.treebinder;

import im.arun.treebinder.model.DataNode;
import im.arun.treebinder.model.RecordNode;

/**
 * Shared input trees for tests.
 */
public final class Fixtures {

    private Fixtures() {}

    /**
     * {@code { "a": 1, "b": { "c": 2 } }}
     */
    public static RecordNode simpleRecord() {
        return DataNode.record()
            .put("a", 1)
            .put("b", DataNode.record().put("c", 2));
    }

    /**
     * Folder1..Folder10, each holding File1.txt..File8.txt with the value "file".
     */
    public static RecordNode folders() {
        RecordNode root = DataNode.record();
        for (int folder = 1; folder <= 10; folder++) {
            RecordNode files = DataNode.record();
            for (int file = 1; file <= 8; file++) {
                files.put("File" + file + ".txt", "file");
            }
            root.put("Folder" + folder, files);
        }
        return root;
    }
}

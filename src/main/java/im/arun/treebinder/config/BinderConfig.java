package im.arun.treebinder.config;

import im.arun.treebinder.search.MatchMode;
import lombok.Data;

@Data
public class BinderConfig {
    private String rootLabel = "root";
    private String indexTemplate = "[%d]";
    private String cyclicLabel = "<cyclic reference>";
    private String unrepresentableLabel = "<unrepresentable>";
    private String filterRootLabel = "Filter results";
    private String noMatchesLabel = "(no matches)";
    private MatchMode matchMode = MatchMode.CONTAINS;
    private boolean searchCaseSensitive = false;
    private boolean replaceCaseSensitive = true;
    private boolean filterLeavesOnly = true;
    private boolean selectOnNavigate = true;
    private int maxUndoHistory = 0;
    private String journalDir;
}

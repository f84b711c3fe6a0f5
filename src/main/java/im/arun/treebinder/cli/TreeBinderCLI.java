package im.arun.treebinder.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import im.arun.treebinder.classify.DefaultScalarFormatter;
import im.arun.treebinder.config.BinderConfig;
import im.arun.treebinder.config.ConfigLoader;
import im.arun.treebinder.model.LabelChange;
import im.arun.treebinder.model.NodeId;
import im.arun.treebinder.model.SearchMatch;
import im.arun.treebinder.report.ReportFormatter;
import im.arun.treebinder.search.MatchMode;
import im.arun.treebinder.search.SearchQuery;
import im.arun.treebinder.service.TreeSession;
import im.arun.treebinder.surface.InMemoryTreeSurface;
import im.arun.treebinder.util.DataLoader;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command-line front end: binds a JSON or YAML file and runs search, filter
 * and replace against it, printing the same reports a dialog would show.
 */
@Command(
    name = "treebinder",
    description = "Bind nested JSON/YAML data to a tree and search, filter or replace its labels",
    mixinStandardHelpOptions = true,
    version = "TreeBinder 1.0"
)
public class TreeBinderCLI implements Callable<Integer> {

    @Option(names = {"--input"}, description = "JSON or YAML file to bind", required = true)
    private String inputPath;

    @Option(names = {"--config"}, description = "YAML configuration file")
    private String configPath;

    @Option(names = {"--find"}, description = "Search term")
    private String findTerm;

    @Option(names = {"--mode"}, description = "Match mode: ${COMPLETION-CANDIDATES}")
    private MatchMode mode;

    @Option(names = {"--case-sensitive"}, description = "Case-sensitive search and filter")
    private Boolean caseSensitive;

    @Option(names = {"--filter"}, description = "Show a flat filtered view for this term")
    private String filterTerm;

    @Option(names = {"--replace"}, description = "Text to replace in labels")
    private String replaceTerm;

    @Option(names = {"--with"}, description = "Replacement text", defaultValue = "")
    private String replaceWith;

    @Option(names = {"--preview"}, description = "Only show what --replace would change")
    private boolean preview;

    @Option(names = {"--rollback"}, description = "Undo the replace after showing its result")
    private boolean rollback;

    @Option(names = {"--print-tree"}, description = "Print the bound tree")
    private boolean printTree;

    @Option(names = {"--output"}, description = "Write the final tree as JSON to this file")
    private String outputPath;

    @Option(names = {"--journal-dir"}, description = "Directory for the JSON operation journal")
    private String journalDir;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() throws Exception {
        Path input = Paths.get(inputPath);
        if (!Files.exists(input)) {
            err().println("Error: input file not found: " + inputPath);
            return 1;
        }

        BinderConfig config = new ConfigLoader(configPath).load(overrides());

        JsonNode data;
        try {
            data = new DataLoader().load(input);
        } catch (IOException e) {
            err().println("Error reading " + inputPath + ": " + e.getMessage());
            return 1;
        }

        TreeSession session = new TreeSession(config,
            new InMemoryTreeSurface(), new InMemoryTreeSurface(),
            new DefaultScalarFormatter(), input.getFileName().toString());
        ReportFormatter reports = session.getReportFormatter();
        NodeId rootId = session.bind(data);
        out().println(reports.bindSummary(session.getBindStats()));

        if (findTerm != null) {
            List<SearchMatch> matches = session.search(
                new SearchQuery(findTerm, config.getMatchMode(), config.isSearchCaseSensitive()));
            out().println(reports.matchCount(matches.size()));
            for (SearchMatch match : matches) {
                out().println("  " + reports.breadcrumb(session.getSurface(), match.getNodeId()));
            }
        }

        if (filterTerm != null) {
            NodeId filterRoot = session.filter(
                new SearchQuery(filterTerm, config.getMatchMode(), config.isSearchCaseSensitive()));
            out().println(reports.outline(session.getFilterView().getTarget(), filterRoot));
        }

        if (replaceTerm != null) {
            List<LabelChange> changes = session.preview(replaceTerm, replaceWith);
            out().println(reports.preview(changes));
            if (!preview) {
                int count = session.replaceAll(replaceTerm, replaceWith);
                out().println(reports.replaced(count));
                if (rollback) {
                    boolean reverted = session.rollback();
                    out().println(reports.rollback(reverted, count));
                }
            }
        }

        if (printTree) {
            out().println(reports.outline(session.getSurface(), rootId));
        }

        if (outputPath != null) {
            ObjectMapper mapper = new ObjectMapper();
            mapper.enable(SerializationFeature.INDENT_OUTPUT);
            Files.writeString(Paths.get(outputPath), mapper.writeValueAsString(session.outline()));
            out().println("Tree written to: " + outputPath);
        }

        out().flush();
        return 0;
    }

    private PrintWriter out() {
        return spec.commandLine().getOut();
    }

    private PrintWriter err() {
        return spec.commandLine().getErr();
    }

    private Map<String, Object> overrides() {
        Map<String, Object> options = new HashMap<>();
        if (mode != null) {
            options.put("matchMode", mode);
        }
        if (caseSensitive != null) {
            options.put("searchCaseSensitive", caseSensitive);
        }
        if (journalDir != null) {
            options.put("journalDir", journalDir);
        }
        return options;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new TreeBinderCLI()).execute(args);
        System.exit(exitCode);
    }
}

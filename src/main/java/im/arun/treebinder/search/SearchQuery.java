package im.arun.treebinder.search;

import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * A search term with its match mode and case sensitivity.
 * An empty term, or a pattern that does not compile, matches nothing.
 */
@Value
public class SearchQuery {
    private static final Logger logger = LoggerFactory.getLogger(SearchQuery.class);

    String term;
    MatchMode mode;
    boolean caseSensitive;

    public static SearchQuery contains(String term) {
        return new SearchQuery(term, MatchMode.CONTAINS, false);
    }

    public boolean isEmpty() {
        return term == null || term.isEmpty();
    }

    public Predicate<String> toPredicate() {
        if (isEmpty()) {
            return label -> false;
        }
        MatchMode effective = mode == null ? MatchMode.CONTAINS : mode;
        if (effective == MatchMode.PATTERN) {
            return patternPredicate();
        }

        String needle = caseSensitive ? term : term.toLowerCase(Locale.ROOT);
        return label -> {
            if (label == null) {
                return false;
            }
            String haystack = caseSensitive ? label : label.toLowerCase(Locale.ROOT);
            switch (effective) {
                case PREFIX:
                    return haystack.startsWith(needle);
                case SUFFIX:
                    return haystack.endsWith(needle);
                case EXACT:
                    return haystack.equals(needle);
                case CONTAINS:
                default:
                    return haystack.contains(needle);
            }
        };
    }

    private Predicate<String> patternPredicate() {
        try {
            Pattern pattern = caseSensitive
                ? Pattern.compile(term)
                : Pattern.compile(term, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
            return label -> label != null && pattern.matcher(label).find();
        } catch (PatternSyntaxException e) {
            logger.warn("Invalid search pattern '{}': {}", term, e.getDescription());
            return label -> false;
        }
    }
}

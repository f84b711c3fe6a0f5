package im.arun.treebinder.search;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.function.Predicate;
import org.junit.jupiter.api.Test;

class SearchQueryTest {

    @Test
    void containsIgnoresCaseByDefault() {
        Predicate<String> p = SearchQuery.contains("file3").toPredicate();
        assertTrue(p.test("File3.txt: file"));
        assertFalse(p.test("File13"));
        assertTrue(new SearchQuery("File3", MatchMode.CONTAINS, true).toPredicate().test("File30"));
        assertFalse(new SearchQuery("file3", MatchMode.CONTAINS, true).toPredicate().test("File30"));
    }

    @Test
    void prefixSuffixExact() {
        assertTrue(new SearchQuery("fold", MatchMode.PREFIX, false).toPredicate().test("Folder1"));
        assertFalse(new SearchQuery("older", MatchMode.PREFIX, false).toPredicate().test("Folder1"));
        assertTrue(new SearchQuery(".TXT", MatchMode.SUFFIX, false).toPredicate().test("a.txt"));
        assertFalse(new SearchQuery(".TXT", MatchMode.SUFFIX, true).toPredicate().test("a.txt"));
        assertTrue(new SearchQuery("a: 1", MatchMode.EXACT, true).toPredicate().test("a: 1"));
        assertFalse(new SearchQuery("a: 1", MatchMode.EXACT, true).toPredicate().test("a: 10"));
    }

    @Test
    void patternMatchesAnywhere() {
        Predicate<String> p = new SearchQuery("file[2-4]\\.txt", MatchMode.PATTERN, false).toPredicate();
        assertTrue(p.test("File3.txt: file"));
        assertFalse(p.test("File5.txt: file"));
    }

    @Test
    void invalidPatternMatchesNothing() {
        Predicate<String> p = new SearchQuery("[unclosed", MatchMode.PATTERN, false).toPredicate();
        assertFalse(p.test("[unclosed"));
    }

    @Test
    void emptyTermMatchesNothing() {
        assertTrue(SearchQuery.contains("").isEmpty());
        assertFalse(SearchQuery.contains("").toPredicate().test("anything"));
        assertFalse(SearchQuery.contains(null).toPredicate().test(""));
    }

    @Test
    void nullModeMeansContains() {
        assertTrue(new SearchQuery("b", null, false).toPredicate().test("abc"));
    }
}

package org.yamldiff.core;

import org.junit.jupiter.api.Test;
import org.yamldiff.domain.Difference;
import org.yamldiff.domain.FilterOptions;
import org.yamldiff.domain.YamlNode;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DiffFilterTest {

    private final List<Difference> diffs = Arrays.asList(
            Difference.modified("spec.replicas", YamlNode.integer(1), YamlNode.integer(2)),
            Difference.modified("spec.replicasMax", YamlNode.integer(1), YamlNode.integer(2)),
            Difference.added("metadata.labels.app", YamlNode.string("web")),
            Difference.removed("[1].status", YamlNode.string("ok")));

    private static List<String> paths(List<Difference> diffs) {
        List<String> paths = new ArrayList<>();
        for (Difference diff : diffs) {
            paths.add(diff.getPath());
        }
        return paths;
    }

    @Test
    void noOptionsKeepsEverything() {
        assertSame(diffs, DiffFilter.filter(diffs, null));
        assertSame(diffs, DiffFilter.filter(diffs, FilterOptions.none()));
    }

    @Test
    void includePathMatchesSubtreeOnly() {
        FilterOptions options = new FilterOptions(Collections.singletonList("spec.replicas"), null, null, null);

        assertEquals(Collections.singletonList("spec.replicas"), paths(DiffFilter.filter(diffs, options)));
    }

    @Test
    void excludeAppliesAfterInclude() {
        FilterOptions options = new FilterOptions(Collections.singletonList("spec"),
                Collections.singletonList("spec.replicasMax"), null, null);

        assertEquals(Collections.singletonList("spec.replicas"), paths(DiffFilter.filter(diffs, options)));
    }

    @Test
    void includeRegexMatchesAnywhere() {
        FilterOptions options = new FilterOptions(null, null, Collections.singletonList("labels"), null);

        assertEquals(Collections.singletonList("metadata.labels.app"), paths(DiffFilter.filter(diffs, options)));
    }

    @Test
    void includePathsAndPatternsAreAlternatives() {
        FilterOptions options = new FilterOptions(Collections.singletonList("metadata"), null,
                Collections.singletonList("^\\[1]"), null);

        assertEquals(Arrays.asList("metadata.labels.app", "[1].status"), paths(DiffFilter.filter(diffs, options)));
    }

    @Test
    void excludeRegex() {
        FilterOptions options = new FilterOptions(null, null, null, Collections.singletonList("replicas"));

        assertEquals(Arrays.asList("metadata.labels.app", "[1].status"), paths(DiffFilter.filter(diffs, options)));
    }

    @Test
    void invalidRegexIsRejected() {
        FilterOptions options = new FilterOptions(null, null, Collections.singletonList("(unclosed"), null);

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> DiffFilter.filter(diffs, options));

        assertTrue(e.getMessage().startsWith("invalid regex pattern \"(unclosed\""), e.getMessage());
    }

    @Test
    void pathBoundaries() {
        assertTrue(DiffFilter.pathMatches("spec", "spec"));
        assertTrue(DiffFilter.pathMatches("spec.a", "spec"));
        assertTrue(DiffFilter.pathMatches("items[0]", "items"));
        assertFalse(DiffFilter.pathMatches("specs", "spec"));
        assertFalse(DiffFilter.pathMatches("sp", "spec"));
    }
}

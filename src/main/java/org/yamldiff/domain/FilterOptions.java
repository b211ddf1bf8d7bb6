package org.yamldiff.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Include/exclude rules applied to a finished difference list.
 */
public final class FilterOptions {

    private final List<String> includePaths;
    private final List<String> excludePaths;
    private final List<String> includeRegexp;
    private final List<String> excludeRegexp;

    public FilterOptions(List<String> includePaths, List<String> excludePaths,
                         List<String> includeRegexp, List<String> excludeRegexp) {
        this.includePaths = copy(includePaths);
        this.excludePaths = copy(excludePaths);
        this.includeRegexp = copy(includeRegexp);
        this.excludeRegexp = copy(excludeRegexp);
    }

    public static FilterOptions none() {
        return new FilterOptions(null, null, null, null);
    }

    public List<String> getIncludePaths() { return includePaths; }
    public List<String> getExcludePaths() { return excludePaths; }
    public List<String> getIncludeRegexp() { return includeRegexp; }
    public List<String> getExcludeRegexp() { return excludeRegexp; }

    public boolean isEmpty() {
        return includePaths.isEmpty() && excludePaths.isEmpty()
                && includeRegexp.isEmpty() && excludeRegexp.isEmpty();
    }

    private static List<String> copy(List<String> values) {
        return values == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(values));
    }
}

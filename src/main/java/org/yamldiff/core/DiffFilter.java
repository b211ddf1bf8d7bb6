package org.yamldiff.core;

import org.yamldiff.domain.Difference;
import org.yamldiff.domain.FilterOptions;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Keeps or drops differences by path.
 * <p>
 * Include filters (paths or patterns) apply first, exclude filters second. A path filter matches the path
 * itself and everything below it; a pattern matches anywhere in the path.
 */
public final class DiffFilter {

    private DiffFilter() {
    }

    /**
     * @throws IllegalArgumentException when a pattern is not a valid regular expression
     */
    public static List<Difference> filter(List<Difference> diffs, FilterOptions options) {
        if (options == null || options.isEmpty()) {
            return diffs;
        }
        List<Pattern> includePatterns = compile(options.getIncludeRegexp());
        List<Pattern> excludePatterns = compile(options.getExcludeRegexp());
        boolean hasIncludes = !options.getIncludePaths().isEmpty() || !includePatterns.isEmpty();

        List<Difference> result = new ArrayList<>();
        for (Difference diff : diffs) {
            String path = diff.getPath();
            if (hasIncludes && !matchesAnyPath(path, options.getIncludePaths())
                    && !matchesAnyPattern(path, includePatterns)) {
                continue;
            }
            if (matchesAnyPath(path, options.getExcludePaths()) || matchesAnyPattern(path, excludePatterns)) {
                continue;
            }
            result.add(diff);
        }
        return result;
    }

    /**
     * Exact match, or {@code filterPath} is a prefix of {@code path} ending at a {@code .} or {@code [}.
     */
    static boolean pathMatches(String path, String filterPath) {
        if (path.equals(filterPath)) {
            return true;
        }
        if (path.length() > filterPath.length() && path.startsWith(filterPath)) {
            char next = path.charAt(filterPath.length());
            return next == '.' || next == '[';
        }
        return false;
    }

    private static boolean matchesAnyPath(String path, List<String> filterPaths) {
        for (String filterPath : filterPaths) {
            if (pathMatches(path, filterPath)) {
                return true;
            }
        }
        return false;
    }

    private static boolean matchesAnyPattern(String path, List<Pattern> patterns) {
        for (Pattern pattern : patterns) {
            if (pattern.matcher(path).find()) {
                return true;
            }
        }
        return false;
    }

    private static List<Pattern> compile(List<String> expressions) {
        List<Pattern> patterns = new ArrayList<>(expressions.size());
        for (String expression : expressions) {
            try {
                patterns.add(Pattern.compile(expression));
            } catch (PatternSyntaxException e) {
                throw new IllegalArgumentException(
                        String.format("invalid regex pattern \"%s\": %s", expression, e.getDescription()), e);
            }
        }
        return patterns;
    }
}

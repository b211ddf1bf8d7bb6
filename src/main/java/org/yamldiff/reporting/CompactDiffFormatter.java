package org.yamldiff.reporting;

import org.yamldiff.domain.Difference;
import org.yamldiff.domain.YamlNode;

import java.util.List;

/**
 * One line per difference: {@code ± path : from → to}, {@code + path : value}, {@code - path : value},
 * after a summary header.
 */
public class CompactDiffFormatter implements DiffFormatter {

    static final String NO_DIFFERENCES = "no differences found\n";

    @Override
    public String format(List<Difference> differences, FormatOptions options) {
        FormatOptions opts = options == null ? FormatOptions.defaults() : options;
        if (differences.isEmpty()) {
            return NO_DIFFERENCES;
        }
        StringBuilder sb = new StringBuilder();
        if (!opts.isOmitHeader()) {
            appendHeader(sb, differences);
        }
        for (Difference difference : differences) {
            appendDifference(sb, difference, opts);
        }
        return sb.toString();
    }

    private void appendHeader(StringBuilder sb, List<Difference> differences) {
        int added = 0;
        int removed = 0;
        int modified = 0;
        for (Difference difference : differences) {
            switch (difference.getType()) {
                case ADDED:
                    added++;
                    break;
                case REMOVED:
                    removed++;
                    break;
                default:
                    modified++;
            }
        }
        sb.append(String.format("Found %d difference(s) (%d added, %d removed, %d modified)",
                differences.size(), added, removed, modified)).append("\n\n");
    }

    private void appendDifference(StringBuilder sb, Difference difference, FormatOptions opts) {
        String path = opts.isGoPatchStyle() ? toGoPatchPath(difference.getPath()) : difference.getPath();
        switch (difference.getType()) {
            case ADDED:
                sb.append("+ ").append(path).append(" : ").append(render(difference.getTo()));
                break;
            case REMOVED:
                sb.append("- ").append(path).append(" : ").append(render(difference.getFrom()));
                break;
            case MODIFIED:
                sb.append("± ").append(path).append(" : ")
                        .append(render(difference.getFrom())).append(" → ").append(render(difference.getTo()));
                break;
            default:
                sb.append("⇆ ").append(path).append(" (order changed)");
        }
        sb.append('\n');
    }

    static String render(YamlNode value) {
        return value == null ? "<nil>" : value.toString();
    }

    /** {@code a.b[1].c} becomes {@code /a/b/1/c}. */
    static String toGoPatchPath(String path) {
        String result = path.replace('.', '/').replace('[', '/').replace("]", "");
        return result.startsWith("/") ? result : "/" + result;
    }
}

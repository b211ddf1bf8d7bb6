package org.yamldiff.reporting;

import org.yamldiff.domain.Difference;

import java.util.ArrayList;
import java.util.List;

/**
 * Counts only, e.g. {@code 2 added, 1 modified}.
 */
public class BriefDiffFormatter implements DiffFormatter {

    @Override
    public String format(List<Difference> differences, FormatOptions options) {
        if (differences.isEmpty()) {
            return "no differences\n";
        }
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
        List<String> parts = new ArrayList<>();
        if (added > 0) {
            parts.add(added + " added");
        }
        if (removed > 0) {
            parts.add(removed + " removed");
        }
        if (modified > 0) {
            parts.add(modified + " modified");
        }
        return String.join(", ", parts) + "\n";
    }
}

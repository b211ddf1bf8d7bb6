package org.yamldiff.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.yamldiff.YamlDiff;
import org.yamldiff.core.DiffFilter;
import org.yamldiff.domain.CompareOptions;
import org.yamldiff.domain.Difference;
import org.yamldiff.domain.FilterOptions;
import org.yamldiff.domain.YamlDiffException;

import java.io.IOException;
import java.util.List;

/**
 * Loads two YAML sources, compares them and applies the configured filters
 */
@Service
public class YamlDiffService {

    private static final Logger logger = LoggerFactory.getLogger(YamlDiffService.class);

    private final ContentLoader contentLoader;

    public YamlDiffService(ContentLoader contentLoader) {
        this.contentLoader = contentLoader;
    }

    public DiffSummary compare(String fromLocation, String toLocation,
                               CompareOptions compareOptions, FilterOptions filterOptions)
            throws IOException, YamlDiffException {
        logger.info("Comparing {} -> {}", fromLocation, toLocation);

        byte[] from = contentLoader.load(fromLocation);
        byte[] to = contentLoader.load(toLocation);

        List<Difference> differences = YamlDiff.compare(from, to, compareOptions);
        List<Difference> filtered = DiffFilter.filter(differences, filterOptions);
        if (filtered.size() != differences.size()) {
            logger.info("Filters kept {} of {} difference(s)", filtered.size(), differences.size());
        }

        DiffSummary summary = new DiffSummary(fromLocation, toLocation, filtered);
        logger.info("Found {} difference(s) ({} added, {} removed, {} modified)",
                filtered.size(), summary.getAdded(), summary.getRemoved(), summary.getModified());
        return summary;
    }

    /**
     * Outcome of one comparison
     */
    public static class DiffSummary {
        private final String fromLocation;
        private final String toLocation;
        private final List<Difference> differences;
        private int added;
        private int removed;
        private int modified;

        public DiffSummary(String fromLocation, String toLocation, List<Difference> differences) {
            this.fromLocation = fromLocation;
            this.toLocation = toLocation;
            this.differences = List.copyOf(differences);
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
        }

        public boolean hasDifferences() {
            return !differences.isEmpty();
        }

        // Getters
        public String getFromLocation() { return fromLocation; }
        public String getToLocation() { return toLocation; }
        public List<Difference> getDifferences() { return differences; }
        public int getAdded() { return added; }
        public int getRemoved() { return removed; }
        public int getModified() { return modified; }
    }
}

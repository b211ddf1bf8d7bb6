package org.yamldiff.reporting;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Looks up formatters by name.
 */
public final class DiffFormatters {

    public static final String COMPACT = "compact";
    public static final String BRIEF = "brief";

    private static final List<String> NAMES = Arrays.asList(COMPACT, BRIEF);

    private DiffFormatters() {
    }

    /**
     * @param name formatter name, case-insensitive
     * @throws IllegalArgumentException for unknown names
     */
    public static DiffFormatter forName(String name) {
        String normalized = name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
        switch (normalized) {
            case COMPACT:
                return new CompactDiffFormatter();
            case BRIEF:
                return new BriefDiffFormatter();
            default:
                throw new IllegalArgumentException(String.format("unknown output format \"%s\", valid formats: %s",
                        name, String.join(", ", NAMES)));
        }
    }

    public static List<String> names() {
        return NAMES;
    }
}

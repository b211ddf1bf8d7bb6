package org.yamldiff.reporting;

import org.yamldiff.domain.Difference;

import java.util.List;

/**
 * Renders a list of differences as text.
 */
public interface DiffFormatter {

    String format(List<Difference> differences, FormatOptions options);
}

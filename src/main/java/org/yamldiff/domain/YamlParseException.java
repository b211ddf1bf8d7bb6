package org.yamldiff.domain;

/**
 * Malformed YAML input. Line and column are 1-based, or 0 when the parser could not tell.
 */
public class YamlParseException extends YamlDiffException {

    private final int line;
    private final int column;
    private final String problem;

    public YamlParseException(int line, int column, String problem, Throwable cause) {
        super(format(line, problem), cause);
        this.line = line;
        this.column = column;
        this.problem = problem;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    /** The parser's description without location prefix. */
    public String getProblem() {
        return problem;
    }

    private static String format(int line, String problem) {
        if (line > 0) {
            return String.format("yaml: line %d: %s", line, problem);
        }
        return "yaml: " + problem;
    }
}

package org.yamldiff.domain;

/**
 * Base class of the failures that abort a comparison.
 */
public class YamlDiffException extends Exception {

    public YamlDiffException(String message) {
        super(message);
    }

    public YamlDiffException(String message, Throwable cause) {
        super(message, cause);
    }
}

package org.yamldiff.domain;

/**
 * A chroot path that cannot be resolved in a document.
 */
public class ChrootException extends YamlDiffException {

    private final String path;

    public ChrootException(String path, String message) {
        super(String.format("chroot path \"%s\": %s", path, message));
        this.path = path;
    }

    public String getPath() {
        return path;
    }
}

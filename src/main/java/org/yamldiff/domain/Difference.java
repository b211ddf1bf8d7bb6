package org.yamldiff.domain;

import java.util.Objects;

/**
 * One reported change between two YAML documents.
 * <p>
 * {@code path} is dotted: map keys, {@code .<index>} for list positions and {@code .<identifier>} for list
 * entries matched by identifier. Multi-document streams prefix the path with {@code [<document>]}.
 */
public final class Difference {

    public enum DiffType {
        ADDED,
        REMOVED,
        MODIFIED,
        ORDER_CHANGED
    }

    private final String path;
    private final DiffType type;
    private final YamlNode from;
    private final YamlNode to;
    private final int documentIndex;

    public Difference(String path, DiffType type, YamlNode from, YamlNode to, int documentIndex) {
        this.path = Objects.requireNonNull(path, "path");
        this.type = Objects.requireNonNull(type, "type");
        this.from = from;
        this.to = to;
        this.documentIndex = documentIndex;
    }

    public static Difference added(String path, YamlNode to) {
        return new Difference(path, DiffType.ADDED, null, to, 0);
    }

    public static Difference removed(String path, YamlNode from) {
        return new Difference(path, DiffType.REMOVED, from, null, 0);
    }

    public static Difference modified(String path, YamlNode from, YamlNode to) {
        return new Difference(path, DiffType.MODIFIED, from, to, 0);
    }

    public Difference withDocumentIndex(int index) {
        return index == documentIndex ? this : new Difference(path, type, from, to, index);
    }

    public String getPath() {
        return path;
    }

    public DiffType getType() {
        return type;
    }

    /** Original value; {@code null} for additions. */
    public YamlNode getFrom() {
        return from;
    }

    /** New value; {@code null} for removals, the null node for a value changed to null. */
    public YamlNode getTo() {
        return to;
    }

    public int getDocumentIndex() {
        return documentIndex;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Difference that = (Difference) o;
        return documentIndex == that.documentIndex &&
               path.equals(that.path) &&
               type == that.type &&
               Objects.equals(from, that.from) &&
               Objects.equals(to, that.to);
    }

    @Override
    public int hashCode() {
        return Objects.hash(path, type, from, to, documentIndex);
    }

    @Override
    public String toString() {
        return "Difference{" +
                "path='" + path + '\'' +
                ", type=" + type +
                ", from=" + from +
                ", to=" + to +
                ", documentIndex=" + documentIndex +
                '}';
    }
}

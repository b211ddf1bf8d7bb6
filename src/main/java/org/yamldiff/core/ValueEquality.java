package org.yamldiff.core;

import org.yamldiff.domain.CompareOptions;
import org.yamldiff.domain.OrderedMap;
import org.yamldiff.domain.YamlNode;

import java.util.List;
import java.util.Map;

/**
 * Value equality used by unordered list matching and scalar comparison.
 */
public final class ValueEquality {

    private ValueEquality() {
    }

    /**
     * Compares two values; with whitespace changes ignored, two strings are equal when they match after
     * trimming leading and trailing whitespace. Everything else falls back to structural equality.
     */
    public static boolean valuesEqual(YamlNode a, YamlNode b, CompareOptions options) {
        YamlNode left = YamlNode.orNull(a);
        YamlNode right = YamlNode.orNull(b);
        if (options != null && options.isIgnoreWhitespaceChanges() && left.isString() && right.isString()) {
            return trimSpace(left.asText()).equals(trimSpace(right.asText()));
        }
        return left.equals(right);
    }

    /**
     * Trims Unicode white space, which also covers NEL (U+0085) and the no-break space (U+00A0).
     */
    static String trimSpace(String text) {
        int start = 0;
        int end = text.length();
        while (start < end && isSpace(text.charAt(start))) {
            start++;
        }
        while (end > start && isSpace(text.charAt(end - 1))) {
            end--;
        }
        return text.substring(start, end);
    }

    static boolean isSpace(char c) {
        switch (c) {
            case ' ':
            case '\t':
            case '\n':
            case '\u000B':
            case '\f':
            case '\r':
            case '\u0085':
            case '\u00A0':
                return true;
            default:
                int type = Character.getType(c);
                return type == Character.SPACE_SEPARATOR
                        || type == Character.LINE_SEPARATOR
                        || type == Character.PARAGRAPH_SEPARATOR;
        }
    }

    /**
     * Recursive equality: maps by key set and values regardless of key order, lists position by position,
     * scalars through {@link #valuesEqual}.
     */
    public static boolean deepEqual(YamlNode a, YamlNode b, CompareOptions options) {
        YamlNode left = YamlNode.orNull(a);
        YamlNode right = YamlNode.orNull(b);
        if (left.getType() != right.getType()) {
            return false;
        }
        switch (left.getType()) {
            case NULL:
                return true;
            case MAP:
                return mapsEqual(left.asMap(), right.asMap(), options);
            case LIST:
                return listsEqual(left.asList(), right.asList(), options);
            default:
                return valuesEqual(left, right, options);
        }
    }

    private static boolean mapsEqual(OrderedMap left, OrderedMap right, CompareOptions options) {
        if (left.size() != right.size()) {
            return false;
        }
        for (Map.Entry<String, YamlNode> entry : left.entrySet()) {
            if (!right.containsKey(entry.getKey())) {
                return false;
            }
            if (!deepEqual(entry.getValue(), right.get(entry.getKey()), options)) {
                return false;
            }
        }
        return true;
    }

    private static boolean listsEqual(List<YamlNode> left, List<YamlNode> right, CompareOptions options) {
        if (left.size() != right.size()) {
            return false;
        }
        for (int i = 0; i < left.size(); i++) {
            if (!deepEqual(left.get(i), right.get(i), options)) {
                return false;
            }
        }
        return true;
    }
}

package org.yamldiff.core;

import org.yamldiff.domain.ChrootException;
import org.yamldiff.domain.YamlNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Re-roots documents at a sub-path such as {@code spec.template}, {@code items[0].name} or {@code [2]}.
 */
public final class ChrootResolver {

    private ChrootResolver() {
    }

    /**
     * Applies {@code path} to every document. With {@code listToDocuments}, a list found at the path
     * contributes one document per entry instead of a single list document.
     *
     * @return the documents unchanged when {@code path} is null or empty
     */
    public static List<YamlNode> apply(List<YamlNode> documents, String path, boolean listToDocuments)
            throws ChrootException {
        if (path == null || path.isEmpty()) {
            return documents;
        }
        List<Segment> segments = parse(path);
        List<YamlNode> result = new ArrayList<>();
        for (YamlNode document : documents) {
            YamlNode target = navigate(document, path, segments);
            if (listToDocuments && target.isList()) {
                result.addAll(target.asList());
            } else {
                result.add(target);
            }
        }
        return result;
    }

    /**
     * @return the node at {@code path}
     * @throws ChrootException when the path is malformed or does not resolve
     */
    public static YamlNode navigate(YamlNode document, String path) throws ChrootException {
        if (path == null || path.isEmpty()) {
            return YamlNode.orNull(document);
        }
        return navigate(document, path, parse(path));
    }

    private static YamlNode navigate(YamlNode document, String path, List<Segment> segments) throws ChrootException {
        YamlNode current = YamlNode.orNull(document);
        for (Segment segment : segments) {
            if (segment.isIndex()) {
                if (!current.isList()) {
                    throw new ChrootException(path, String.format("expected list at index %d, got %s",
                            segment.index, typeName(current)));
                }
                List<YamlNode> list = current.asList();
                if (segment.index < 0 || segment.index >= list.size()) {
                    throw new ChrootException(path, String.format("index %d out of bounds (list has %d items)",
                            segment.index, list.size()));
                }
                current = list.get(segment.index);
            } else {
                if (!current.isMap()) {
                    throw new ChrootException(path, String.format("expected map at \"%s\", got %s",
                            segment.key, typeName(current)));
                }
                if (!current.asMap().containsKey(segment.key)) {
                    throw new ChrootException(path, String.format("key \"%s\" not found", segment.key));
                }
                current = current.asMap().get(segment.key);
            }
        }
        return current;
    }

    /**
     * Splits a path at dots outside brackets; {@code key[n]} becomes a key step followed by an index step.
     */
    static List<Segment> parse(String path) throws ChrootException {
        List<String> parts = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inBracket = false;
        for (int i = 0; i < path.length(); i++) {
            char c = path.charAt(i);
            if (c == '.' && !inBracket) {
                if (current.length() > 0) {
                    parts.add(current.toString());
                    current.setLength(0);
                }
                continue;
            }
            if (c == '[') {
                if (inBracket) {
                    throw new ChrootException(path, "invalid path syntax \"" + path + "\"");
                }
                inBracket = true;
            } else if (c == ']') {
                if (!inBracket) {
                    throw new ChrootException(path, "invalid path syntax \"" + path + "\"");
                }
                inBracket = false;
            }
            current.append(c);
        }
        if (inBracket) {
            throw new ChrootException(path, "invalid path syntax \"" + path + "\"");
        }
        if (current.length() > 0) {
            parts.add(current.toString());
        }

        List<Segment> segments = new ArrayList<>();
        for (String part : parts) {
            int open = part.indexOf('[');
            if (open < 0) {
                segments.add(Segment.key(part));
                continue;
            }
            if (open != part.lastIndexOf('[') || part.indexOf(']') != part.length() - 1) {
                throw new ChrootException(path, "invalid list index syntax \"" + part + "\"");
            }
            String indexText = part.substring(open + 1, part.length() - 1);
            if (indexText.isEmpty()) {
                throw new ChrootException(path, "empty list index in \"" + part + "\"");
            }
            if (open > 0) {
                segments.add(Segment.key(part.substring(0, open)));
            }
            try {
                segments.add(Segment.index(Integer.parseInt(indexText)));
            } catch (NumberFormatException e) {
                throw new ChrootException(path, "invalid list index \"" + indexText + "\"");
            }
        }
        return segments;
    }

    private static String typeName(YamlNode node) {
        return node.getType().name().toLowerCase(Locale.ROOT);
    }

    static final class Segment {

        final String key;
        final int index;

        private Segment(String key, int index) {
            this.key = key;
            this.index = index;
        }

        static Segment key(String key) {
            return new Segment(key, -1);
        }

        static Segment index(int index) {
            return new Segment(null, index);
        }

        boolean isIndex() {
            return key == null;
        }
    }
}

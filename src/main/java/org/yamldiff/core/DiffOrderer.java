package org.yamldiff.core;

import org.yamldiff.domain.CompareOptions;
import org.yamldiff.domain.Difference;
import org.yamldiff.domain.YamlNode;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Sorts differences into reading order.
 * <p>
 * Every path of the source documents gets a position from a depth-first walk over the {@code from} documents
 * and then the {@code to} documents. Differences are then grouped by their root segment in source order and,
 * within a root, ordered by source position, nearest positioned ancestor, depth and finally path text.
 * Whole additions at the root come first. The sort is stable.
 */
public final class DiffOrderer {

    private static final Pattern DOCUMENT_PREFIX = Pattern.compile("\\[(\\d{1,9})]");
    private static final Pattern INDEX_SUFFIX = Pattern.compile(".*\\.\\d+");

    private final Map<String, Integer> pathOrder;

    private DiffOrderer(Map<String, Integer> pathOrder) {
        this.pathOrder = pathOrder;
    }

    /**
     * @return a new list holding {@code diffs} in reading order
     */
    public static List<Difference> order(List<Difference> diffs, List<YamlNode> fromDocuments,
                                         List<YamlNode> toDocuments, CompareOptions options) {
        DiffOrderer orderer = new DiffOrderer(pathOrder(fromDocuments, toDocuments, options));
        List<Difference> sorted = new ArrayList<>(diffs);
        sorted.sort(orderer.comparator());
        return sorted;
    }

    /**
     * Positions of all paths in the documents. Multi-document streams prefix paths with {@code [i]}, the same
     * way the comparator does.
     */
    static Map<String, Integer> pathOrder(List<YamlNode> fromDocuments, List<YamlNode> toDocuments,
                                          CompareOptions options) {
        Map<String, Integer> order = new HashMap<>();
        List<String> additional = ListStrategySelector.additionalIdentifiers(options);
        boolean prefixed = fromDocuments.size() > 1 || toDocuments.size() > 1;
        for (int i = 0; i < fromDocuments.size(); i++) {
            record(order, prefixed ? StructuralComparator.documentPath(i) : "", fromDocuments.get(i), additional);
        }
        for (int i = 0; i < toDocuments.size(); i++) {
            record(order, prefixed ? StructuralComparator.documentPath(i) : "", toDocuments.get(i), additional);
        }
        return order;
    }

    private static void record(Map<String, Integer> order, String path, YamlNode node, List<String> additional) {
        if (!path.isEmpty()) {
            order.putIfAbsent(path, order.size());
        }
        if (node.isMap()) {
            for (String key : node.asMap().keys()) {
                record(order, StructuralComparator.childPath(path, key), node.asMap().get(key), additional);
            }
        } else if (node.isList()) {
            List<YamlNode> items = node.asList();
            for (int i = 0; i < items.size(); i++) {
                YamlNode id = ListStrategySelector.identifierOf(items.get(i), additional);
                String segment = ListStrategySelector.isUsableIdentifier(id) ? id.scalarText() : String.valueOf(i);
                record(order, StructuralComparator.childPath(path, segment), items.get(i), additional);
            }
        }
    }

    private Comparator<Difference> comparator() {
        return Comparator.comparing((Difference diff) -> !isRootAddition(diff))
                .thenComparing(diff -> root(diff.getPath()), this::compareRoots)
                .thenComparing(Difference::getPath, this::compareWithinRoot);
    }

    private int compareRoots(String a, String b) {
        if (a.equals(b)) {
            return 0;
        }
        Integer orderA = pathOrder.get(a);
        Integer orderB = pathOrder.get(b);
        if (orderA != null && orderB != null) {
            return Integer.compare(orderA, orderB);
        }
        if (orderA != null || orderB != null) {
            return orderA != null ? -1 : 1;
        }
        Matcher documentA = DOCUMENT_PREFIX.matcher(a);
        Matcher documentB = DOCUMENT_PREFIX.matcher(b);
        if (documentA.matches() && documentB.matches()) {
            return Integer.compare(Integer.parseInt(documentA.group(1)), Integer.parseInt(documentB.group(1)));
        }
        return a.compareTo(b);
    }

    private int compareWithinRoot(String a, String b) {
        Integer orderA = pathOrder.get(a);
        Integer orderB = pathOrder.get(b);
        if (orderA != null && orderB != null) {
            return Integer.compare(orderA, orderB);
        }
        if (orderA != null || orderB != null) {
            return orderA != null ? -1 : 1;
        }
        int parentA = ancestorOrder(a);
        int parentB = ancestorOrder(b);
        if (parentA != parentB) {
            return Integer.compare(parentA, parentB);
        }
        int depthA = depth(a);
        int depthB = depth(b);
        if (depthA != depthB) {
            return Integer.compare(depthA, depthB);
        }
        return a.compareTo(b);
    }

    /** Position of the nearest recorded ancestor, or -1 when none is recorded. */
    private int ancestorOrder(String path) {
        String current = path;
        while (true) {
            Integer order = pathOrder.get(current);
            if (order != null) {
                return order;
            }
            int lastDot = current.lastIndexOf('.');
            if (lastDot < 0) {
                return -1;
            }
            current = current.substring(0, lastDot);
        }
    }

    static boolean isRootAddition(Difference diff) {
        return diff.getType() == Difference.DiffType.ADDED && diff.getPath().indexOf('.') < 0 && !isListEntry(diff);
    }

    /**
     * A difference describes a list entry when its path ends in an index or a document prefix, or when its
     * value is a map carrying {@code name} or {@code id}.
     */
    static boolean isListEntry(Difference diff) {
        String path = diff.getPath();
        if (path.endsWith("]") || INDEX_SUFFIX.matcher(path).matches()) {
            return true;
        }
        YamlNode value = diff.getTo() != null && !diff.getTo().isNull() ? diff.getTo() : diff.getFrom();
        return value != null && value.isMap()
                && (value.asMap().containsKey(ListStrategySelector.NAME_FIELD)
                || value.asMap().containsKey(ListStrategySelector.ID_FIELD));
    }

    static String root(String path) {
        int dot = path.indexOf('.');
        return dot < 0 ? path : path.substring(0, dot);
    }

    private static int depth(String path) {
        int depth = 0;
        for (int i = 0; i < path.length(); i++) {
            if (path.charAt(i) == '.') {
                depth++;
            }
        }
        return depth;
    }
}

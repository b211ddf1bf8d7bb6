package org.yamldiff.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yamldiff.domain.CompareOptions;
import org.yamldiff.domain.Difference;
import org.yamldiff.domain.OrderedMap;
import org.yamldiff.domain.YamlNode;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Recursive comparison of two parsed documents.
 * <p>
 * Paths are dotted: map keys, list indices, or the identifier text of identifier-matched list entries.
 * A null node on either side counts as absent. Instances hold only the immutable options and may be shared.
 */
public final class StructuralComparator {

    private static final Logger logger = LoggerFactory.getLogger(StructuralComparator.class);

    private final CompareOptions options;

    public StructuralComparator(CompareOptions options) {
        this.options = options == null ? CompareOptions.defaults() : options;
    }

    /**
     * Compares two document streams. Documents are paired by index, or by resource identity when Kubernetes
     * detection is on and either side holds a Kubernetes resource. Every difference carries the index of the
     * document it was found in.
     */
    public List<Difference> compareDocuments(List<YamlNode> from, List<YamlNode> to) {
        if (options.isDetectKubernetes() && KubernetesMatcher.containsResources(from, to)) {
            return compareResources(from, to);
        }

        List<Difference> diffs = new ArrayList<>();
        int count = Math.max(from.size(), to.size());
        for (int i = 0; i < count; i++) {
            String prefix = count > 1 ? documentPath(i) : "";
            // a missing document on either side compares as NULL
            YamlNode fromDocument = i < from.size() ? from.get(i) : YamlNode.nullNode();
            YamlNode toDocument = i < to.size() ? to.get(i) : YamlNode.nullNode();
            List<Difference> documentDiffs = compareNodes(prefix, fromDocument, toDocument);
            for (Difference diff : documentDiffs) {
                diffs.add(diff.withDocumentIndex(i));
            }
        }
        logger.debug("Compared {} -> {} document(s) by position: {} difference(s)", from.size(), to.size(), diffs.size());
        return diffs;
    }

    private List<Difference> compareResources(List<YamlNode> from, List<YamlNode> to) {
        KubernetesMatcher.DocumentMatch match = KubernetesMatcher.match(from, to, options);
        boolean prefixed = from.size() > 1 || to.size() > 1;

        List<Difference> diffs = new ArrayList<>();
        for (Map.Entry<Integer, Integer> pair : match.getMatched().entrySet()) {
            int fromIdx = pair.getKey();
            String prefix = prefixed ? documentPath(fromIdx) : "";
            for (Difference diff : compareNodes(prefix, from.get(fromIdx), to.get(pair.getValue()))) {
                diffs.add(diff.withDocumentIndex(fromIdx));
            }
        }
        for (int fromIdx : match.getUnmatchedFrom()) {
            if (!from.get(fromIdx).isNull()) {
                diffs.add(Difference.removed(documentPath(fromIdx), from.get(fromIdx)).withDocumentIndex(fromIdx));
            }
        }
        for (int toIdx : match.getUnmatchedTo()) {
            if (!to.get(toIdx).isNull()) {
                diffs.add(Difference.added(documentPath(toIdx), to.get(toIdx)).withDocumentIndex(toIdx));
            }
        }
        return diffs;
    }

    /**
     * Compares two nodes found at {@code path}.
     */
    public List<Difference> compareNodes(String path, YamlNode from, YamlNode to) {
        YamlNode left = YamlNode.orNull(from);
        YamlNode right = YamlNode.orNull(to);
        List<Difference> diffs = new ArrayList<>();

        if (left.isNull() && right.isNull()) {
            return diffs;
        }
        if (left.isNull()) {
            diffs.add(Difference.added(path, right));
            return diffs;
        }
        if (right.isNull() || left.getType() != right.getType()) {
            // a key that now holds null still exists, so this is a value change
            if (!options.isIgnoreValueChanges()) {
                diffs.add(Difference.modified(path, left, right));
            }
            return diffs;
        }

        switch (left.getType()) {
            case MAP:
                compareMaps(path, left.asMap(), right.asMap(), diffs);
                break;
            case LIST:
                compareLists(path, left.asList(), right.asList(), diffs);
                break;
            default:
                if (!ValueEquality.valuesEqual(left, right, options) && !options.isIgnoreValueChanges()) {
                    diffs.add(Difference.modified(path, left, right));
                }
        }
        return diffs;
    }

    private void compareMaps(String path, OrderedMap from, OrderedMap to, List<Difference> diffs) {
        for (String key : from.keys()) {
            String childPath = childPath(path, key);
            if (to.containsKey(key)) {
                diffs.addAll(compareNodes(childPath, from.get(key), to.get(key)));
            } else {
                diffs.add(Difference.removed(childPath, from.get(key)));
            }
        }
        for (String key : to.keys()) {
            if (!from.containsKey(key)) {
                diffs.add(Difference.added(childPath(path, key), to.get(key)));
            }
        }
    }

    private void compareLists(String path, List<YamlNode> from, List<YamlNode> to, List<Difference> diffs) {
        switch (ListStrategySelector.select(from, to, options)) {
            case IDENTIFIER:
                compareByIdentifier(path, from, to, diffs);
                break;
            case UNORDERED:
            case HETEROGENEOUS:
                compareUnordered(path, from, allIndices(from), to, allIndices(to), diffs);
                break;
            default:
                comparePositional(path, from, to, diffs);
        }
    }

    private void comparePositional(String path, List<YamlNode> from, List<YamlNode> to, List<Difference> diffs) {
        int count = Math.max(from.size(), to.size());
        for (int i = 0; i < count; i++) {
            String childPath = childPath(path, String.valueOf(i));
            if (i >= from.size()) {
                diffs.add(Difference.added(childPath, to.get(i)));
            } else if (i >= to.size()) {
                diffs.add(Difference.removed(childPath, from.get(i)));
            } else {
                diffs.addAll(compareNodes(childPath, from.get(i), to.get(i)));
            }
        }
    }

    /**
     * Greedy multiset matching over the given positions: each {@code from} entry claims the first unclaimed
     * deep-equal {@code to} entry. Leftovers are reported at their own index on their own side.
     */
    private void compareUnordered(String path, List<YamlNode> from, List<Integer> fromPositions,
                                  List<YamlNode> to, List<Integer> toPositions, List<Difference> diffs) {
        boolean[] claimed = new boolean[toPositions.size()];
        for (int fromIdx : fromPositions) {
            YamlNode fromItem = from.get(fromIdx);
            boolean found = false;
            for (int j = 0; j < toPositions.size(); j++) {
                if (!claimed[j] && ValueEquality.deepEqual(fromItem, to.get(toPositions.get(j)), options)) {
                    claimed[j] = true;
                    found = true;
                    break;
                }
            }
            if (!found) {
                diffs.add(Difference.removed(childPath(path, String.valueOf(fromIdx)), fromItem));
            }
        }
        for (int j = 0; j < toPositions.size(); j++) {
            if (!claimed[j]) {
                int toIdx = toPositions.get(j);
                diffs.add(Difference.added(childPath(path, String.valueOf(toIdx)), to.get(toIdx)));
            }
        }
    }

    /**
     * Pairs entries by identifier; matched entries are compared under {@code path.<identifier>}, unpaired ones
     * are reported whole at the list path. Entries without a usable identifier fall back to multiset matching.
     */
    private void compareByIdentifier(String path, List<YamlNode> from, List<YamlNode> to, List<Difference> diffs) {
        List<String> additional = ListStrategySelector.additionalIdentifiers(options);

        Map<YamlNode, List<Integer>> toById = new LinkedHashMap<>();
        List<Integer> toWithoutId = new ArrayList<>();
        for (int j = 0; j < to.size(); j++) {
            YamlNode id = ListStrategySelector.identifierOf(to.get(j), additional);
            if (ListStrategySelector.isUsableIdentifier(id)) {
                toById.computeIfAbsent(id, key -> new ArrayList<>()).add(j);
            } else {
                toWithoutId.add(j);
            }
        }

        Map<YamlNode, Integer> fromOccurrences = new HashMap<>();
        List<Integer> fromWithoutId = new ArrayList<>();
        for (int i = 0; i < from.size(); i++) {
            YamlNode fromItem = from.get(i);
            YamlNode id = ListStrategySelector.identifierOf(fromItem, additional);
            if (!ListStrategySelector.isUsableIdentifier(id)) {
                fromWithoutId.add(i);
                continue;
            }
            int occurrence = fromOccurrences.merge(id, 1, Integer::sum) - 1;
            List<Integer> candidates = toById.get(id);
            if (candidates != null && occurrence < candidates.size()) {
                YamlNode toItem = to.get(candidates.get(occurrence));
                diffs.addAll(compareNodes(childPath(path, id.scalarText()), fromItem, toItem));
            } else {
                diffs.add(Difference.removed(path, fromItem));
            }
        }

        Map<YamlNode, Integer> toOccurrences = new HashMap<>();
        for (int j = 0; j < to.size(); j++) {
            YamlNode id = ListStrategySelector.identifierOf(to.get(j), additional);
            if (!ListStrategySelector.isUsableIdentifier(id)) {
                continue;
            }
            int occurrence = toOccurrences.merge(id, 1, Integer::sum) - 1;
            if (occurrence >= fromOccurrences.getOrDefault(id, 0)) {
                diffs.add(Difference.added(path, to.get(j)));
            }
        }

        compareUnordered(path, from, fromWithoutId, to, toWithoutId, diffs);
    }

    private static List<Integer> allIndices(List<YamlNode> list) {
        List<Integer> indices = new ArrayList<>(list.size());
        for (int i = 0; i < list.size(); i++) {
            indices.add(i);
        }
        return indices;
    }

    static String childPath(String base, String segment) {
        return base.isEmpty() ? segment : base + "." + segment;
    }

    static String documentPath(int index) {
        return "[" + index + "]";
    }
}

package org.yamldiff.core;

import org.yamldiff.domain.YamlNode;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Pairs Kubernetes resources that lost their identity match (typically because they were renamed) by
 * comparing their serialized content line by line.
 */
final class RenameDetector {

    /** Minimum similarity percentage for a pair. */
    static final int SCORE_THRESHOLD = 60;

    /** Above this many candidates on either side detection is skipped. */
    static final int CANDIDATE_LIMIT = 50;

    private RenameDetector() {
    }

    /**
     * @return renamed pairs, {@code from} index to {@code to} index
     */
    static Map<Integer, Integer> detect(List<YamlNode> from, List<YamlNode> to,
                                        List<Integer> unmatchedFrom, List<Integer> unmatchedTo) {
        List<Integer> fromCandidates = resources(from, unmatchedFrom);
        List<Integer> toCandidates = resources(to, unmatchedTo);
        Map<Integer, Integer> renamed = new LinkedHashMap<>();
        if (fromCandidates.isEmpty() || toCandidates.isEmpty()
                || Math.max(fromCandidates.size(), toCandidates.size()) > CANDIDATE_LIMIT) {
            return renamed;
        }

        Yaml yaml = newYaml();
        Map<Integer, SimilarityIndex> fromIndexes = new HashMap<>();
        for (int idx : fromCandidates) {
            fromIndexes.put(idx, new SimilarityIndex(serialize(yaml, from.get(idx))));
        }
        Map<Integer, SimilarityIndex> toIndexes = new HashMap<>();
        for (int idx : toCandidates) {
            toIndexes.put(idx, new SimilarityIndex(serialize(yaml, to.get(idx))));
        }

        List<int[]> pairs = new ArrayList<>();
        for (int fromIdx : fromCandidates) {
            SimilarityIndex fromIndex = fromIndexes.get(fromIdx);
            for (int toIdx : toCandidates) {
                SimilarityIndex toIndex = toIndexes.get(toIdx);
                if (!similarSize(fromIndex.byteLength, toIndex.byteLength)) {
                    continue;
                }
                int score = fromIndex.score(toIndex);
                if (score >= SCORE_THRESHOLD) {
                    pairs.add(new int[]{fromIdx, toIdx, score});
                }
            }
        }
        pairs.sort(Comparator.<int[]>comparingInt(p -> -p[2])
                .thenComparingInt(p -> p[0])
                .thenComparingInt(p -> p[1]));

        Set<Integer> assignedTo = new HashSet<>();
        for (int[] pair : pairs) {
            if (renamed.containsKey(pair[0]) || assignedTo.contains(pair[1])) {
                continue;
            }
            renamed.put(pair[0], pair[1]);
            assignedTo.add(pair[1]);
        }
        return renamed;
    }

    /** Similarity of two texts in percent, 0 to 100. */
    static int similarity(String a, String b) {
        return new SimilarityIndex(a).score(new SimilarityIndex(b));
    }

    private static boolean similarSize(int a, int b) {
        int min = Math.min(a, b);
        int max = Math.max(a, b);
        return max == 0 || (long) min * 100 / max >= SCORE_THRESHOLD;
    }

    private static List<Integer> resources(List<YamlNode> documents, List<Integer> indices) {
        List<Integer> result = new ArrayList<>();
        for (int idx : indices) {
            if (KubernetesMatcher.isKubernetesResource(documents.get(idx))) {
                result.add(idx);
            }
        }
        return result;
    }

    private static Yaml newYaml() {
        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        options.setIndent(2);
        return new Yaml(options);
    }

    private static String serialize(Yaml yaml, YamlNode document) {
        return yaml.dump(document.toPlainObject());
    }

    /**
     * Multiset of DJB hashes of the non-blank lines of a text.
     */
    private static final class SimilarityIndex {

        private final Map<Integer, Integer> hashes = new HashMap<>();
        private final int byteLength;
        private int lines;

        SimilarityIndex(String text) {
            byte[] data = text.getBytes(StandardCharsets.UTF_8);
            this.byteLength = data.length;
            int start = 0;
            for (int i = 0; i <= data.length; i++) {
                if (i == data.length || data[i] == '\n') {
                    addLine(data, start, i);
                    start = i + 1;
                }
            }
        }

        private void addLine(byte[] data, int start, int end) {
            boolean blank = true;
            for (int i = start; i < end; i++) {
                if (data[i] != ' ' && data[i] != '\t' && data[i] != '\r') {
                    blank = false;
                    break;
                }
            }
            if (blank) {
                return;
            }
            int hash = 5381;
            for (int i = start; i < end; i++) {
                hash = hash * 33 + (data[i] & 0xff);
            }
            hashes.merge(hash, 1, Integer::sum);
            lines++;
        }

        int score(SimilarityIndex other) {
            int maxLines = Math.max(lines, other.lines);
            if (maxLines == 0) {
                return 0;
            }
            int shared = 0;
            for (Map.Entry<Integer, Integer> entry : other.hashes.entrySet()) {
                Integer count = hashes.get(entry.getKey());
                if (count != null) {
                    shared += Math.min(count, entry.getValue());
                }
            }
            return shared * 100 / maxLines;
        }
    }
}

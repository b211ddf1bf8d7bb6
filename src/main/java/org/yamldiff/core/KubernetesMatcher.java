package org.yamldiff.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yamldiff.domain.CompareOptions;
import org.yamldiff.domain.OrderedMap;
import org.yamldiff.domain.YamlNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Recognises Kubernetes resources and pairs them across two document streams by identity
 * ({@code apiVersion:kind:namespace/name}) instead of by position.
 */
public final class KubernetesMatcher {

    private static final Logger logger = LoggerFactory.getLogger(KubernetesMatcher.class);

    private KubernetesMatcher() {
    }

    /**
     * A resource is a map with string {@code apiVersion} and {@code kind}, and a {@code metadata} map holding
     * a non-null {@code name} or, failing that, a non-null {@code generateName}.
     */
    public static boolean isKubernetesResource(YamlNode document) {
        if (document == null || !document.isMap()) {
            return false;
        }
        OrderedMap map = document.asMap();
        if (!isString(map.get("apiVersion")) || !isString(map.get("kind"))) {
            return false;
        }
        YamlNode metadata = map.get("metadata");
        if (metadata == null || !metadata.isMap()) {
            return false;
        }
        return !isAbsent(metadata.asMap().get("name")) || !isAbsent(metadata.asMap().get("generateName"));
    }

    /**
     * @return {@code apiVersion:kind:namespace/name}, {@code apiVersion:kind:name} without a namespace, with
     * the apiVersion part left out when {@code ignoreApiVersion} is set; {@code null} for non-resources
     */
    public static String resourceIdentifier(YamlNode document, boolean ignoreApiVersion) {
        if (!isKubernetesResource(document)) {
            return null;
        }
        OrderedMap map = document.asMap();
        OrderedMap metadata = map.get("metadata").asMap();
        YamlNode name = metadata.get("name");
        if (isAbsent(name)) {
            name = metadata.get("generateName");
        }
        StringBuilder id = new StringBuilder();
        if (!ignoreApiVersion) {
            id.append(map.get("apiVersion").asText()).append(':');
        }
        id.append(map.get("kind").asText()).append(':');
        YamlNode namespace = metadata.get("namespace");
        if (!isAbsent(namespace)) {
            id.append(namespace).append('/');
        }
        return id.append(name).toString();
    }

    /** @return true when any document on either side is a Kubernetes resource */
    public static boolean containsResources(List<YamlNode> from, List<YamlNode> to) {
        for (YamlNode document : from) {
            if (isKubernetesResource(document)) {
                return true;
            }
        }
        for (YamlNode document : to) {
            if (isKubernetesResource(document)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Pairs documents by resource identifier. When an identifier occurs several times, the n-th occurrence
     * in {@code from} pairs with the n-th in {@code to}. With rename detection on, leftover resources are
     * then paired by content similarity.
     */
    public static DocumentMatch match(List<YamlNode> from, List<YamlNode> to, CompareOptions options) {
        boolean ignoreApiVersion = options != null && options.isIgnoreApiVersion();

        Map<String, Deque<Integer>> toIndex = new HashMap<>();
        for (int i = 0; i < to.size(); i++) {
            String id = resourceIdentifier(to.get(i), ignoreApiVersion);
            if (id != null) {
                toIndex.computeIfAbsent(id, key -> new ArrayDeque<>()).add(i);
            }
        }

        SortedMap<Integer, Integer> matched = new TreeMap<>();
        Set<Integer> matchedTo = new HashSet<>();
        List<Integer> unmatchedFrom = new ArrayList<>();
        for (int i = 0; i < from.size(); i++) {
            String id = resourceIdentifier(from.get(i), ignoreApiVersion);
            Deque<Integer> candidates = id == null ? null : toIndex.get(id);
            if (candidates != null && !candidates.isEmpty()) {
                int toIdx = candidates.poll();
                matched.put(i, toIdx);
                matchedTo.add(toIdx);
            } else {
                unmatchedFrom.add(i);
            }
        }
        List<Integer> unmatchedTo = new ArrayList<>();
        for (int i = 0; i < to.size(); i++) {
            if (!matchedTo.contains(i)) {
                unmatchedTo.add(i);
            }
        }

        if (options != null && options.isDetectRenames()) {
            Map<Integer, Integer> renamed = RenameDetector.detect(from, to, unmatchedFrom, unmatchedTo);
            if (!renamed.isEmpty()) {
                logger.debug("Paired {} renamed resource(s): {}", renamed.size(), renamed);
                matched.putAll(renamed);
                unmatchedFrom.removeAll(renamed.keySet());
                unmatchedTo.removeAll(renamed.values());
            }
        }

        logger.debug("Matched {} resource(s), {} only in from, {} only in to",
                matched.size(), unmatchedFrom.size(), unmatchedTo.size());
        return new DocumentMatch(matched, unmatchedFrom, unmatchedTo);
    }

    private static boolean isString(YamlNode node) {
        return node != null && node.isString();
    }

    private static boolean isAbsent(YamlNode node) {
        return node == null || node.isNull();
    }

    /**
     * Result of pairing two document streams: matched indices in ascending {@code from} order plus the indices
     * left over on each side, ascending.
     */
    public static final class DocumentMatch {

        private final SortedMap<Integer, Integer> matched;
        private final List<Integer> unmatchedFrom;
        private final List<Integer> unmatchedTo;

        DocumentMatch(SortedMap<Integer, Integer> matched, List<Integer> unmatchedFrom, List<Integer> unmatchedTo) {
            this.matched = Collections.unmodifiableSortedMap(matched);
            this.unmatchedFrom = Collections.unmodifiableList(unmatchedFrom);
            this.unmatchedTo = Collections.unmodifiableList(unmatchedTo);
        }

        public SortedMap<Integer, Integer> getMatched() {
            return matched;
        }

        public List<Integer> getUnmatchedFrom() {
            return unmatchedFrom;
        }

        public List<Integer> getUnmatchedTo() {
            return unmatchedTo;
        }
    }
}

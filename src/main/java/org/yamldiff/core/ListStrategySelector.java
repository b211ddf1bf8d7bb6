package org.yamldiff.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yamldiff.domain.CompareOptions;
import org.yamldiff.domain.OrderedMap;
import org.yamldiff.domain.YamlNode;

import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Chooses how two lists at the same path are matched against each other.
 * <p>
 * The predicates are pure functions over the list contents so they can be exercised on their own.
 */
public final class ListStrategySelector {

    private static final Logger logger = LoggerFactory.getLogger(ListStrategySelector.class);

    static final String NAME_FIELD = "name";
    static final String ID_FIELD = "id";

    public enum Strategy {
        /** Entries are paired by their identifier field. */
        IDENTIFIER,
        /** Entries are paired as a multiset because order changes are ignored. */
        UNORDERED,
        /** Single-key entries of different shapes, compared as a multiset. */
        HETEROGENEOUS,
        /** Entries are paired by index. */
        POSITIONAL
    }

    private ListStrategySelector() {
    }

    public static Strategy select(List<YamlNode> from, List<YamlNode> to, CompareOptions options) {
        List<String> additional = additionalIdentifiers(options);
        Strategy strategy;
        if (canMatchByIdentifier(from, additional) && canMatchByIdentifier(to, additional)) {
            strategy = Strategy.IDENTIFIER;
        } else if (options != null && options.isIgnoreOrderChanges()) {
            strategy = Strategy.UNORDERED;
        } else if (isHeterogeneous(from, to)) {
            strategy = Strategy.HETEROGENEOUS;
        } else {
            strategy = Strategy.POSITIONAL;
        }
        if (logger.isTraceEnabled()) {
            logger.trace("List of {} -> {} entries compared with strategy {}", from.size(), to.size(), strategy);
        }
        return strategy;
    }

    /**
     * @return true when the list is non-empty and at least one entry carries a usable identifier
     */
    public static boolean canMatchByIdentifier(List<YamlNode> list, List<String> additionalIdentifiers) {
        for (YamlNode item : list) {
            if (isUsableIdentifier(identifierOf(item, additionalIdentifiers))) {
                return true;
            }
        }
        return false;
    }

    /**
     * Looks up the identifier field of a map entry: configured fields first, then {@code name}, then
     * {@code id}. The first field present decides, even when its value turns out not to be usable.
     *
     * @return the identifier value, or {@code null} when the entry is not a map or has none of the fields
     */
    public static YamlNode identifierOf(YamlNode item, List<String> additionalIdentifiers) {
        if (item == null || !item.isMap()) {
            return null;
        }
        OrderedMap map = item.asMap();
        if (additionalIdentifiers != null) {
            for (String field : additionalIdentifiers) {
                if (map.containsKey(field)) {
                    return map.get(field);
                }
            }
        }
        if (map.containsKey(NAME_FIELD)) {
            return map.get(NAME_FIELD);
        }
        if (map.containsKey(ID_FIELD)) {
            return map.get(ID_FIELD);
        }
        return null;
    }

    /** Only non-null scalars can serve as lookup keys. */
    public static boolean isUsableIdentifier(YamlNode identifier) {
        return identifier != null && identifier.isScalar();
    }

    /**
     * Detects lists of mutually exclusive variants such as {@code [{podSelector: ..}, {ipBlock: ..}]}: every
     * entry on both sides is a map with exactly one key, and more than one distinct key occurs overall.
     */
    public static boolean isHeterogeneous(List<YamlNode> from, List<YamlNode> to) {
        Set<String> keys = new HashSet<>();
        if (!collectSingleKeys(from, keys) || !collectSingleKeys(to, keys)) {
            return false;
        }
        return keys.size() > 1;
    }

    private static boolean collectSingleKeys(List<YamlNode> list, Set<String> keys) {
        for (YamlNode item : list) {
            if (!item.isMap() || item.asMap().size() != 1) {
                return false;
            }
            keys.addAll(item.asMap().keys());
        }
        return true;
    }

    static List<String> additionalIdentifiers(CompareOptions options) {
        return options == null ? Collections.emptyList() : options.getAdditionalIdentifiers();
    }
}

package org.yamldiff.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable mapping that remembers the order in which its keys first appeared in the source document.
 * <p>
 * Key order and value lookup are backed by a single {@link LinkedHashMap}, so the two views can never
 * disagree. Instances are only produced by {@link Builder}.
 */
public final class OrderedMap {

    private static final OrderedMap EMPTY = new OrderedMap(new LinkedHashMap<>());

    private final Map<String, YamlNode> entries;
    private final List<String> keys;

    private OrderedMap(LinkedHashMap<String, YamlNode> entries) {
        this.entries = Collections.unmodifiableMap(entries);
        this.keys = Collections.unmodifiableList(new ArrayList<>(entries.keySet()));
    }

    public static OrderedMap empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Keys in first-insertion order. */
    public List<String> keys() {
        return keys;
    }

    public Set<String> keySet() {
        return entries.keySet();
    }

    public YamlNode get(String key) {
        return entries.get(key);
    }

    public boolean containsKey(String key) {
        return entries.containsKey(key);
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /** Entries in key order. */
    public Set<Map.Entry<String, YamlNode>> entrySet() {
        return entries.entrySet();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        OrderedMap that = (OrderedMap) o;
        return entries.equals(that.entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        boolean first = true;
        for (Map.Entry<String, YamlNode> entry : entries.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append(": ").append(entry.getValue());
            first = false;
        }
        return sb.append('}').toString();
    }

    /**
     * Single mutator of an {@link OrderedMap}. A builder can be used to build exactly one map.
     */
    public static final class Builder {

        private LinkedHashMap<String, YamlNode> entries = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Inserts an explicit key. A repeated key keeps its first position and takes the new value.
         */
        public Builder put(String key, YamlNode value) {
            ensureOpen().put(Objects.requireNonNull(key, "key"), YamlNode.orNull(value));
            return this;
        }

        /**
         * Inserts a merged key only when it is not present yet.
         */
        public Builder putIfAbsent(String key, YamlNode value) {
            ensureOpen().putIfAbsent(Objects.requireNonNull(key, "key"), YamlNode.orNull(value));
            return this;
        }

        public boolean containsKey(String key) {
            return ensureOpen().containsKey(key);
        }

        public OrderedMap build() {
            LinkedHashMap<String, YamlNode> built = ensureOpen();
            entries = null;
            return built.isEmpty() ? EMPTY : new OrderedMap(built);
        }

        private LinkedHashMap<String, YamlNode> ensureOpen() {
            if (entries == null) {
                throw new IllegalStateException("OrderedMap already built");
            }
            return entries;
        }
    }
}

package org.yamldiff.domain;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One parsed YAML value: null, a scalar (boolean, integer, float, string), an {@link OrderedMap} or a list.
 * <p>
 * The hierarchy is closed: the only subclasses are the nested ones below, and every instance is immutable.
 * Equality is structural; maps compare by key set and values regardless of key order.
 */
public abstract class YamlNode {

    public enum NodeType {
        NULL,
        BOOLEAN,
        INTEGER,
        FLOAT,
        STRING,
        MAP,
        LIST;

        public boolean isScalar() {
            return this == BOOLEAN || this == INTEGER || this == FLOAT || this == STRING;
        }
    }

    private static final BigInteger LONG_MIN = BigInteger.valueOf(Long.MIN_VALUE);
    private static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);

    private YamlNode() {
    }

    // ==================== Factories ====================

    public static YamlNode nullNode() {
        return NullNode.INSTANCE;
    }

    /** Maps a Java {@code null} to the null node. */
    public static YamlNode orNull(YamlNode node) {
        return node == null ? NullNode.INSTANCE : node;
    }

    public static YamlNode bool(boolean value) {
        return value ? ScalarNode.TRUE : ScalarNode.FALSE;
    }

    public static YamlNode integer(long value) {
        return new ScalarNode(NodeType.INTEGER, value);
    }

    /** Integers that fit into a {@code long} are stored as such so equal numbers compare equal. */
    public static YamlNode integer(BigInteger value) {
        Objects.requireNonNull(value, "value");
        if (value.compareTo(LONG_MIN) >= 0 && value.compareTo(LONG_MAX) <= 0) {
            return integer(value.longValue());
        }
        return new ScalarNode(NodeType.INTEGER, value);
    }

    public static YamlNode floating(double value) {
        return new ScalarNode(NodeType.FLOAT, value);
    }

    public static YamlNode string(String value) {
        return new ScalarNode(NodeType.STRING, Objects.requireNonNull(value, "value"));
    }

    public static YamlNode map(OrderedMap map) {
        return new MapNode(Objects.requireNonNull(map, "map"));
    }

    public static YamlNode list(List<YamlNode> items) {
        List<YamlNode> copy = new ArrayList<>(items.size());
        for (YamlNode item : items) {
            copy.add(orNull(item));
        }
        return new ListNode(Collections.unmodifiableList(copy));
    }

    // ==================== Accessors ====================

    public abstract NodeType getType();

    public boolean isNull() {
        return getType() == NodeType.NULL;
    }

    public boolean isScalar() {
        return getType().isScalar();
    }

    public boolean isMap() {
        return getType() == NodeType.MAP;
    }

    public boolean isList() {
        return getType() == NodeType.LIST;
    }

    public boolean isString() {
        return getType() == NodeType.STRING;
    }

    public OrderedMap asMap() {
        throw new IllegalStateException("Not a map: " + getType());
    }

    public List<YamlNode> asList() {
        throw new IllegalStateException("Not a list: " + getType());
    }

    /** The boxed scalar value ({@code Boolean}, {@code Long}, {@code BigInteger}, {@code Double}, {@code String}). */
    public Object scalarValue() {
        return null;
    }

    /** String content of a string scalar. */
    public String asText() {
        throw new IllegalStateException("Not a string: " + getType());
    }

    /**
     * Textual form of a scalar as it appears in paths and rendered output.
     */
    public String scalarText() {
        return toString();
    }

    /**
     * Converts the tree to plain Java collections ({@link LinkedHashMap}, {@link ArrayList}, boxed scalars),
     * suitable for YAML dumping or JSON serialization.
     */
    public abstract Object toPlainObject();

    // ==================== Variants ====================

    private static final class NullNode extends YamlNode {

        static final NullNode INSTANCE = new NullNode();

        @Override
        public NodeType getType() {
            return NodeType.NULL;
        }

        @Override
        public Object toPlainObject() {
            return null;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof NullNode;
        }

        @Override
        public int hashCode() {
            return 0;
        }

        @Override
        public String toString() {
            return "<nil>";
        }
    }

    private static final class ScalarNode extends YamlNode {

        static final ScalarNode TRUE = new ScalarNode(NodeType.BOOLEAN, Boolean.TRUE);
        static final ScalarNode FALSE = new ScalarNode(NodeType.BOOLEAN, Boolean.FALSE);

        private final NodeType type;
        private final Object value;

        ScalarNode(NodeType type, Object value) {
            this.type = type;
            this.value = value;
        }

        @Override
        public NodeType getType() {
            return type;
        }

        @Override
        public Object scalarValue() {
            return value;
        }

        @Override
        public String asText() {
            if (type != NodeType.STRING) {
                return super.asText();
            }
            return (String) value;
        }

        @Override
        public String scalarText() {
            if (type == NodeType.FLOAT) {
                return formatFloat((Double) value);
            }
            return String.valueOf(value);
        }

        @Override
        public Object toPlainObject() {
            return value;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof ScalarNode)) return false;
            ScalarNode that = (ScalarNode) o;
            if (type != that.type) return false;
            if (type == NodeType.FLOAT) {
                double a = (Double) value;
                double b = (Double) that.value;
                // 0.0 equals -0.0; NaN equals NaN
                return a == b || (Double.isNaN(a) && Double.isNaN(b));
            }
            return value.equals(that.value);
        }

        @Override
        public int hashCode() {
            if (type == NodeType.FLOAT && (Double) value == 0.0) {
                return Objects.hash(type, 0.0d);
            }
            return Objects.hash(type, value);
        }

        @Override
        public String toString() {
            return scalarText();
        }
    }

    private static final class MapNode extends YamlNode {

        private final OrderedMap map;

        MapNode(OrderedMap map) {
            this.map = map;
        }

        @Override
        public NodeType getType() {
            return NodeType.MAP;
        }

        @Override
        public OrderedMap asMap() {
            return map;
        }

        @Override
        public Object toPlainObject() {
            Map<String, Object> plain = new LinkedHashMap<>();
            for (Map.Entry<String, YamlNode> entry : map.entrySet()) {
                plain.put(entry.getKey(), entry.getValue().toPlainObject());
            }
            return plain;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof MapNode)) return false;
            return map.equals(((MapNode) o).map);
        }

        @Override
        public int hashCode() {
            return map.hashCode();
        }

        @Override
        public String toString() {
            return map.toString();
        }
    }

    private static final class ListNode extends YamlNode {

        private final List<YamlNode> items;

        ListNode(List<YamlNode> items) {
            this.items = items;
        }

        @Override
        public NodeType getType() {
            return NodeType.LIST;
        }

        @Override
        public List<YamlNode> asList() {
            return items;
        }

        @Override
        public Object toPlainObject() {
            List<Object> plain = new ArrayList<>(items.size());
            for (YamlNode item : items) {
                plain.add(item.toPlainObject());
            }
            return plain;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof ListNode)) return false;
            return items.equals(((ListNode) o).items);
        }

        @Override
        public int hashCode() {
            return items.hashCode();
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder("[");
            for (int i = 0; i < items.size(); i++) {
                if (i > 0) {
                    sb.append(' ');
                }
                sb.append(items.get(i));
            }
            return sb.append(']').toString();
        }
    }

    // ==================== Helpers ====================

    /**
     * Shortest round-trip form of a double; exponent notation below 1e-4 and from 1e21 on.
     */
    static String formatFloat(double d) {
        if (Double.isNaN(d)) {
            return "NaN";
        }
        if (Double.isInfinite(d)) {
            return d > 0 ? "+Inf" : "-Inf";
        }
        if (d == 0) {
            return 1 / d < 0 ? "-0" : "0";
        }
        BigDecimal decimal = new BigDecimal(Double.toString(d)).stripTrailingZeros();
        int exponent = decimal.precision() - decimal.scale() - 1;
        if (exponent < -4 || exponent >= 21) {
            String digits = decimal.unscaledValue().abs().toString();
            StringBuilder sb = new StringBuilder();
            if (decimal.signum() < 0) {
                sb.append('-');
            }
            sb.append(digits.charAt(0));
            if (digits.length() > 1) {
                sb.append('.').append(digits, 1, digits.length());
            }
            sb.append('e').append(exponent < 0 ? '-' : '+');
            int abs = Math.abs(exponent);
            if (abs < 10) {
                sb.append('0');
            }
            return sb.append(abs).toString();
        }
        return decimal.toPlainString();
    }
}

package org.yamldiff.core;

import org.yamldiff.domain.YamlNode;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns scalar text into a typed {@link YamlNode}.
 * <p>
 * Plain scalars follow the resolution rules of the widely used Go YAML decoder: only
 * {@code true/false} spellings are booleans ({@code yes}, {@code on} stay strings), integers accept
 * {@code _} separators and {@code 0x}/{@code 0o}/{@code 0b} or leading-zero octal prefixes, timestamps stay
 * strings. Text that does not convert is always kept as a string; nothing here throws.
 */
final class ScalarResolver {

    private static final Set<String> NULLS = new HashSet<>(Arrays.asList("", "~", "null", "Null", "NULL"));
    private static final Set<String> TRUES = new HashSet<>(Arrays.asList("true", "True", "TRUE"));
    private static final Set<String> FALSES = new HashSet<>(Arrays.asList("false", "False", "FALSE"));
    private static final Set<String> POSITIVE_INF = new HashSet<>(Arrays.asList(
            ".inf", ".Inf", ".INF", "+.inf", "+.Inf", "+.INF"));
    private static final Set<String> NEGATIVE_INF = new HashSet<>(Arrays.asList("-.inf", "-.Inf", "-.INF"));
    private static final Set<String> NANS = new HashSet<>(Arrays.asList(".nan", ".NaN", ".NAN"));

    private static final Pattern YAML_FLOAT = Pattern.compile("^[-+]?(\\.[0-9]+|[0-9]+(\\.[0-9]*)?)([eE][-+]?[0-9]+)?$");

    private static final BigInteger LONG_MIN = BigInteger.valueOf(Long.MIN_VALUE);
    private static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);

    private ScalarResolver() {
    }

    /** Resolves an untagged plain scalar. */
    static YamlNode resolvePlain(String text) {
        if (NULLS.contains(text)) {
            return YamlNode.nullNode();
        }
        if (TRUES.contains(text)) {
            return YamlNode.bool(true);
        }
        if (FALSES.contains(text)) {
            return YamlNode.bool(false);
        }
        YamlNode special = specialFloat(text);
        if (special != null) {
            return special;
        }
        char first = text.charAt(0);
        if ((first >= '0' && first <= '9') || first == '+' || first == '-' || first == '.') {
            YamlNode number = resolveNumber(text);
            if (number != null) {
                return number;
            }
        }
        return YamlNode.string(text);
    }

    static YamlNode resolveInteger(String text) {
        BigInteger value = parseInteger(text.replace("_", ""));
        return value == null ? YamlNode.string(text) : YamlNode.integer(value);
    }

    static YamlNode resolveFloat(String text) {
        YamlNode special = specialFloat(text);
        if (special != null) {
            return special;
        }
        YamlNode number = resolveNumber(text);
        if (number == null) {
            return YamlNode.string(text);
        }
        if (number.getType() == YamlNode.NodeType.INTEGER) {
            return YamlNode.floating(((Number) number.scalarValue()).doubleValue());
        }
        return number;
    }

    static YamlNode resolveBoolean(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        if (lower.equals("true") || lower.equals("yes") || lower.equals("on")) {
            return YamlNode.bool(true);
        }
        if (lower.equals("false") || lower.equals("no") || lower.equals("off")) {
            return YamlNode.bool(false);
        }
        return YamlNode.string(text);
    }

    static YamlNode resolveNull(String text) {
        return NULLS.contains(text) ? YamlNode.nullNode() : YamlNode.string(text);
    }

    private static YamlNode specialFloat(String text) {
        if (POSITIVE_INF.contains(text)) {
            return YamlNode.floating(Double.POSITIVE_INFINITY);
        }
        if (NEGATIVE_INF.contains(text)) {
            return YamlNode.floating(Double.NEGATIVE_INFINITY);
        }
        if (NANS.contains(text)) {
            return YamlNode.floating(Double.NaN);
        }
        return null;
    }

    private static YamlNode resolveNumber(String text) {
        String plain = text.replace("_", "");
        BigInteger integer = parseInteger(plain);
        if (integer != null) {
            return YamlNode.integer(integer);
        }
        if (YAML_FLOAT.matcher(plain).matches()) {
            double value = Double.parseDouble(plain);
            // out-of-range literals are not numbers
            if (!Double.isInfinite(value)) {
                return YamlNode.floating(value);
            }
        }
        return null;
    }

    /**
     * Parses a signed 64-bit integer or an unsigned one without sign, with base prefixes.
     *
     * @return the value, or {@code null} when the text is not such an integer
     */
    static BigInteger parseInteger(String s) {
        if (s.isEmpty()) {
            return null;
        }
        int pos = 0;
        boolean negative = false;
        char sign = s.charAt(0);
        if (sign == '+' || sign == '-') {
            negative = sign == '-';
            pos = 1;
        }
        String body = s.substring(pos);
        int radix = 10;
        String digits = body;
        if (body.length() >= 2 && body.charAt(0) == '0') {
            char prefix = Character.toLowerCase(body.charAt(1));
            if (prefix == 'x') {
                radix = 16;
                digits = body.substring(2);
            } else if (prefix == 'o') {
                radix = 8;
                digits = body.substring(2);
            } else if (prefix == 'b') {
                radix = 2;
                digits = body.substring(2);
            } else {
                radix = 8;
                digits = body.substring(1);
            }
        }
        if (digits.isEmpty()) {
            return null;
        }
        for (int i = 0; i < digits.length(); i++) {
            char c = digits.charAt(i);
            if (c > 127 || Character.digit(c, radix) < 0) {
                return null;
            }
        }
        BigInteger value = new BigInteger(digits, radix);
        if (negative) {
            value = value.negate();
        }
        if (value.compareTo(LONG_MIN) >= 0 && value.compareTo(LONG_MAX) <= 0) {
            return value;
        }
        // unsigned 64-bit range is only reachable without an explicit sign
        if (pos == 0 && value.bitLength() <= 64) {
            return value;
        }
        return null;
    }
}

package org.yamldiff.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class YamlNodeTest {

    @Nested
    @DisplayName("Scalars")
    class Scalars {

        @Test
        void integersThatFitIntoLongCompareEqual() {
            assertEquals(YamlNode.integer(42), YamlNode.integer(BigInteger.valueOf(42)));
            assertEquals(42L, YamlNode.integer(BigInteger.valueOf(42)).scalarValue());
        }

        @Test
        void unsignedIntegersStayBig() {
            BigInteger max = new BigInteger("18446744073709551615");
            YamlNode node = YamlNode.integer(max);

            assertEquals(YamlNode.NodeType.INTEGER, node.getType());
            assertEquals(max, node.scalarValue());
            assertEquals("18446744073709551615", node.scalarText());
        }

        @Test
        @DisplayName("Integer and float are different variants")
        void integerIsNotFloat() {
            assertNotEquals(YamlNode.integer(1), YamlNode.floating(1.0));
        }

        @Test
        void nanEqualsNan() {
            assertEquals(YamlNode.floating(Double.NaN), YamlNode.floating(Double.NaN));
        }

        @Test
        @DisplayName("Positive and negative zero are equal with the same hash")
        void signedZerosAreEqual() {
            YamlNode positive = YamlNode.floating(0.0);
            YamlNode negative = YamlNode.floating(-0.0);

            assertEquals(positive, negative);
            assertEquals(positive.hashCode(), negative.hashCode());
            assertNotEquals(YamlNode.floating(0.0), YamlNode.floating(0.5));
        }

        @Test
        void booleansAreShared() {
            assertSame(YamlNode.bool(true), YamlNode.bool(true));
            assertEquals("true", YamlNode.bool(true).toString());
        }

        @Test
        void asTextOnlyForStrings() {
            assertEquals("x", YamlNode.string("x").asText());
            assertThrows(IllegalStateException.class, () -> YamlNode.integer(1).asText());
        }
    }

    @Nested
    @DisplayName("Float text")
    class FloatText {

        @Test
        void wholeNumbersHaveNoFraction() {
            assertEquals("3", YamlNode.formatFloat(3.0));
            assertEquals("-2", YamlNode.formatFloat(-2.0));
        }

        @Test
        void shortestRoundTripForm() {
            assertEquals("1.5", YamlNode.formatFloat(1.5));
            assertEquals("0.1", YamlNode.formatFloat(0.1));
            assertEquals("123456.789", YamlNode.formatFloat(123456.789));
        }

        @Test
        void exponentForVeryLargeAndVerySmall() {
            assertEquals("1e+21", YamlNode.formatFloat(1e21));
            assertEquals("1e-05", YamlNode.formatFloat(0.00001));
            assertEquals("0.0001", YamlNode.formatFloat(0.0001));
            assertEquals("1.5e+300", YamlNode.formatFloat(1.5e300));
        }

        @Test
        void specialValues() {
            assertEquals("+Inf", YamlNode.formatFloat(Double.POSITIVE_INFINITY));
            assertEquals("-Inf", YamlNode.formatFloat(Double.NEGATIVE_INFINITY));
            assertEquals("NaN", YamlNode.formatFloat(Double.NaN));
            assertEquals("0", YamlNode.formatFloat(0.0));
        }
    }

    @Nested
    @DisplayName("Maps and lists")
    class Containers {

        @Test
        void mapEqualityIgnoresKeyOrder() {
            YamlNode first = YamlNode.map(OrderedMap.builder()
                    .put("a", YamlNode.integer(1)).put("b", YamlNode.integer(2)).build());
            YamlNode second = YamlNode.map(OrderedMap.builder()
                    .put("b", YamlNode.integer(2)).put("a", YamlNode.integer(1)).build());

            assertEquals(first, second);
        }

        @Test
        void listEqualityIsPositional() {
            YamlNode first = YamlNode.list(Arrays.asList(YamlNode.string("a"), YamlNode.string("b")));
            YamlNode second = YamlNode.list(Arrays.asList(YamlNode.string("b"), YamlNode.string("a")));

            assertNotEquals(first, second);
            assertEquals("[a b]", first.toString());
        }

        @Test
        void listIsCopiedAndReadOnly() {
            List<YamlNode> items = new java.util.ArrayList<>(Arrays.asList(YamlNode.integer(1), null));
            YamlNode list = YamlNode.list(items);
            items.add(YamlNode.integer(3));

            assertEquals(2, list.asList().size());
            assertTrue(list.asList().get(1).isNull());
            assertThrows(UnsupportedOperationException.class, () -> list.asList().add(YamlNode.integer(4)));
        }

        @Test
        void toPlainObjectKeepsStructure() {
            YamlNode node = YamlNode.map(OrderedMap.builder()
                    .put("name", YamlNode.string("web"))
                    .put("ports", YamlNode.list(Arrays.asList(YamlNode.integer(80), YamlNode.integer(443))))
                    .put("extra", YamlNode.nullNode())
                    .build());

            Map<String, Object> expected = new LinkedHashMap<>();
            expected.put("name", "web");
            expected.put("ports", Arrays.asList(80L, 443L));
            expected.put("extra", null);
            assertEquals(expected, node.toPlainObject());
        }

        @Test
        void nullNodeRendersAsNil() {
            assertEquals("<nil>", YamlNode.nullNode().toString());
            assertSame(YamlNode.nullNode(), YamlNode.orNull(null));
        }
    }
}

package org.yamldiff.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.yamldiff.domain.OrderedMap;
import org.yamldiff.domain.YamlNode;
import org.yamldiff.domain.YamlParseException;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link YamlDocumentParser} covering typing, merge keys, aliases and multi-document streams.
 */
class YamlDocumentParserTest {

    private static List<YamlNode> parse(String yaml) throws YamlParseException {
        return YamlDocumentParser.parse(yaml.getBytes(StandardCharsets.UTF_8));
    }

    private static YamlNode single(String yaml) throws YamlParseException {
        List<YamlNode> documents = parse(yaml);
        assertEquals(1, documents.size());
        return documents.get(0);
    }

    @Nested
    @DisplayName("Documents")
    class Documents {

        @Test
        void emptyStreamYieldsOneNullDocument() throws Exception {
            List<YamlNode> documents = parse("");

            assertEquals(1, documents.size());
            assertTrue(documents.get(0).isNull());
        }

        @Test
        void multipleDocuments() throws Exception {
            List<YamlNode> documents = parse("a: 1\n---\nb: 2\n---\n");

            assertEquals(3, documents.size());
            assertEquals(YamlNode.integer(1), documents.get(0).asMap().get("a"));
            assertEquals(YamlNode.integer(2), documents.get(1).asMap().get("b"));
            assertTrue(documents.get(2).isNull());
        }

        @Test
        void keysKeepSourceOrder() throws Exception {
            OrderedMap map = single("zeta: 1\nalpha: 2\nmid: 3\n").asMap();

            assertEquals(Arrays.asList("zeta", "alpha", "mid"), map.keys());
        }

        @Test
        void utf8BomIsSkipped() throws Exception {
            byte[] bom = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF};
            byte[] body = "name: café\n".getBytes(StandardCharsets.UTF_8);
            byte[] content = new byte[bom.length + body.length];
            System.arraycopy(bom, 0, content, 0, bom.length);
            System.arraycopy(body, 0, content, bom.length, body.length);

            YamlNode document = YamlDocumentParser.parse(content).get(0);

            assertEquals(YamlNode.string("café"), document.asMap().get("name"));
        }
    }

    @Nested
    @DisplayName("Scalars")
    class Scalars {

        @Test
        void plainScalarsAreTyped() throws Exception {
            OrderedMap map = single("i: 10\nf: 2.5\nb: true\nn: ~\ns: hello\ny: yes\nt: 2024-01-15\n").asMap();

            assertEquals(YamlNode.integer(10), map.get("i"));
            assertEquals(YamlNode.floating(2.5), map.get("f"));
            assertEquals(YamlNode.bool(true), map.get("b"));
            assertTrue(map.get("n").isNull());
            assertEquals(YamlNode.string("hello"), map.get("s"));
            assertEquals(YamlNode.string("yes"), map.get("y"));
            assertEquals(YamlNode.string("2024-01-15"), map.get("t"));
        }

        @Test
        void quotedAndBlockScalarsAreStrings() throws Exception {
            OrderedMap map = single("q: \"10\"\nsq: 'true'\nblock: |\n  42\n").asMap();

            assertEquals(YamlNode.string("10"), map.get("q"));
            assertEquals(YamlNode.string("true"), map.get("sq"));
            assertEquals(YamlNode.string("42\n"), map.get("block"));
        }

        @Test
        void explicitTagsForceType() throws Exception {
            OrderedMap map = single("s: !!str 10\ni: !!int \"7\"\nf: !!float 1\nbad: !!int abc\n").asMap();

            assertEquals(YamlNode.string("10"), map.get("s"));
            assertEquals(YamlNode.integer(7), map.get("i"));
            assertEquals(YamlNode.floating(1.0), map.get("f"));
            assertEquals(YamlNode.string("abc"), map.get("bad"));
        }

        @Test
        void emptyValueIsNull() throws Exception {
            assertTrue(single("key:\n").asMap().get("key").isNull());
        }
    }

    @Nested
    @DisplayName("Merge keys and aliases")
    class MergeAndAliases {

        @Test
        @DisplayName("Explicit keys win over merged ones")
        void mergeKeyDoesNotOverrideExplicitKeys() throws Exception {
            String yaml = "base: &base\n  a: 1\n  b: 2\nchild:\n  b: 20\n  <<: *base\n  c: 3\n";

            OrderedMap child = single(yaml).asMap().get("child").asMap();

            assertEquals(YamlNode.integer(1), child.get("a"));
            assertEquals(YamlNode.integer(20), child.get("b"));
            assertEquals(YamlNode.integer(3), child.get("c"));
            assertFalse(child.containsKey("<<"));
        }

        @Test
        void mergeListOfMaps() throws Exception {
            String yaml = "one: &one\n  a: 1\ntwo: &two\n  a: 2\n  b: 2\nchild:\n  <<: [*one, *two]\n";

            OrderedMap child = single(yaml).asMap().get("child").asMap();

            assertEquals(YamlNode.integer(1), child.get("a"));
            assertEquals(YamlNode.integer(2), child.get("b"));
        }

        @Test
        void quotedMergeKeyAlsoMerges() throws Exception {
            OrderedMap map = single("base: &b {x: 1}\nchild:\n  \"<<\": *b\n  y: 2\n").asMap().get("child").asMap();

            assertEquals(Arrays.asList("x", "y"), map.keys());
            assertEquals(YamlNode.integer(1), map.get("x"));
            assertFalse(map.containsKey("<<"));
        }

        @Test
        void mergeKeyWithScalarValueContributesNothing() throws Exception {
            OrderedMap map = single("\"<<\": value\na: 1\n").asMap();

            assertEquals(List.of("a"), map.keys());
        }

        @Test
        void aliasResolvesToTarget() throws Exception {
            OrderedMap map = single("anchor: &x [1, 2]\ncopy: *x\n").asMap();

            assertEquals(map.get("anchor"), map.get("copy"));
        }

        @Test
        @DisplayName("A self-referencing alias is broken with null")
        void recursiveAliasBecomesNull() throws Exception {
            OrderedMap map = single("a: &x\n  b: *x\n  c: 1\n").asMap();

            OrderedMap a = map.get("a").asMap();
            assertTrue(a.get("b").isNull());
            assertEquals(YamlNode.integer(1), a.get("c"));
        }

        @Test
        void complexKeyUsesItsText() throws Exception {
            OrderedMap map = single("? [a, b]\n: value\n").asMap();

            assertEquals(YamlNode.string("value"), map.get("[a b]"));
        }
    }

    @Nested
    @DisplayName("Errors")
    class Errors {

        @Test
        void malformedYamlReportsLine() {
            YamlParseException e = assertThrows(YamlParseException.class, () -> parse("a: 1\nb: [1, 2\nc: 3\n"));

            assertTrue(e.getLine() > 0);
            assertTrue(e.getMessage().startsWith("yaml: line "), e.getMessage());
            assertNotNull(e.getProblem());
        }

        @Test
        void undefinedAliasIsAnError() {
            assertThrows(YamlParseException.class, () -> parse("a: *missing\n"));
        }
    }
}

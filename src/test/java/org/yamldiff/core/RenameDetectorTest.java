package org.yamldiff.core;

import org.junit.jupiter.api.Test;
import org.yamldiff.domain.YamlNode;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RenameDetectorTest {

    private static final String DATA = "data:\n  a: \"1\"\n  b: \"2\"\n  c: \"3\"\n  d: \"4\"\n  e: \"5\"\n  f: \"6\"\n";

    private static List<YamlNode> docs(String yaml) throws Exception {
        return YamlDocumentParser.parse(yaml.getBytes(StandardCharsets.UTF_8));
    }

    private static String configMap(String name, String body) {
        return "apiVersion: v1\nkind: ConfigMap\nmetadata:\n  name: " + name + "\n" + body;
    }

    @Test
    void similarityCountsSharedLines() {
        assertEquals(100, RenameDetector.similarity("a\nb\nc\n", "c\nb\na\n"));
        assertEquals(66, RenameDetector.similarity("a\nb\nc\n", "a\nb\nd\n"));
        assertEquals(0, RenameDetector.similarity("", ""));
        assertEquals(100, RenameDetector.similarity("a\n\n  \nb", "a\nb\n"));
    }

    @Test
    void pairsSimilarResources() throws Exception {
        List<YamlNode> from = docs(configMap("old", DATA));
        List<YamlNode> to = docs(configMap("new", DATA));

        Map<Integer, Integer> renamed = RenameDetector.detect(from, to,
                Collections.singletonList(0), Collections.singletonList(0));

        assertEquals(Collections.singletonMap(0, 0), renamed);
    }

    @Test
    void prefersTheBestScore() throws Exception {
        String other = "data:\n  a: \"1\"\n  b: \"2\"\n  c: \"3\"\n  d: \"4\"\n  e: \"x\"\n  f: \"y\"\n";
        List<YamlNode> from = docs(configMap("old", DATA));
        List<YamlNode> to = docs(configMap("near", other) + "---\n" + configMap("exact", DATA));

        Map<Integer, Integer> renamed = RenameDetector.detect(from, to,
                Collections.singletonList(0), Arrays.asList(0, 1));

        assertEquals(Integer.valueOf(1), renamed.get(0));
    }

    @Test
    void dissimilarResourcesStayUnpaired() throws Exception {
        List<YamlNode> from = docs(configMap("old", DATA));
        List<YamlNode> to = docs("apiVersion: v1\nkind: Service\nmetadata:\n  name: svc\nspec:\n  type: ClusterIP\n");

        assertTrue(RenameDetector.detect(from, to, Collections.singletonList(0), Collections.singletonList(0)).isEmpty());
    }

    @Test
    void nonResourcesAreNotCandidates() throws Exception {
        List<YamlNode> from = docs("plain: 1\n");
        List<YamlNode> to = docs("plain: 1\n");

        assertTrue(RenameDetector.detect(from, to, Collections.singletonList(0), Collections.singletonList(0)).isEmpty());
    }
}

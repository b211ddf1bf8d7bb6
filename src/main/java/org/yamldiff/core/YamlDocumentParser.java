package org.yamldiff.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yamldiff.domain.OrderedMap;
import org.yamldiff.domain.YamlNode;
import org.yamldiff.domain.YamlParseException;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.Mark;
import org.yaml.snakeyaml.error.MarkedYAMLException;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.nodes.MappingNode;
import org.yaml.snakeyaml.nodes.Node;
import org.yaml.snakeyaml.nodes.NodeId;
import org.yaml.snakeyaml.nodes.NodeTuple;
import org.yaml.snakeyaml.nodes.ScalarNode;
import org.yaml.snakeyaml.nodes.SequenceNode;
import org.yaml.snakeyaml.nodes.Tag;
import org.yaml.snakeyaml.reader.UnicodeReader;
import org.yaml.snakeyaml.representer.Representer;
import org.yaml.snakeyaml.resolver.Resolver;

import java.io.ByteArrayInputStream;
import java.io.Reader;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Decodes a YAML byte stream into one {@link YamlNode} tree per document.
 * <p>
 * SnakeYAML composes the node graph (anchors already linked to their targets); this class then walks it,
 * keeping mapping key order, expanding {@code <<} merge keys and typing scalars through {@link ScalarResolver}.
 * An alias that points back to a node still being decoded yields null instead of recursing.
 * <p>
 * Stateless and safe for concurrent use: every call builds its own SnakeYAML instance.
 */
public final class YamlDocumentParser {

    private static final Logger logger = LoggerFactory.getLogger(YamlDocumentParser.class);

    static final String MERGE_KEY = "<<";

    /** Tag given to untagged plain scalars so that typing happens here rather than in SnakeYAML. */
    private static final Tag PLAIN = new Tag("tag:yamldiff:plain");

    private static final int MAX_ALIASES_FOR_COLLECTIONS = 1000;
    private static final int CODE_POINT_LIMIT = 64 * 1024 * 1024;

    private YamlDocumentParser() {
    }

    /**
     * @param content raw YAML, UTF-8/UTF-16 with or without BOM
     * @return one node per document; an empty stream yields a single null document
     * @throws YamlParseException when the input is not well-formed YAML
     */
    public static List<YamlNode> parse(byte[] content) throws YamlParseException {
        List<YamlNode> documents = new ArrayList<>();
        try (Reader reader = new UnicodeReader(new ByteArrayInputStream(content))) {
            for (Node root : newYaml().composeAll(reader)) {
                documents.add(decode(root, Collections.newSetFromMap(new IdentityHashMap<>())));
            }
        } catch (MarkedYAMLException e) {
            Mark mark = e.getProblemMark() != null ? e.getProblemMark() : e.getContextMark();
            String problem = e.getProblem() != null ? e.getProblem() : e.getMessage();
            if (mark != null) {
                throw new YamlParseException(mark.getLine() + 1, mark.getColumn() + 1, problem, e);
            }
            throw new YamlParseException(0, 0, problem, e);
        } catch (YAMLException e) {
            throw new YamlParseException(0, 0, e.getMessage(), e);
        } catch (java.io.IOException e) {
            // a byte array reader never fails to close
            throw new IllegalStateException(e);
        }

        if (documents.isEmpty()) {
            documents.add(YamlNode.nullNode());
        }
        logger.debug("Parsed {} document(s) from {} bytes", documents.size(), content.length);
        return documents;
    }

    private static Yaml newYaml() {
        LoaderOptions loaderOptions = new LoaderOptions();
        loaderOptions.setMaxAliasesForCollections(MAX_ALIASES_FOR_COLLECTIONS);
        loaderOptions.setCodePointLimit(CODE_POINT_LIMIT);
        DumperOptions dumperOptions = new DumperOptions();
        return new Yaml(new SafeConstructor(loaderOptions), new Representer(dumperOptions),
                dumperOptions, loaderOptions, new PlainScalarResolver());
    }

    /**
     * @param resolving nodes on the current decoding path, compared by identity
     */
    private static YamlNode decode(Node node, Set<Node> resolving) {
        if (node == null) {
            return YamlNode.nullNode();
        }
        if (!resolving.add(node)) {
            logger.debug("Breaking recursive alias at line {}", node.getStartMark() != null ? node.getStartMark().getLine() + 1 : 0);
            return YamlNode.nullNode();
        }
        try {
            NodeId id = node.getNodeId();
            if (id == NodeId.mapping) {
                return decodeMapping((MappingNode) node, resolving);
            }
            if (id == NodeId.sequence) {
                SequenceNode sequence = (SequenceNode) node;
                List<YamlNode> items = new ArrayList<>(sequence.getValue().size());
                for (Node child : sequence.getValue()) {
                    items.add(decode(child, resolving));
                }
                return YamlNode.list(items);
            }
            if (id == NodeId.scalar) {
                return decodeScalar((ScalarNode) node);
            }
            return YamlNode.nullNode();
        } finally {
            resolving.remove(node);
        }
    }

    private static YamlNode decodeMapping(MappingNode mapping, Set<Node> resolving) {
        OrderedMap.Builder builder = OrderedMap.builder();
        for (NodeTuple tuple : mapping.getValue()) {
            if (isMergeKey(tuple.getKeyNode())) {
                merge(builder, decode(tuple.getValueNode(), resolving));
                continue;
            }
            builder.put(keyText(tuple.getKeyNode(), resolving), decode(tuple.getValueNode(), resolving));
        }
        return YamlNode.map(builder.build());
    }

    /** Merge sources are a map or a list of maps; anything else contributes nothing. */
    private static void merge(OrderedMap.Builder builder, YamlNode source) {
        if (source.isMap()) {
            for (String key : source.asMap().keys()) {
                builder.putIfAbsent(key, source.asMap().get(key));
            }
        } else if (source.isList()) {
            for (YamlNode item : source.asList()) {
                if (item.isMap()) {
                    merge(builder, item);
                }
            }
        }
    }

    /** Any scalar key whose text is {@code <<} is a merge key, whatever its style or tag. */
    private static boolean isMergeKey(Node keyNode) {
        return keyNode instanceof ScalarNode && MERGE_KEY.equals(((ScalarNode) keyNode).getValue());
    }

    private static String keyText(Node keyNode, Set<Node> resolving) {
        if (keyNode instanceof ScalarNode) {
            return ((ScalarNode) keyNode).getValue();
        }
        return decode(keyNode, resolving).toString();
    }

    private static YamlNode decodeScalar(ScalarNode scalar) {
        String text = scalar.getValue();
        Tag tag = scalar.getTag();
        if (PLAIN.equals(tag)) {
            return ScalarResolver.resolvePlain(text);
        }
        if (Tag.INT.equals(tag)) {
            return ScalarResolver.resolveInteger(text);
        }
        if (Tag.FLOAT.equals(tag)) {
            return ScalarResolver.resolveFloat(text);
        }
        if (Tag.BOOL.equals(tag)) {
            return ScalarResolver.resolveBoolean(text);
        }
        if (Tag.NULL.equals(tag)) {
            return ScalarResolver.resolveNull(text);
        }
        // !!str, quoted scalars, and any other tag keep their literal text
        return YamlNode.string(text);
    }

    /**
     * Leaves plain scalars untyped; everything else resolves as SnakeYAML does.
     */
    private static final class PlainScalarResolver extends Resolver {

        @Override
        public Tag resolve(NodeId kind, String value, boolean implicit) {
            if (kind == NodeId.scalar && implicit) {
                return PLAIN;
            }
            return super.resolve(kind, value, implicit);
        }
    }
}

package org.yamldiff;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yamldiff.core.ChrootResolver;
import org.yamldiff.core.DiffOrderer;
import org.yamldiff.core.StructuralComparator;
import org.yamldiff.core.YamlDocumentParser;
import org.yamldiff.domain.CompareOptions;
import org.yamldiff.domain.Difference;
import org.yamldiff.domain.YamlDiffException;
import org.yamldiff.domain.YamlNode;

import java.util.List;

/**
 * Semantic comparison of two YAML byte streams.
 * <p>
 * Pure and thread-safe: both inputs are parsed per call and never shared between calls.
 */
public final class YamlDiff {

    private static final Logger logger = LoggerFactory.getLogger(YamlDiff.class);

    private YamlDiff() {
    }

    /**
     * Parses both inputs, applies swap and chroot, compares document by document and returns the
     * differences in reading order.
     *
     * @param options comparison options, {@code null} for {@link CompareOptions#defaults()}
     * @throws org.yamldiff.domain.YamlParseException when either input is not valid YAML
     * @throws org.yamldiff.domain.ChrootException when a chroot path does not resolve
     */
    public static List<Difference> compare(byte[] from, byte[] to, CompareOptions options) throws YamlDiffException {
        CompareOptions opts = options == null ? CompareOptions.defaults() : options;

        List<YamlNode> fromDocuments = YamlDocumentParser.parse(from);
        List<YamlNode> toDocuments = YamlDocumentParser.parse(to);

        if (opts.isSwap()) {
            List<YamlNode> swapped = fromDocuments;
            fromDocuments = toDocuments;
            toDocuments = swapped;
        }

        if (opts.getChroot() != null) {
            fromDocuments = ChrootResolver.apply(fromDocuments, opts.getChroot(), opts.isChrootListToDocuments());
            toDocuments = ChrootResolver.apply(toDocuments, opts.getChroot(), opts.isChrootListToDocuments());
        } else {
            fromDocuments = ChrootResolver.apply(fromDocuments, opts.getChrootFrom(), opts.isChrootListToDocuments());
            toDocuments = ChrootResolver.apply(toDocuments, opts.getChrootTo(), opts.isChrootListToDocuments());
        }

        List<Difference> diffs = new StructuralComparator(opts).compareDocuments(fromDocuments, toDocuments);
        List<Difference> ordered = DiffOrderer.order(diffs, fromDocuments, toDocuments, opts);
        logger.debug("Compared {} -> {} document(s): {} difference(s)",
                fromDocuments.size(), toDocuments.size(), ordered.size());
        return ordered;
    }
}

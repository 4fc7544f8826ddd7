package com.yongkangl.newick.io;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Parses Newick text (NHX comments included) into a tree whose shape is defined by a
 * {@link NodeAggregator}. Distances and comments are read by the injected
 * {@link DistanceParser} and {@link FeatureParser}.
 *
 * <pre>
 * NewickTreeParser&lt;Object, OptionalDouble, String&gt; parser = NewickTreeParser.withDefaults(
 *         (label, children, distance, features) -&gt; children.isEmpty() ? label : children);
 * parser.parseTree("(A,(B,C));"); // [A, [B, C]]
 * </pre>
 *
 * Instances hold no parse state and may be shared between threads.
 */
public class NewickTreeParser<T, D, F> {
    private static final Logger logger = LoggerFactory.getLogger(NewickTreeParser.class);

    public static final char TERMINATOR = ';';
    public static final int DEFAULT_MAX_DEPTH = 1000;

    private final NodeAggregator<T, D, F> aggregator;
    private final DistanceParser<D> distanceParser;
    private final FeatureParser<F> featureParser;
    private final int maxDepth;

    public NewickTreeParser(NodeAggregator<T, D, F> aggregator,
                            DistanceParser<D> distanceParser,
                            FeatureParser<F> featureParser) {
        this(aggregator, distanceParser, featureParser, DEFAULT_MAX_DEPTH);
    }

    public NewickTreeParser(NodeAggregator<T, D, F> aggregator,
                            DistanceParser<D> distanceParser,
                            FeatureParser<F> featureParser,
                            int maxDepth) {
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("Maximum depth must be positive.");
        }
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator");
        this.distanceParser = Objects.requireNonNull(distanceParser, "distanceParser");
        this.featureParser = Objects.requireNonNull(featureParser, "featureParser");
        this.maxDepth = maxDepth;
    }

    public static <T> NewickTreeParser<T, OptionalDouble, String> withDefaults(
            NodeAggregator<T, OptionalDouble, String> aggregator) {
        return new NewickTreeParser<>(aggregator, DistanceParser.simple(), FeatureParser.identity());
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    /**
     * Parses a complete tree, which must end with ';'.
     *
     * @throws NewickFormatException if the terminator is missing or the text is malformed
     */
    public T parseTree(String newick) {
        if (newick.isEmpty() || newick.charAt(newick.length() - 1) != TERMINATOR) {
            throw new NewickFormatException("Tree in Newick format must end with '" + TERMINATOR + "'");
        }
        logger.debug("Parsing tree of {} characters", newick.length());
        return parseFragment(newick.substring(0, newick.length() - 1));
    }

    /**
     * Parses a single node and its descendants, without the ';' terminator.
     */
    public T parseFragment(String newick) {
        return parseNode(newick, 0);
    }

    private T parseNode(String newick, int depth) {
        if (depth >= maxDepth) {
            throw new NewickFormatException("Tree nesting exceeds the maximum depth of " + maxDepth);
        }
        NodeFields fields = NodeFieldExtractor.extract(StringUtils.strip(newick));

        List<T> children = new ArrayList<>();
        for (String child : SiblingSplitter.split(fields.getChildren())) {
            children.add(parseNode(child, depth + 1));
        }

        D distance = distanceParser.parse(fields.getDistance());
        F feature = featureParser.parse(fields.getComment());
        return aggregator.aggregate(fields.getLabel(), children, distance, feature);
    }
}

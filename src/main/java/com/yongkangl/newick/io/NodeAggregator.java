package com.yongkangl.newick.io;

import java.util.List;

/**
 * Folds a parsed node into the caller's tree representation.
 * Called once per node, after all of its children have been aggregated.
 *
 * @param <T> tree value
 * @param <D> distance value
 * @param <F> feature value
 */
@FunctionalInterface
public interface NodeAggregator<T, D, F> {
    T aggregate(String label, List<T> children, D distance, F feature);
}

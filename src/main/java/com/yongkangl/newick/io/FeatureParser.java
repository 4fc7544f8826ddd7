package com.yongkangl.newick.io;

/**
 * Turns a node's comment, brackets already removed, into a feature value.
 * Receives an empty string when the node has no comment.
 */
@FunctionalInterface
public interface FeatureParser<F> {
    F parse(String comment);

    static FeatureParser<String> identity() {
        return comment -> comment;
    }
}

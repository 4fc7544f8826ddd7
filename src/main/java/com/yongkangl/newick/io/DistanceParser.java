package com.yongkangl.newick.io;

import java.util.OptionalDouble;

/**
 * Turns the text after a node's ':' into a distance value.
 * An empty string means the node has no distance.
 */
@FunctionalInterface
public interface DistanceParser<D> {
    D parse(String distance);

    /**
     * Empty text gives {@link OptionalDouble#empty()}, anything else must be a decimal number.
     *
     * @throws NumberFormatException for non-numeric text
     */
    static DistanceParser<OptionalDouble> simple() {
        return new DecimalDistanceParser();
    }
}

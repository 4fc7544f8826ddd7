package com.yongkangl.newick.io;

import java.util.OptionalDouble;
import java.util.regex.Pattern;

/**
 * Reads plain decimal branch lengths such as '1', '-0.5', '.25' or '1e-3'.
 * Java literal forms ('1f', '2d', '0x1p3') are rejected.
 */
class DecimalDistanceParser implements DistanceParser<OptionalDouble> {
    private static final Pattern DECIMAL =
            Pattern.compile("\\s*[+-]?((\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?|NaN|Infinity)\\s*");

    @Override
    public OptionalDouble parse(String distance) {
        if (distance.isEmpty()) {
            return OptionalDouble.empty();
        }
        if (!DECIMAL.matcher(distance).matches()) {
            throw new NumberFormatException("Not a decimal branch length: \"" + distance + "\"");
        }
        return OptionalDouble.of(Double.parseDouble(distance));
    }
}

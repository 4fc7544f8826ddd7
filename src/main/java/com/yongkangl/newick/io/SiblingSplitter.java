package com.yongkangl.newick.io;

import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;

public final class SiblingSplitter {

    private SiblingSplitter() {
    }

    /**
     * From a comma separated list of Newick nodes, returns the final position of the first one.
     * Examples:
     *   '(A:1,(C[x],D))name:1.[c], (X,Y),,[xxx]' -> 23
     *   '(X,Y),,[xxx]' -> 4
     *   '[xxx]' -> 4
     */
    public static int nextNodeEnd(String nodes) {
        nodes = StringUtils.strip(nodes);

        int current = 0;
        if (nodes.startsWith("(")) {
            current = DelimiterScanner.findClosingParenthesis(nodes, 1);
        }

        // Label, distance and comment run up to the next comma outside any parentheses or brackets
        while (current < nodes.length()) {
            char c = nodes.charAt(current);
            DelimiterPair pair = DelimiterPair.forOpening(c);
            if (pair != null) {
                current = DelimiterScanner.findClosing(nodes, current + 1, pair);
                continue;
            }
            if (c == ',') {
                return current - 1;
            }
            current++;
        }
        return nodes.length() - 1;
    }

    /**
     * Separates the nodes of a comma separated list. Empty slots are kept as empty strings.
     * Example: '(a,b), , :12, c[xxx]' -> ['(a,b)', '', ':12', 'c[xxx]']
     */
    public static List<String> split(String nodes) {
        List<String> result = new ArrayList<>();
        int trailingEmpty = 0;
        String rest = StringUtils.strip(nodes);

        while (!rest.isEmpty()) {
            if (rest.equals(",")) {
                result.add("");
                result.add("");
                break;
            }
            if (rest.startsWith(",")) {
                result.add("");
                rest = StringUtils.strip(rest.substring(1));
                continue;
            }
            if (rest.endsWith(",")) {
                trailingEmpty++;
                rest = StringUtils.strip(rest.substring(0, rest.length() - 1));
                continue;
            }

            int end = nextNodeEnd(rest);
            result.add(rest.substring(0, end + 1));
            rest = StringUtils.stripStart(rest.substring(end + 1), null);
            if (rest.startsWith(",")) {
                rest = rest.substring(1);
            }
            rest = StringUtils.strip(rest);
        }

        for (int i = 0; i < trailingEmpty; i++) {
            result.add("");
        }
        return result;
    }
}

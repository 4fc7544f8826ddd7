package com.yongkangl.newick.io;

import org.apache.commons.lang3.StringUtils;

public final class NodeFieldExtractor {

    private NodeFieldExtractor() {
    }

    /**
     * Splits one trimmed node into its children block, label, distance and comment.
     * The node must not carry its siblings or the ';' terminator.
     */
    public static NodeFields extract(String node) {
        String children = "";
        String rest = node;
        if (node.startsWith("(")) {
            int childrenEnd = DelimiterScanner.findClosingParenthesis(node, 1);
            children = node.substring(1, childrenEnd);
            rest = node.substring(childrenEnd + 1);
        }

        // Comments sit at the end; the last character is taken to be the closing ']'
        String comment = "";
        int commentStart = rest.indexOf('[');
        if (commentStart >= 0) {
            comment = StringUtils.substring(rest, commentStart + 1, -1);
            rest = rest.substring(0, commentStart);
        }

        String label = rest;
        String distance = "";
        int colon = rest.indexOf(':');
        if (colon >= 0) {
            label = rest.substring(0, colon);
            distance = rest.substring(colon + 1);
        }

        return new NodeFields(children, StringUtils.strip(label), distance, comment);
    }
}

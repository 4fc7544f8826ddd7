package com.yongkangl.newick.io;

public enum DelimiterPair {
    PARENTHESES('(', ')'),
    BRACKETS('[', ']');

    private final char opening;
    private final char closing;

    DelimiterPair(char opening, char closing) {
        this.opening = opening;
        this.closing = closing;
    }

    public char getOpening() {
        return opening;
    }

    public char getClosing() {
        return closing;
    }

    /**
     * Returns the pair opened by the given character, or null if it opens none.
     */
    public static DelimiterPair forOpening(char c) {
        for (DelimiterPair pair : values()) {
            if (pair.opening == c) {
                return pair;
            }
        }
        return null;
    }
}

package com.yongkangl.newick.io;

public class UnbalancedDelimiterException extends NewickFormatException {
    private final DelimiterPair pair;
    private final int start;

    public UnbalancedDelimiterException(String text, int start, DelimiterPair pair) {
        super("Missing '" + pair.getClosing() + "' to close '" + pair.getOpening() + "' in: " + text);
        this.pair = pair;
        this.start = start;
    }

    public DelimiterPair getPair() {
        return pair;
    }

    /**
     * Position just past the opening delimiter that was never closed.
     */
    public int getStart() {
        return start;
    }
}

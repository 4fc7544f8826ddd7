package com.yongkangl.newick.io;

public final class DelimiterScanner {

    private DelimiterScanner() {
    }

    /**
     * Finds the closing delimiter that balances an already opened region.
     * Example: '((),())()' from start 1 -> 6
     *
     * @param text  the text to scan
     * @param start position just past the opening delimiter
     * @param pair  the delimiter pair to balance
     * @return index of the balancing closer
     * @throws UnbalancedDelimiterException if the region is never closed
     */
    public static int findClosing(String text, int start, DelimiterPair pair) {
        char opening = pair.getOpening();
        char closing = pair.getClosing();
        int depth = 0; // nested pairs opened since start
        int position = start;
        while (true) {
            int nextClosing = text.indexOf(closing, position);
            if (nextClosing < 0) {
                throw new UnbalancedDelimiterException(text, start, pair);
            }
            int nextOpening = text.indexOf(opening, position);
            if (nextOpening < 0 || nextClosing < nextOpening) {
                if (depth == 0) {
                    return nextClosing;
                }
                depth--;
                position = nextClosing + 1;
            } else {
                depth++;
                position = nextOpening + 1;
            }
        }
    }

    public static int findClosingParenthesis(String text, int start) {
        return findClosing(text, start, DelimiterPair.PARENTHESES);
    }
}

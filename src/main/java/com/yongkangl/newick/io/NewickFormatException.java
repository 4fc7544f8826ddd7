package com.yongkangl.newick.io;

/**
 * Thrown when text cannot be read as a Newick tree.
 */
public class NewickFormatException extends IllegalArgumentException {

    public NewickFormatException(String message) {
        super(message);
    }
}

package com.yongkangl.newick.io;

import java.util.Objects;

/**
 * The raw parts of a single Newick node: children block, label, distance and comment.
 * Example: '(A,B)root:10.0[x=xx]' -> 'A,B', 'root', '10.0', 'x=xx'
 */
public final class NodeFields {
    private final String children;
    private final String label;
    private final String distance;
    private final String comment;

    public NodeFields(String children, String label, String distance, String comment) {
        this.children = children;
        this.label = label;
        this.distance = distance;
        this.comment = comment;
    }

    /**
     * Text strictly between the node's outer parentheses, empty for a tip.
     */
    public String getChildren() {
        return children;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Branch length text without the leading ':'.
     */
    public String getDistance() {
        return distance;
    }

    /**
     * Comment text without the surrounding brackets.
     */
    public String getComment() {
        return comment;
    }

    public boolean hasChildren() {
        return !children.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NodeFields)) return false;
        NodeFields that = (NodeFields) o;
        return children.equals(that.children)
                && label.equals(that.label)
                && distance.equals(that.distance)
                && comment.equals(that.comment);
    }

    @Override
    public int hashCode() {
        return Objects.hash(children, label, distance, comment);
    }

    @Override
    public String toString() {
        return "NodeFields{children='" + children + "', label='" + label
                + "', distance='" + distance + "', comment='" + comment + "'}";
    }
}

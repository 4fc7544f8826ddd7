package com.yongkangl.newick.io;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.OptionalDouble;

public class TreeNode {
    private final String tipName;
    private final OptionalDouble branchLength;
    private final String features;
    private TreeNode parent;
    private final List<TreeNode> children;

    public TreeNode(String tipName, List<TreeNode> children, OptionalDouble branchLength, String features) {
        this.tipName = tipName;
        this.children = new ArrayList<>(children);
        this.branchLength = branchLength;
        this.features = features;
        for (TreeNode child : this.children) {
            child.parent = this;
        }
    }

    /**
     * Builds {@link TreeNode}s with the default distance and feature parsers.
     */
    public static NodeAggregator<TreeNode, OptionalDouble, String> aggregator() {
        return TreeNode::new;
    }

    public static TreeNode parse(String newick) {
        return NewickTreeParser.withDefaults(aggregator()).parseTree(newick);
    }

    public String getTipName() {
        return tipName;
    }

    public OptionalDouble getBranchLength() {
        return branchLength;
    }

    public String getFeatures() {
        return features;
    }

    public TreeNode getParent() {
        return parent;
    }

    public List<TreeNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public int getChildCount() {
        return children.size();
    }

    public TreeNode getChild(int i) {
        return children.get(i);
    }

    public boolean isTip() {
        return children.isEmpty();
    }

    public boolean isRoot() {
        return parent == null;
    }

    public String constructNewick() {
        return this + ";";
    }

    /**
     * One line per node, 'name distance features', indented by one space per level.
     */
    public String print() {
        StringBuilder sb = new StringBuilder();
        print(sb, 0);
        return sb.toString();
    }

    private void print(StringBuilder sb, int depth) {
        sb.append(" ".repeat(depth)).append(tipName).append(' ');
        if (branchLength.isPresent()) {
            sb.append(branchLength.getAsDouble());
        }
        sb.append(' ').append(features).append('\n');
        for (TreeNode child : children) {
            child.print(sb, depth + 1);
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (!children.isEmpty()) {
            sb.append("(");
            for (int i = 0; i < children.size(); i++) {
                if (i > 0) sb.append(",");
                sb.append(children.get(i).toString());
            }
            sb.append(")");
        }
        sb.append(tipName);
        if (branchLength.isPresent()) {
            sb.append(":").append(branchLength.getAsDouble());
        }
        if (!features.isEmpty()) {
            sb.append("[").append(features).append("]");
        }
        return sb.toString();
    }
}

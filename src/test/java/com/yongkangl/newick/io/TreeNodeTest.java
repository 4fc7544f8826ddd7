package com.yongkangl.newick.io;

import static org.junit.jupiter.api.Assertions.*;

import java.util.OptionalDouble;
import org.junit.jupiter.api.Test;

public class TreeNodeTest {

    @Test
    void parse_linksParents() {
        TreeNode root = TreeNode.parse("((A,B)C,D)E;");
        assertTrue(root.isRoot());
        assertEquals("E", root.getTipName());
        TreeNode c = root.getChild(0);
        assertSame(root, c.getParent());
        assertSame(c, c.getChild(1).getParent());
        assertEquals("B", c.getChild(1).getTipName());
        assertTrue(root.getChild(1).isTip());
    }

    @Test
    void toString_writesNewick() {
        TreeNode root = TreeNode.parse("(A:1.0,B:2.5)root;");
        assertEquals("(A:1.0,B:2.5)root", root.toString());
        assertEquals("(A:1.0,B:2.5)root;", root.constructNewick());
    }

    @Test
    void toString_keepsComments() {
        assertEquals("A[&&NHX:S=human]", TreeNode.parse("A[&&NHX:S=human];").toString());
        assertEquals("((A,B)x:0.5[c],)", TreeNode.parse("((A,B)x:0.5[c],);").toString());
    }

    @Test
    void print_indentsByDepth() {
        TreeNode root = TreeNode.parse("(A:1,(B,C)D:2[x])R;");
        String expected = "R  \n"
                + " A 1.0 \n"
                + " D 2.0 x\n"
                + "  B  \n"
                + "  C  \n";
        assertEquals(expected, root.print());
    }

    @Test
    void children_areReadOnly() {
        TreeNode root = TreeNode.parse("(A,B);");
        assertThrows(UnsupportedOperationException.class, () -> root.getChildren().remove(0));
        assertEquals(OptionalDouble.empty(), root.getBranchLength());
    }
}

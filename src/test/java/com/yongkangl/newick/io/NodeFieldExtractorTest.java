package com.yongkangl.newick.io;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

public class NodeFieldExtractorTest {

    @Test
    void extract_allFields() {
        assertEquals(new NodeFields("A,B", "root", "10.0", "x=xx"),
                NodeFieldExtractor.extract("(A,B)root:10.0[x=xx]"));
    }

    @Test
    void extract_tipHasNoChildren() {
        NodeFields fields = NodeFieldExtractor.extract("A");
        assertEquals(new NodeFields("", "A", "", ""), fields);
        assertFalse(fields.hasChildren());
    }

    @Test
    void extract_labelIsTrimmedButDistanceIsNot() {
        assertEquals(new NodeFields("", "A", "1 ", ""), NodeFieldExtractor.extract("A :1 "));
    }

    @Test
    void extract_distanceOnly() {
        assertEquals(new NodeFields("", "", "12", ""), NodeFieldExtractor.extract(":12"));
    }

    @Test
    void extract_commentOnly() {
        assertEquals(new NodeFields("", "c", "", "xxx"), NodeFieldExtractor.extract("c[xxx]"));
        assertEquals(new NodeFields("", "", "", "xxx"), NodeFieldExtractor.extract("[xxx]"));
    }

    @Test
    void extract_nestedChildrenBlock() {
        NodeFields fields = NodeFieldExtractor.extract("(A:1,(B,C)x:2):0.5");
        assertEquals("A:1,(B,C)x:2", fields.getChildren());
        assertEquals("", fields.getLabel());
        assertEquals("0.5", fields.getDistance());
        assertTrue(fields.hasChildren());
    }

    @Test
    void extract_colonsInsideCommentStayInComment() {
        assertEquals(new NodeFields("", "A", "", "&&NHX:conf=0.01:name=A"),
                NodeFieldExtractor.extract("A[&&NHX:conf=0.01:name=A]"));
        assertEquals(new NodeFields("", "A", "1", "a:b"), NodeFieldExtractor.extract("A:1[a:b]"));
    }

    @Test
    void extract_commentDropsLastCharacter() {
        assertEquals("", NodeFieldExtractor.extract("A[").getComment());
        assertEquals("", NodeFieldExtractor.extract("A[]").getComment());
        assertEquals("x]", NodeFieldExtractor.extract("A[x]y").getComment());
    }

    @Test
    void extract_unbalancedChildren() {
        assertThrows(UnbalancedDelimiterException.class, () -> NodeFieldExtractor.extract("(A,(B)"));
    }
}

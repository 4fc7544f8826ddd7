package com.yongkangl.newick.nhx;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.yongkangl.newick.io.DistanceParser;
import com.yongkangl.newick.io.FeatureParser;
import com.yongkangl.newick.io.NewickTreeParser;
import java.util.Map;
import java.util.OptionalDouble;
import org.junit.jupiter.api.Test;

public class JsonTreeAggregatorTest {

    @Test
    void aggregate_plainComments() {
        NewickTreeParser<JsonNode, OptionalDouble, String> parser = new NewickTreeParser<>(
                new JsonTreeAggregator<>(), DistanceParser.simple(), FeatureParser.identity());

        JsonNode root = parser.parseTree("(A:1,B[note])C;");
        assertEquals("C", root.get("label").asText());
        assertTrue(root.get("distance").isNull());
        assertEquals("", root.get("features").asText());
        assertEquals(2, root.get("children").size());

        JsonNode a = root.get("children").get(0);
        assertEquals(1.0, a.get("distance").asDouble());
        assertEquals(0, a.get("children").size());
        assertEquals("note", root.get("children").get(1).get("features").asText());
    }

    @Test
    void aggregate_nhxFeatures() {
        NewickTreeParser<JsonNode, OptionalDouble, Map<String, String>> parser = new NewickTreeParser<>(
                new JsonTreeAggregator<>(), DistanceParser.simple(), new NhxFeatureParser());

        JsonNode root = parser.parseTree("(A[&&NHX:conf=0.01:name=A],B)[&&NHX:S=root];");
        assertEquals("0.01", root.get("children").get(0).get("features").get("conf").asText());
        assertEquals("root", root.get("features").get("S").asText());
        assertEquals(0, root.get("children").get(1).get("features").size());
    }
}

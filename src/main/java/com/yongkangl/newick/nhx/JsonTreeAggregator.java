package com.yongkangl.newick.nhx;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.yongkangl.newick.io.NodeAggregator;

import java.util.List;
import java.util.OptionalDouble;

/**
 * Builds a Jackson tree with one object per node:
 * {"label": ..., "distance": ..., "features": ..., "children": [...]}.
 * Features are converted with {@link ObjectMapper#valueToTree(Object)}, so both plain
 * comment strings and decoded NHX maps are supported.
 */
public class JsonTreeAggregator<F> implements NodeAggregator<JsonNode, OptionalDouble, F> {
    private final ObjectMapper mapper;

    public JsonTreeAggregator() {
        this(new ObjectMapper());
    }

    public JsonTreeAggregator(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public JsonNode aggregate(String label, List<JsonNode> children, OptionalDouble distance, F feature) {
        ObjectNode node = mapper.createObjectNode();
        node.put("label", label);
        if (distance.isPresent()) {
            node.put("distance", distance.getAsDouble());
        } else {
            node.putNull("distance");
        }
        node.set("features", mapper.valueToTree(feature));
        ArrayNode array = node.putArray("children");
        array.addAll(children);
        return node;
    }
}

package com.yongkangl.newick.nhx;

import com.yongkangl.newick.io.FeatureParser;
import org.apache.commons.lang3.StringUtils;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads New Hampshire eXtended comments into key/value pairs.
 * Example: '&&NHX:conf=0.01:name=INTERNAL' -> {conf=0.01, name=INTERNAL}
 */
public class NhxFeatureParser implements FeatureParser<Map<String, String>> {
    public static final String PREFIX = "&&NHX:";

    @Override
    public Map<String, String> parse(String comment) {
        Map<String, String> features = new LinkedHashMap<>();
        if (comment.isEmpty()) {
            return features;
        }
        if (!comment.startsWith(PREFIX)) {
            throw new IllegalArgumentException("NHX comment must start with " + PREFIX + ": " + comment);
        }
        for (String item : StringUtils.splitPreserveAllTokens(comment.substring(PREFIX.length()), ':')) {
            String[] keyValue = StringUtils.splitPreserveAllTokens(item, '=');
            if (keyValue.length != 2) {
                throw new IllegalArgumentException("Invalid NHX key/value pair: " + item);
            }
            features.put(keyValue[0], keyValue[1]);
        }
        return features;
    }
}

package io.contextlink.window.aggregation;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

public final class EntireCodebaseStrategy implements AggregationStrategy {
    private final ListUnionStrategy files = new ListUnionStrategy("filesData");

    @Override
    public ObjectNode merge(List<WindowContribution> successes) {
        ObjectNode merged = files.merge(successes);
        boolean truncated = false;
        for (WindowContribution contribution : successes) {
            truncated |= ListUnionStrategy.data(contribution).path("truncated").asBoolean(false);
        }
        merged.put("truncated", truncated);
        return merged;
    }
}

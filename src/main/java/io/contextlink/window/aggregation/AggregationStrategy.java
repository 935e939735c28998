package io.contextlink.window.aggregation;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

@FunctionalInterface
public interface AggregationStrategy {
    ObjectNode merge(List<WindowContribution> successes);
}

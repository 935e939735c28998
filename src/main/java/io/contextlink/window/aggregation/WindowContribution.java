package io.contextlink.window.aggregation;

import com.fasterxml.jackson.databind.JsonNode;

public record WindowContribution(String windowId, JsonNode payload) {
}

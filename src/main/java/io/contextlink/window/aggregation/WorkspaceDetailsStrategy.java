package io.contextlink.window.aggregation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.contextlink.util.Jsons;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

public final class WorkspaceDetailsStrategy implements AggregationStrategy {
    @Override
    public ObjectNode merge(List<WindowContribution> successes) {
        ObjectNode merged = Jsons.object();
        ArrayNode folders = merged.putArray("workspaceFolders");
        Set<String> seen = new HashSet<>();
        boolean trusted = !successes.isEmpty();
        for (WindowContribution contribution : successes) {
            JsonNode data = ListUnionStrategy.data(contribution);
            trusted &= data.path("isTrusted").asBoolean(false);
            for (JsonNode folder : data.path("workspaceFolders")) {
                String uri = folder.path("uri").asText("");
                if (seen.add(uri)) {
                    folders.add(ListUnionStrategy.tag(folder, contribution.windowId()));
                }
            }
        }
        merged.put("isTrusted", trusted);
        return merged;
    }
}

package io.contextlink.window.aggregation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.contextlink.util.Jsons;

import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

public final class ListUnionStrategy implements AggregationStrategy {
    private final List<String> listFields;

    public ListUnionStrategy(String... listFields) {
        this.listFields = List.of(listFields);
    }

    @Override
    public ObjectNode merge(List<WindowContribution> successes) {
        ObjectNode merged = Jsons.object();
        if (successes.isEmpty()) {
            return merged;
        }
        Set<String> fields = new LinkedHashSet<>(listFields);
        if (fields.isEmpty()) {
            for (WindowContribution contribution : successes) {
                Iterator<Map.Entry<String, JsonNode>> it = data(contribution).fields();
                while (it.hasNext()) {
                    Map.Entry<String, JsonNode> entry = it.next();
                    if (entry.getValue().isArray()) {
                        fields.add(entry.getKey());
                    }
                }
            }
        }
        JsonNode first = data(successes.get(0));
        Iterator<Map.Entry<String, JsonNode>> it = first.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            if (!fields.contains(entry.getKey()) && !"windowId".equals(entry.getKey())) {
                merged.set(entry.getKey(), entry.getValue().deepCopy());
            }
        }
        for (String field : fields) {
            ArrayNode union = merged.putArray(field);
            for (WindowContribution contribution : successes) {
                for (JsonNode item : data(contribution).path(field)) {
                    union.add(tag(item, contribution.windowId()));
                }
            }
        }
        return merged;
    }

    static JsonNode data(WindowContribution contribution) {
        JsonNode data = contribution.payload().path("data");
        return data.isObject() ? data : Jsons.object();
    }

    static JsonNode tag(JsonNode item, String windowId) {
        if (!item.isObject()) {
            return item.deepCopy();
        }
        ObjectNode copy = item.deepCopy();
        if (!copy.hasNonNull("windowId")) {
            copy.put("windowId", windowId);
        }
        return copy;
    }
}

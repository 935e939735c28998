package io.contextlink.window.aggregation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.contextlink.protocol.Command;
import io.contextlink.protocol.ErrorCode;
import io.contextlink.protocol.Payloads;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

public final class AggregationPolicy {
    private final Map<Command, AggregationStrategy> strategies = new EnumMap<>(Command.class);
    private final AggregationStrategy fallback;

    public AggregationPolicy(AggregationStrategy fallback) {
        this.fallback = fallback;
    }

    public static AggregationPolicy defaults() {
        return new AggregationPolicy(new ListUnionStrategy())
                .with(Command.GET_WORKSPACE_DETAILS, new WorkspaceDetailsStrategy())
                .with(Command.SEARCH_WORKSPACE, new ListUnionStrategy("results"))
                .with(Command.GET_OPEN_FILES, new ListUnionStrategy("openFiles"))
                .with(Command.GET_CONTENTS_FOR_FILES, new ListUnionStrategy("data", "errors"))
                .with(Command.GET_ENTIRE_CODEBASE, new EntireCodebaseStrategy());
    }

    public AggregationPolicy with(Command command, AggregationStrategy strategy) {
        strategies.put(command, strategy);
        return this;
    }

    public AggregationStrategy strategyFor(Command command) {
        return strategies.getOrDefault(command, fallback);
    }

    public JsonNode merge(Command command, List<WindowContribution> contributions) {
        if (contributions.isEmpty()) {
            return Payloads.error(ErrorCode.NO_RESPONSES, "No window answered " + command.wireName() + ".");
        }
        List<WindowContribution> successes = new ArrayList<>();
        List<WindowContribution> failures = new ArrayList<>();
        for (WindowContribution contribution : contributions) {
            if (Payloads.isFailure(contribution.payload())) {
                failures.add(contribution);
            } else {
                successes.add(contribution);
            }
        }
        if (successes.isEmpty()) {
            return failures.get(0).payload();
        }
        ObjectNode data = strategyFor(command).merge(successes);
        if (!failures.isEmpty()) {
            ArrayNode windowErrors = data.putArray("windowErrors");
            for (WindowContribution failure : failures) {
                ObjectNode entry = windowErrors.addObject();
                entry.put("windowId", failure.windowId());
                entry.put("error", Payloads.errorMessage(failure.payload()));
                entry.put("errorCode", Payloads.errorCode(failure.payload()));
            }
        }
        return Payloads.ok(data);
    }
}

package io.contextlink.window.aggregation;

import com.fasterxml.jackson.databind.JsonNode;
import io.contextlink.protocol.Command;
import io.contextlink.protocol.Envelope;
import io.contextlink.server.ClientRecord;
import io.contextlink.server.CommandDispatcher;
import io.contextlink.server.ServerEndpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

public final class AggregationService {
    private static final Logger LOG = LoggerFactory.getLogger(AggregationService.class);

    private final long timeoutMs;
    private final ScheduledExecutorService timer;
    private final AggregationPolicy policy;
    private final Map<String, AggregationContext> contexts = new ConcurrentHashMap<>();

    public AggregationService(long timeoutMs, ScheduledExecutorService timer, AggregationPolicy policy) {
        this.timeoutMs = timeoutMs;
        this.timer = timer;
        this.policy = policy;
    }

    public AggregationContext begin(String originalMessageId, ClientRecord requester, Command command,
                                    List<String> expectedWindowIds) {
        String aggregationId = UUID.randomUUID().toString();
        AggregationContext context = new AggregationContext(aggregationId, originalMessageId, requester, command,
                expectedWindowIds);
        contexts.put(aggregationId, context);
        context.deadline(timer.schedule(() -> expire(context), timeoutMs, TimeUnit.MILLISECONDS));
        LOG.debug("Aggregation {} for {} expects {}", aggregationId, command.wireName(), expectedWindowIds);
        return context;
    }

    public void contributeLocal(AggregationContext context, String windowId, JsonNode payload) {
        if (context.contributeLocal(windowId, payload)) {
            finish(context);
        }
    }

    public boolean accept(String aggregationId, String windowId, JsonNode payload) {
        AggregationContext context = contexts.get(aggregationId);
        if (context == null) {
            LOG.warn("Late or unknown aggregation {} answer from window {} dropped", aggregationId, windowId);
            return false;
        }
        switch (context.offer(windowId, payload)) {
            case READY -> {
                finish(context);
                return true;
            }
            case ACCEPTED -> {
                return true;
            }
            case LATE -> {
                LOG.warn("Aggregation {} already answered; window {} dropped", aggregationId, windowId);
                return false;
            }
            default -> {
                LOG.warn("Window {} was not expected in aggregation {}", windowId, aggregationId);
                return false;
            }
        }
    }

    public void windowGone(String windowId) {
        for (AggregationContext context : contexts.values()) {
            if (context.drop(windowId)) {
                finish(context);
            }
        }
    }

    public void dropWindow(AggregationContext context, String windowId) {
        if (context.drop(windowId)) {
            finish(context);
        }
    }

    public int inFlight() {
        return contexts.size();
    }

    public void close() {
        for (AggregationContext context : contexts.values()) {
            context.complete();
        }
        contexts.clear();
    }

    private void expire(AggregationContext context) {
        if (contexts.containsKey(context.aggregationId())) {
            LOG.warn("Aggregation {} for {} timed out; missing windows {}", context.aggregationId(),
                    context.command().wireName(), context.outstanding());
            finish(context);
        }
    }

    private void finish(AggregationContext context) {
        context.complete().ifPresent(contributions -> {
            contexts.remove(context.aggregationId());
            JsonNode merged = policy.merge(context.command(), contributions);
            Envelope response = CommandDispatcher.toEnvelope(context.originalMessageId(), context.command(), merged);
            LOG.debug("Aggregation {} answered with {} contribution(s)", context.aggregationId(), contributions.size());
            ServerEndpoint.reply(context.requester(), response);
        });
    }
}

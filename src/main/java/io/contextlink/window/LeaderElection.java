package io.contextlink.window;

import io.contextlink.client.ServerProbe;
import io.contextlink.config.ContextLinkConfig;
import io.contextlink.server.IpcServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.OptionalInt;

public final class LeaderElection {
    private static final Logger LOG = LoggerFactory.getLogger(LeaderElection.class);

    public record Outcome(WindowRole role, int port, IpcServer server) {
        static Outcome primary(IpcServer server, int port) {
            return new Outcome(WindowRole.PRIMARY, port, server);
        }

        static Outcome secondary(int primaryPort) {
            return new Outcome(WindowRole.SECONDARY, primaryPort, null);
        }
    }

    private final ContextLinkConfig config;

    public LeaderElection(ContextLinkConfig config) {
        this.config = config;
    }

    // Empty when no port could be bound and no Primary answered.
    public Optional<Outcome> elect(IpcServer.Listener listener) {
        OptionalInt existing = ServerProbe.find(config);
        if (existing.isPresent()) {
            LOG.info("Primary found on port {}", existing.getAsInt());
            return Optional.of(Outcome.secondary(existing.getAsInt()));
        }
        for (int port = config.portRangeStart(); port <= config.portRangeEnd(); port++) {
            Optional<IpcServer> bound = IpcServer.tryBind(config.host(), port, listener);
            if (bound.isEmpty()) {
                continue;
            }
            OptionalInt lower = ServerProbe.find(config, config.portRangeStart(), port - 1);
            if (lower.isPresent()) {
                LOG.info("Port {} bound but a server answers on {}; stepping down", port, lower.getAsInt());
                bound.get().shutdown();
                return Optional.of(Outcome.secondary(lower.getAsInt()));
            }
            return Optional.of(Outcome.primary(bound.get(), port));
        }
        OptionalInt late = ServerProbe.find(config);
        if (late.isPresent()) {
            return Optional.of(Outcome.secondary(late.getAsInt()));
        }
        LOG.warn("No free port in {}-{} and no Primary answered", config.portRangeStart(), config.portRangeEnd());
        return Optional.empty();
    }
}

package io.contextlink.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

final class PortScanner {
    private static final Logger LOG = LoggerFactory.getLogger(PortScanner.class);

    private PortScanner() {
    }

    // Winner events are installed before the future completes, so no frame is lost in hand-over.
    static CompletableFuture<LinkSocket> scan(
            String host,
            int fromPort,
            int toPort,
            long probeTimeoutMs,
            ScheduledExecutorService timer,
            LinkSocket.Events winnerEvents
    ) {
        CompletableFuture<LinkSocket> result = new CompletableFuture<>();
        if (toPort < fromPort) {
            result.completeExceptionally(new ConnectionException("No ports to scan"));
            return result;
        }
        Scan scan = new Scan(fromPort, toPort, result, winnerEvents);
        for (int port = fromPort; port <= toPort; port++) {
            LinkSocket probe = new LinkSocket(host, port, (int) probeTimeoutMs, scan);
            scan.probes.add(probe);
        }
        for (LinkSocket probe : scan.probes) {
            ScheduledFuture<?> deadline = timer.schedule(() -> scan.expire(probe), probeTimeoutMs, TimeUnit.MILLISECONDS);
            scan.deadlines.add(deadline);
            probe.connect();
        }
        return result;
    }

    private static final class Scan implements LinkSocket.Events {
        private final int fromPort;
        private final int toPort;
        private final CompletableFuture<LinkSocket> result;
        private final LinkSocket.Events winnerEvents;
        private final List<LinkSocket> probes = new ArrayList<>();
        private final List<ScheduledFuture<?>> deadlines = new ArrayList<>();
        private final Set<LinkSocket> failed = new HashSet<>();

        private Scan(int fromPort, int toPort, CompletableFuture<LinkSocket> result, LinkSocket.Events winnerEvents) {
            this.fromPort = fromPort;
            this.toPort = toPort;
            this.result = result;
            this.winnerEvents = winnerEvents;
        }

        @Override
        public void onOpened(LinkSocket socket) {
            boolean won;
            synchronized (this) {
                won = !result.isDone() && !failed.contains(socket);
                if (won) {
                    socket.events(winnerEvents);
                }
            }
            if (!won) {
                socket.closeIntentionally();
                return;
            }
            LOG.debug("Port {} answered", socket.port());
            synchronized (this) {
                deadlines.forEach(deadline -> deadline.cancel(false));
            }
            for (LinkSocket probe : probes) {
                if (probe != socket) {
                    probe.closeIntentionally();
                }
            }
            result.complete(socket);
        }

        @Override
        public void onText(LinkSocket socket, String text) {
        }

        @Override
        public void onClosed(LinkSocket socket, int code, String reason, boolean remote) {
            markFailed(socket);
        }

        @Override
        public void onFailure(LinkSocket socket, Exception error) {
            LOG.trace("Probe of port {} failed: {}", socket.port(), error.getMessage());
            markFailed(socket);
        }

        void expire(LinkSocket socket) {
            if (!socket.isOpen()) {
                markFailed(socket);
                socket.closeIntentionally();
            }
        }

        private void markFailed(LinkSocket socket) {
            boolean exhausted;
            synchronized (this) {
                if (result.isDone() || !failed.add(socket)) {
                    return;
                }
                exhausted = failed.size() == probes.size();
            }
            if (exhausted) {
                result.completeExceptionally(new ConnectionException(
                        "No server answered on ports " + fromPort + "-" + toPort));
            }
        }
    }
}

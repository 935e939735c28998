package io.contextlink.client;

import io.contextlink.config.ContextLinkConfig;
import io.contextlink.util.DaemonThreads;

import java.util.OptionalInt;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

public final class ServerProbe {
    private static final ScheduledExecutorService TIMER =
            Executors.newSingleThreadScheduledExecutor(DaemonThreads.factory("contextlink-probe"));
    private static final LinkSocket.Events DISCARD = new LinkSocket.Events() {
        @Override
        public void onOpened(LinkSocket socket) {
        }

        @Override
        public void onText(LinkSocket socket, String text) {
        }

        @Override
        public void onClosed(LinkSocket socket, int code, String reason, boolean remote) {
        }

        @Override
        public void onFailure(LinkSocket socket, Exception error) {
        }
    };

    private ServerProbe() {
    }

    public static OptionalInt find(ContextLinkConfig config) {
        return find(config, config.portRangeStart(), config.portRangeEnd());
    }

    public static OptionalInt find(ContextLinkConfig config, int fromPort, int toPort) {
        if (toPort < fromPort) {
            return OptionalInt.empty();
        }
        try {
            LinkSocket socket = PortScanner.scan(config.host(), fromPort, toPort, config.probeTimeoutMs(), TIMER, DISCARD)
                    .join();
            socket.closeIntentionally();
            return OptionalInt.of(socket.port());
        } catch (CompletionException e) {
            return OptionalInt.empty();
        }
    }
}

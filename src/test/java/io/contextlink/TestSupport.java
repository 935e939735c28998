package io.contextlink;

import io.contextlink.config.ContextLinkConfig;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.BooleanSupplier;

public final class TestSupport {
    private TestSupport() {
    }

    /** A config over {@code size} consecutive loopback ports that are currently free, with fast retries. */
    public static ContextLinkConfig fastConfig(int size) {
        int start = freePortRange(size);
        return ContextLinkConfig.defaults()
                .withPortRange(start, start + size - 1)
                .withRetry(3, 200L)
                .withRequestTimeoutMs(3_000L)
                .withAggregationTimeoutMs(1_500L);
    }

    public static int freePortRange(int size) {
        for (int attempt = 0; attempt < 200; attempt++) {
            int start = ThreadLocalRandom.current().nextInt(20_000, 60_000);
            boolean free = true;
            for (int port = start; port < start + size && free; port++) {
                free = isFree(port);
            }
            if (free) {
                return start;
            }
        }
        throw new IllegalStateException("No free port range of size " + size);
    }

    private static boolean isFree(int port) {
        try (ServerSocket socket = new ServerSocket()) {
            socket.setReuseAddress(false);
            socket.bind(new InetSocketAddress(InetAddress.getByName("127.0.0.1"), port));
            return true;
        } catch (IOException e) {
            return false;
        }
    }

    public static boolean await(BooleanSupplier condition, long timeoutMs) {
        long deadline = System.currentTimeMillis() + timeoutMs;
        while (System.currentTimeMillis() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            try {
                Thread.sleep(20L);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        return condition.getAsBoolean();
    }
}

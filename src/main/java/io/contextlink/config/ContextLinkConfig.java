package io.contextlink.config;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

public final class ContextLinkConfig {
    public static final String PROTOCOL_VERSION = "1.0";
    public static final String DEFAULT_HOST = "127.0.0.1";
    public static final int DEFAULT_PORT_RANGE_START = 30001;
    public static final int DEFAULT_PORT_RANGE_END = 30005;
    public static final int DEFAULT_MAX_CONNECT_ATTEMPTS = 5;
    public static final long DEFAULT_RETRY_DELAY_MS = 3_000L;
    public static final long DEFAULT_REQUEST_TIMEOUT_MS = 30_000L;
    public static final long DEFAULT_PROBE_TIMEOUT_MS = 500L;
    public static final long DEFAULT_AGGREGATION_TIMEOUT_MS = 5_000L;
    public static final int DEFAULT_MAX_SECONDARIES = 16;

    static final String RESOURCE_PATH = "/contextlink.properties";
    static final String PROPERTY_PREFIX = "contextlink.";

    private final String host;
    private final int portRangeStart;
    private final int portRangeEnd;
    private final int maxConnectAttempts;
    private final long retryDelayMs;
    private final long requestTimeoutMs;
    private final long probeTimeoutMs;
    private final long aggregationTimeoutMs;
    private final int maxSecondaries;

    public ContextLinkConfig(
            String host,
            int portRangeStart,
            int portRangeEnd,
            int maxConnectAttempts,
            long retryDelayMs,
            long requestTimeoutMs,
            long probeTimeoutMs,
            long aggregationTimeoutMs,
            int maxSecondaries
    ) {
        if (portRangeStart <= 0 || portRangeEnd > 65_535 || portRangeEnd < portRangeStart) {
            throw new IllegalArgumentException("Invalid port range: " + portRangeStart + "-" + portRangeEnd);
        }
        this.host = host == null || host.isBlank() ? DEFAULT_HOST : host.trim();
        this.portRangeStart = portRangeStart;
        this.portRangeEnd = portRangeEnd;
        this.maxConnectAttempts = Math.max(1, maxConnectAttempts);
        this.retryDelayMs = Math.max(0L, retryDelayMs);
        this.requestTimeoutMs = Math.max(1L, requestTimeoutMs);
        this.probeTimeoutMs = Math.max(50L, probeTimeoutMs);
        this.aggregationTimeoutMs = Math.max(1L, aggregationTimeoutMs);
        this.maxSecondaries = Math.max(0, maxSecondaries);
    }

    public static ContextLinkConfig defaults() {
        return new ContextLinkConfig(
                DEFAULT_HOST,
                DEFAULT_PORT_RANGE_START,
                DEFAULT_PORT_RANGE_END,
                DEFAULT_MAX_CONNECT_ATTEMPTS,
                DEFAULT_RETRY_DELAY_MS,
                DEFAULT_REQUEST_TIMEOUT_MS,
                DEFAULT_PROBE_TIMEOUT_MS,
                DEFAULT_AGGREGATION_TIMEOUT_MS,
                DEFAULT_MAX_SECONDARIES
        );
    }

    public static ContextLinkConfig load() {
        Properties merged = new Properties();
        try (InputStream in = ContextLinkConfig.class.getResourceAsStream(RESOURCE_PATH)) {
            if (in != null) {
                merged.load(in);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load config resource: " + RESOURCE_PATH, e);
        }
        for (String name : System.getProperties().stringPropertyNames()) {
            if (name.startsWith(PROPERTY_PREFIX)) {
                merged.setProperty(name.substring(PROPERTY_PREFIX.length()), System.getProperty(name));
            }
        }
        return fromProperties(merged);
    }

    public static ContextLinkConfig fromProperties(Properties props) {
        ContextLinkConfig d = defaults();
        return new ContextLinkConfig(
                props.getProperty("host", d.host),
                intValue(props, "port-range-start", d.portRangeStart),
                intValue(props, "port-range-end", d.portRangeEnd),
                intValue(props, "max-connect-attempts", d.maxConnectAttempts),
                longValue(props, "retry-delay-ms", d.retryDelayMs),
                longValue(props, "request-timeout-ms", d.requestTimeoutMs),
                longValue(props, "probe-timeout-ms", d.probeTimeoutMs),
                longValue(props, "aggregation-timeout-ms", d.aggregationTimeoutMs),
                intValue(props, "max-secondaries", d.maxSecondaries)
        );
    }

    private static int intValue(Properties props, String key, int fallback) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": " + raw, e);
        }
    }

    private static long longValue(Properties props, String key, long fallback) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid long for " + key + ": " + raw, e);
        }
    }

    public ContextLinkConfig withPortRange(int start, int end) {
        return new ContextLinkConfig(host, start, end, maxConnectAttempts, retryDelayMs,
                requestTimeoutMs, probeTimeoutMs, aggregationTimeoutMs, maxSecondaries);
    }

    public ContextLinkConfig withRetry(int attempts, long delayMs) {
        return new ContextLinkConfig(host, portRangeStart, portRangeEnd, attempts, delayMs,
                requestTimeoutMs, probeTimeoutMs, aggregationTimeoutMs, maxSecondaries);
    }

    public ContextLinkConfig withRequestTimeoutMs(long timeoutMs) {
        return new ContextLinkConfig(host, portRangeStart, portRangeEnd, maxConnectAttempts, retryDelayMs,
                timeoutMs, probeTimeoutMs, aggregationTimeoutMs, maxSecondaries);
    }

    public ContextLinkConfig withAggregationTimeoutMs(long timeoutMs) {
        return new ContextLinkConfig(host, portRangeStart, portRangeEnd, maxConnectAttempts, retryDelayMs,
                requestTimeoutMs, probeTimeoutMs, timeoutMs, maxSecondaries);
    }

    public ContextLinkConfig withMaxSecondaries(int max) {
        return new ContextLinkConfig(host, portRangeStart, portRangeEnd, maxConnectAttempts, retryDelayMs,
                requestTimeoutMs, probeTimeoutMs, aggregationTimeoutMs, max);
    }

    public String host() {
        return host;
    }

    public int portRangeStart() {
        return portRangeStart;
    }

    public int portRangeEnd() {
        return portRangeEnd;
    }

    public int portCount() {
        return portRangeEnd - portRangeStart + 1;
    }

    public int maxConnectAttempts() {
        return maxConnectAttempts;
    }

    public long retryDelayMs() {
        return retryDelayMs;
    }

    public long requestTimeoutMs() {
        return requestTimeoutMs;
    }

    public long probeTimeoutMs() {
        return probeTimeoutMs;
    }

    public long aggregationTimeoutMs() {
        return aggregationTimeoutMs;
    }

    public int maxSecondaries() {
        return maxSecondaries;
    }

    @Override
    public String toString() {
        return "ContextLinkConfig{" +
                "host=" + host +
                ", ports=" + portRangeStart + "-" + portRangeEnd +
                ", maxConnectAttempts=" + maxConnectAttempts +
                ", retryDelayMs=" + retryDelayMs +
                ", requestTimeoutMs=" + requestTimeoutMs +
                ", probeTimeoutMs=" + probeTimeoutMs +
                ", aggregationTimeoutMs=" + aggregationTimeoutMs +
                ", maxSecondaries=" + maxSecondaries +
                '}';
    }
}

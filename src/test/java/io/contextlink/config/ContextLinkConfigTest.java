package io.contextlink.config;

import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ContextLinkConfigTest {
    @Test
    void defaultsShouldMatchProtocolConstants() {
        ContextLinkConfig config = ContextLinkConfig.defaults();
        assertEquals("127.0.0.1", config.host());
        assertEquals(30001, config.portRangeStart());
        assertEquals(30005, config.portRangeEnd());
        assertEquals(5, config.portCount());
        assertEquals(5, config.maxConnectAttempts());
        assertEquals(3_000L, config.retryDelayMs());
        assertEquals(30_000L, config.requestTimeoutMs());
        assertEquals(5_000L, config.aggregationTimeoutMs());
        assertEquals(16, config.maxSecondaries());
    }

    @Test
    void propertiesShouldOverrideDefaults() {
        Properties props = new Properties();
        props.setProperty("port-range-start", "41000");
        props.setProperty("port-range-end", "41002");
        props.setProperty("aggregation-timeout-ms", "750");
        props.setProperty("max-secondaries", "2");
        ContextLinkConfig config = ContextLinkConfig.fromProperties(props);
        assertEquals(41000, config.portRangeStart());
        assertEquals(3, config.portCount());
        assertEquals(750L, config.aggregationTimeoutMs());
        assertEquals(2, config.maxSecondaries());
        assertEquals(30_000L, config.requestTimeoutMs());
    }

    @Test
    void invalidValuesShouldBeRejected() {
        Properties props = new Properties();
        props.setProperty("retry-delay-ms", "soon");
        assertThrows(IllegalArgumentException.class, () -> ContextLinkConfig.fromProperties(props));
        assertThrows(IllegalArgumentException.class, () -> ContextLinkConfig.defaults().withPortRange(30010, 30001));
    }

    @Test
    void loadShouldApplySystemPropertyOverrides() {
        System.setProperty("contextlink.request-timeout-ms", "1234");
        try {
            assertEquals(1_234L, ContextLinkConfig.load().requestTimeoutMs());
        } finally {
            System.clearProperty("contextlink.request-timeout-ms");
        }
    }
}

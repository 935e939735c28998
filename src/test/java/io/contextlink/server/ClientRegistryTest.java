package io.contextlink.server;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ClientRegistryTest {
    @Test
    void currentTargetShouldSkipSecondariesAndClientsWithoutTab() {
        ClientRegistry registry = new ClientRegistry();
        ClientRecord plain = registry.add(new RecordingPeer());
        ClientRecord secondary = registry.add(new RecordingPeer());
        secondary.markSecondary("w-2");
        secondary.markActiveTarget("tab-x", "host");
        ClientRecord browser = registry.add(new RecordingPeer());
        browser.markActiveTarget("tab-1", "chat.example");

        assertEquals(browser, registry.currentTarget().orElseThrow());
        assertEquals(2, registry.recipients().size());
        assertTrue(registry.recipients().contains(plain));
    }

    @Test
    void currentTargetShouldBeEmptyAfterTheTabDisconnects() {
        ClientRegistry registry = new ClientRegistry();
        RecordingPeer peer = new RecordingPeer();
        registry.add(peer).markActiveTarget("tab-1", null);

        registry.remove(peer);

        assertTrue(registry.currentTarget().isEmpty());
        assertTrue(registry.findByTabId("tab-1").isEmpty());
    }
}

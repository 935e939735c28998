package io.contextlink.window;

import io.contextlink.protocol.ErrorCode;
import io.contextlink.server.ClientRecord;
import io.contextlink.server.CommandException;
import io.contextlink.server.RecordingPeer;
import io.contextlink.util.Jsons;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SecondaryRegistryTest {
    private static ClientRecord client(String windowId) {
        ClientRecord record = new ClientRecord(new RecordingPeer(), true);
        record.markSecondary(windowId);
        return record;
    }

    @Test
    void registeringTwiceShouldKeepOneEntry() {
        SecondaryRegistry registry = new SecondaryRegistry(4);
        ClientRecord first = client("w-2");
        ClientRecord second = client("w-2");

        assertTrue(registry.register("w-2", 0, first).isEmpty());
        assertEquals(first, registry.register("w-2", 0, second).get(0).client());

        assertEquals(1, registry.size());
        assertEquals(second, registry.snapshot().get(0).client());
    }

    @Test
    void staleConnectionCloseShouldNotRemoveNewerRegistration() {
        SecondaryRegistry registry = new SecondaryRegistry(4);
        ClientRecord stale = client("w-2");
        ClientRecord fresh = client("w-2");
        registry.register("w-2", 0, stale);
        registry.register("w-2", 0, fresh);

        assertTrue(registry.removeByClient(stale).isEmpty());
        assertEquals(1, registry.size());
        assertEquals("w-2", registry.removeByClient(fresh).orElseThrow().windowId());
        assertEquals(0, registry.size());
    }

    @Test
    void limitShouldRejectNewWindowsButAllowReRegistration() {
        SecondaryRegistry registry = new SecondaryRegistry(1);
        registry.register("w-2", 0, client("w-2"));

        CommandException e = assertThrows(CommandException.class, () -> registry.register("w-3", 0, client("w-3")));
        assertEquals(ErrorCode.COMMAND_EXECUTION_ERROR, e.errorCode());
        registry.register("w-2", 0, client("w-2"));
        assertEquals(1, registry.size());
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 2, 5, 16})
    void limitShouldHoldForAnyConfiguredMaximum(int max) {
        SecondaryRegistry registry = new SecondaryRegistry(max);
        for (int i = 0; i < max; i++) {
            registry.register("w-" + i, 0, client("w-" + i));
        }

        assertThrows(CommandException.class, () -> registry.register("w-extra", 0, client("w-extra")));
        assertEquals(max, registry.size());
    }

    @Test
    void connectionRegisteringUnderNewIdShouldLeaveOnlyTheNewEntry() {
        SecondaryRegistry registry = new SecondaryRegistry(4);
        List<String> gone = new ArrayList<>();
        RegisterSecondaryHandler handler = new RegisterSecondaryHandler(registry, () -> true, gone::add);
        ClientRecord socket = new ClientRecord(new RecordingPeer(), true);

        handler.handle(Jsons.object().put("windowId", "a"), socket);
        handler.handle(Jsons.object().put("windowId", "b"), socket);

        assertEquals(List.of("b"), registry.windowIds());
        assertEquals(List.of("a"), gone);
        assertEquals("b", socket.windowId().orElseThrow());
        assertEquals("b", registry.removeByClient(socket).orElseThrow().windowId());
        assertEquals(0, registry.size());
    }

    @Test
    void renamedRegistrationShouldNotCountTowardTheLimit() {
        SecondaryRegistry registry = new SecondaryRegistry(1);
        ClientRecord socket = new ClientRecord(new RecordingPeer(), true);
        registry.register("a", 0, socket);

        registry.register("b", 0, socket);

        assertEquals(List.of("b"), registry.windowIds());
    }

    @Test
    void registrationOnNonPrimaryShouldBeRefused() {
        RegisterSecondaryHandler handler = new RegisterSecondaryHandler(new SecondaryRegistry(4), () -> false, id -> {
        });

        CommandException e = assertThrows(CommandException.class,
                () -> handler.handle(Jsons.object().put("windowId", "a"), new ClientRecord(new RecordingPeer(), true)));
        assertEquals(ErrorCode.NOT_PRIMARY, e.errorCode());
    }
}

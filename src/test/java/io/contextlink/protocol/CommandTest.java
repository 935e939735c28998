package io.contextlink.protocol;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CommandTest {
    @Test
    void responseNamesShouldFollowTheTable() {
        assertEquals("response_generic_ack", Command.responseNameFor("register_active_target"));
        assertEquals("response_search_workspace", Command.responseNameFor("search_workspace"));
        assertEquals("response_unregister_secondary_ack", Command.responseNameFor("unregister_secondary"));
    }

    @Test
    void unmappedCommandsShouldGetGenericResponseName() {
        assertEquals("response_get_workspace_problems", Command.responseNameFor("get_workspace_problems"));
    }

    @Test
    void flagsShouldSeparateGatedAndAggregatedCommands() {
        assertTrue(Command.SEARCH_WORKSPACE.aggregated());
        assertTrue(Command.SEARCH_WORKSPACE.requiresWorkspace());
        assertFalse(Command.GET_FILE_TREE.aggregated());
        assertFalse(Command.REGISTER_SECONDARY.requiresWorkspace());
        assertTrue(Command.fromWire("nope").isEmpty());
    }
}

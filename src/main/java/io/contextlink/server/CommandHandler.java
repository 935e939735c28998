package io.contextlink.server;

import com.fasterxml.jackson.databind.JsonNode;
import io.contextlink.protocol.Command;

public interface CommandHandler {
    Command command();

    // client is null when the request was forwarded by a Primary.
    JsonNode handle(JsonNode payload, ClientRecord client);
}

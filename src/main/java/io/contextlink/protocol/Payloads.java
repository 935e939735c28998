package io.contextlink.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.contextlink.util.Jsons;

public final class Payloads {
    private Payloads() {
    }

    public static ObjectNode ok(Object data) {
        ObjectNode node = Jsons.object();
        node.put("success", true);
        node.set("data", data == null ? Jsons.object() : Jsons.tree(data));
        node.putNull("error");
        return node;
    }

    public static ObjectNode ack(String message) {
        ObjectNode node = Jsons.object();
        node.put("success", true);
        node.put("message", message);
        return node;
    }

    public static ObjectNode error(ErrorCode code, String message) {
        return error(code.name(), message);
    }

    public static ObjectNode error(String code, String message) {
        ObjectNode node = Jsons.object();
        node.put("success", false);
        node.put("error", message == null ? "Unknown error" : message);
        node.put("errorCode", code);
        return node;
    }

    public static boolean isFailure(JsonNode payload) {
        return payload != null
                && payload.isObject()
                && payload.has("success")
                && !payload.path("success").asBoolean(true);
    }

    public static String errorMessage(JsonNode payload) {
        String message = payload == null ? "" : payload.path("error").asText("");
        return message.isBlank() ? "Unknown error" : message;
    }

    public static String errorCode(JsonNode payload) {
        String code = payload == null ? "" : payload.path("errorCode").asText("");
        return code.isBlank() ? ErrorCode.COMMAND_EXECUTION_ERROR.name() : code;
    }
}

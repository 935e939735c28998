package io.contextlink.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import io.contextlink.util.Jsons;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EnvelopeCodecTest {
    @Test
    void encodeShouldUseSnakeCaseFieldNames() {
        Envelope request = Envelope.request("search_workspace", Jsons.parse("{\"query\":\"foo\"}"));
        JsonNode wire = Jsons.parse(EnvelopeCodec.encode(request));
        assertEquals("1.0", wire.path("protocol_version").asText());
        assertEquals(request.messageId(), wire.path("message_id").asText());
        assertEquals("request", wire.path("type").asText());
        assertEquals("search_workspace", wire.path("command").asText());
        assertEquals("foo", wire.path("payload").path("query").asText());
    }

    @Test
    void decodeShouldRejectNonJsonWithoutRecoveredId() {
        ProtocolException e = assertThrows(ProtocolException.class, () -> EnvelopeCodec.decode("not json {"));
        assertEquals(ErrorCode.INVALID_MESSAGE_FORMAT, e.errorCode());
        assertTrue(e.recoveredMessageId().isEmpty());
    }

    @Test
    void decodeShouldRecoverIdWhenFieldsAreMissing() {
        String frame = "{\"protocol_version\":\"1.0\",\"message_id\":\"m-1\",\"type\":\"request\"}";
        ProtocolException e = assertThrows(ProtocolException.class, () -> EnvelopeCodec.decode(frame));
        assertEquals(ErrorCode.INVALID_MESSAGE_FORMAT, e.errorCode());
        assertEquals("m-1", e.recoveredMessageId().orElseThrow());
    }

    @Test
    void decodeShouldRejectOtherProtocolVersions() {
        String frame = "{\"protocol_version\":\"2.0\",\"message_id\":\"m-2\",\"type\":\"request\",\"command\":\"get_open_files\"}";
        ProtocolException e = assertThrows(ProtocolException.class, () -> EnvelopeCodec.decode(frame));
        assertEquals(ErrorCode.UNSUPPORTED_PROTOCOL_VERSION, e.errorCode());
        assertEquals("m-2", e.recoveredMessageId().orElseThrow());
    }

    @Test
    void decodeShouldRejectUnknownTypes() {
        String frame = "{\"protocol_version\":\"1.0\",\"message_id\":\"m-3\",\"type\":\"shout\",\"command\":\"x\"}";
        ProtocolException e = assertThrows(ProtocolException.class, () -> EnvelopeCodec.decode(frame));
        assertEquals(ErrorCode.INVALID_MESSAGE_FORMAT, e.errorCode());
        assertEquals("m-3", e.recoveredMessageId().orElseThrow());
    }

    @Test
    void decodeShouldDefaultMissingPayloadToEmptyObject() {
        String frame = "{\"protocol_version\":\"1.0\",\"message_id\":\"m-4\",\"type\":\"push\",\"command\":\"push_snippet\"}";
        Envelope envelope = EnvelopeCodec.decode(frame);
        assertEquals(MessageType.PUSH, envelope.type());
        assertTrue(envelope.payload().isObject());
        assertEquals(0, envelope.payload().size());
    }

    @Test
    void errorEnvelopeShouldCarryRequestIdAndCode() {
        Envelope error = Envelope.error("m-5", ErrorCode.UNKNOWN_COMMAND, "Unknown command: nope");
        assertEquals("m-5", error.messageId());
        assertEquals(MessageType.ERROR_RESPONSE, error.type());
        assertEquals("error_response", error.command());
        assertEquals("UNKNOWN_COMMAND", error.payload().path("errorCode").asText());
        assertTrue(Payloads.isFailure(error.payload()));
    }
}

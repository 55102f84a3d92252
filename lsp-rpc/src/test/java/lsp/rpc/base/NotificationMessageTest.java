package lsp.rpc.base;

import lsp.json.Json;
import lsp.json.JsonArray;
import lsp.json.JsonObject;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class NotificationMessageTest extends RpcTestBase {

    @Test
    void validatesANotificationWithParams() {
        var message = NotificationMessage.validate(json("{\"jsonrpc\":\"2.0\",\"method\":\"initialized\",\"params\":{}}"));
        assertThat(message).contains(NotificationMessage.of("initialized", JsonObject.of()));
    }

    @Test
    void paramsAreOptional() {
        var message = NotificationMessage.validate(json("{\"jsonrpc\":\"2.0\",\"method\":\"exit\"}"));
        assertThat(message).contains(NotificationMessage.of("exit"));
        assertThat(message.orElseThrow().params()).isEmpty();
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "{\"jsonrpc\":\"2.0\"}",
            "{\"method\":\"exit\"}",
            "{\"jsonrpc\":\"2.0\",\"method\":null}",
            "{\"jsonrpc\":\"2.0\",\"method\":\"m\",\"params\":false}",
            "null"
    })
    void rejectsMalformedNotifications(String text) {
        assertThat(NotificationMessage.validate(json(text))).isEmpty();
    }

    @Test
    void dumpNeverWritesAnId() {
        var message = NotificationMessage.of("textDocument/didClose", JsonArray.of());
        assertThat(Json.serialize(message.toJson()))
                .isEqualTo("{\"jsonrpc\":\"2.0\",\"method\":\"textDocument\\/didClose\",\"params\":[]}");
    }

    @Test
    void leavesUnknownMembersBehind() {
        JsonObject input = json("{\"jsonrpc\":\"2.0\",\"method\":\"m\",\"x\":1,\"y\":2}").asObject();
        assertThat(NotificationMessage.validate(input)).isPresent();
        assertThat(input.members().keySet()).containsExactly("x", "y");
    }
}

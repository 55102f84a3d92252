package lsp.rpc.base;

import lsp.json.JsonObject;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class BaseProtocolTest extends RpcTestBase {

    @Test
    void decodesARequest() {
        var decoded = BaseProtocol.decode("{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"initialize\",\"params\":{}}");
        assertThat(decoded).isEqualTo(new InboundMessage.Request(
                RequestMessage.of(RequestId.of(1), "initialize", JsonObject.of())));
    }

    @Test
    void decodesANotification() {
        var decoded = BaseProtocol.decode("{\"jsonrpc\":\"2.0\",\"method\":\"exit\"}");
        assertThat(decoded).isEqualTo(new InboundMessage.Notification(NotificationMessage.of("exit")));
    }

    @Test
    void decodesAResponse() {
        var decoded = BaseProtocol.decode("{\"jsonrpc\":\"2.0\",\"id\":\"7\",\"result\":[]}");
        assertThat(decoded).isInstanceOf(InboundMessage.Response.class);
        assertThat(((InboundMessage.Response) decoded).message().id()).isEqualTo(RequestId.of("7"));
    }

    @Test
    void textThatIsNotJsonGetsAParseError() {
        var decoded = BaseProtocol.decode("{\"jsonrpc\":\"2.0\",");
        assertThat(decoded).isEqualTo(new InboundMessage.Rejected(ResponseMessage.err(ResponseId.NULL,
                ResponseError.of(ErrorCode.PARSE_ERROR, "Parse error"))));
        assertThat(BaseProtocol.encode(((InboundMessage.Rejected) decoded).reply()))
                .isEqualTo("{\"jsonrpc\":\"2.0\",\"id\":null,\"error\":{\"code\":-32700,\"message\":\"Parse error\"}}");
    }

    @Test
    void anInvalidRequestEchoesItsId() {
        var decoded = BaseProtocol.decode("{\"jsonrpc\":\"2.0\",\"id\":5,\"method\":\"m\",\"params\":1}");
        assertThat(decoded).isEqualTo(new InboundMessage.Rejected(ResponseMessage.err(RequestId.of(5),
                ResponseError.of(ErrorCode.INVALID_REQUEST, "Invalid Request"))));
    }

    @Test
    void anInvalidRequestWithAnUnreadableIdGetsANullId() {
        var decoded = BaseProtocol.decode("{\"jsonrpc\":\"2.0\",\"id\":{},\"method\":\"m\"}");
        assertThat(decoded).isInstanceOf(InboundMessage.Rejected.class);
        assertThat(((InboundMessage.Rejected) decoded).reply().id()).isEqualTo(ResponseId.NULL);
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "[]",
            "42",
            "{}",
            "{\"jsonrpc\":\"2.0\"}",
            "{\"jsonrpc\":\"2.0\",\"method\":1}",
            "{\"jsonrpc\":\"1.0\",\"id\":1,\"result\":1}"
    })
    void otherJsonIsAnInvalidRequest(String text) {
        var decoded = BaseProtocol.decode(text);
        assertThat(decoded).isEqualTo(new InboundMessage.Rejected(ResponseMessage.err(ResponseId.NULL,
                ResponseError.of(ErrorCode.INVALID_REQUEST, "Invalid Request"))));
    }

    @Test
    void encodeIsCompact() {
        var message = RequestMessage.of(RequestId.of(2), "shutdown");
        assertThat(BaseProtocol.encode(message)).isEqualTo("{\"jsonrpc\":\"2.0\",\"id\":2,\"method\":\"shutdown\"}");
    }

    @Test
    void dollarSlashMethodsAreImplementationDependent() {
        assertThat(BaseProtocol.isImplementationDependent(BaseProtocol.CANCEL_REQUEST)).isTrue();
        assertThat(BaseProtocol.isImplementationDependent("$/progress")).isTrue();
        assertThat(BaseProtocol.isImplementationDependent("initialize")).isFalse();
    }

    @Test
    void defaultIntegerTolerance() {
        assertThat(BaseProtocol.INTEGER_TOLERANCE).isEqualTo(BaseProtocol.DEFAULT_INTEGER_TOLERANCE);
    }
}

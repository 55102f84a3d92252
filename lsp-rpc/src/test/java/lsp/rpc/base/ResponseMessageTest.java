package lsp.rpc.base;

import lsp.json.Json;
import lsp.json.JsonNull;
import lsp.json.JsonNumber;
import lsp.json.JsonObject;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResponseMessageTest extends RpcTestBase {

    @Test
    void okNeverWritesAnError() {
        var response = ResponseMessage.ok(RequestId.of(1), JsonNull.of());
        assertThat(Json.serialize(response.toJson())).isEqualTo("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":null}");
    }

    @Test
    void errNeverWritesAResult() {
        var response = ResponseMessage.err(ResponseId.NULL, ResponseError.of(ErrorCode.PARSE_ERROR, "Parse error"));
        assertThat(Json.serialize(response.toJson()))
                .isEqualTo("{\"jsonrpc\":\"2.0\",\"id\":null,\"error\":{\"code\":-32700,\"message\":\"Parse error\"}}");
    }

    @Test
    void constructorRequiresExactlyOneOutcome() {
        assertThatThrownBy(() -> new ResponseMessage(ResponseId.NULL, Optional.empty(), Optional.empty()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ResponseMessage(ResponseId.NULL, Optional.of(JsonNumber.of(1)),
                Optional.of(ResponseError.of(ErrorCode.INTERNAL_ERROR, "x"))))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void validatesASuccessfulResponse() {
        var response = ResponseMessage.validate(json("{\"jsonrpc\":\"2.0\",\"id\":\"r1\",\"result\":{\"capabilities\":{}}}"));
        assertThat(response).hasValueSatisfying(r -> {
            assertThat(r.id()).isEqualTo(RequestId.of("r1"));
            assertThat(r.isSuccess()).isTrue();
            assertThat(r.result().orElseThrow().asObject().hasKey("capabilities")).isTrue();
        });
    }

    @Test
    void validatesAFailedResponseWithANullId() {
        var response = ResponseMessage.validate(
                json("{\"jsonrpc\":\"2.0\",\"id\":null,\"error\":{\"code\":-32600,\"message\":\"Invalid Request\"}}"));
        assertThat(response).contains(
                ResponseMessage.err(ResponseId.NULL, ResponseError.of(ErrorCode.INVALID_REQUEST, "Invalid Request")));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "{\"jsonrpc\":\"2.0\",\"result\":1}",
            "{\"jsonrpc\":\"2.0\",\"id\":1}",
            "{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":1,\"error\":{\"code\":-32603,\"message\":\"m\"}}",
            "{\"jsonrpc\":\"2.0\",\"id\":[1],\"result\":1}",
            "{\"jsonrpc\":\"2.0\",\"id\":1,\"error\":{\"code\":12345,\"message\":\"m\"}}",
            "{\"jsonrpc\":\"2.0\",\"id\":1,\"error\":\"oops\"}",
            "{\"id\":1,\"result\":1}"
    })
    void rejectsMalformedResponses(String text) {
        assertThat(ResponseMessage.validate(json(text))).isEmpty();
    }

    @Test
    void validateReadsBackWhatDumpWrites() {
        var data = JsonObject.of();
        data.set("retry", JsonNumber.of(0));
        var failed = ResponseMessage.err(RequestId.of(99),
                ResponseError.of(ErrorCode.CONTENT_MODIFIED, "document changed", data));
        assertThat(ResponseMessage.validate(json(BaseProtocol.encode(failed)))).contains(failed);

        var succeeded = ResponseMessage.ok(RequestId.of("abc"), JsonNumber.of(2.5));
        assertThat(ResponseMessage.validate(json(BaseProtocol.encode(succeeded)))).contains(succeeded);
    }

    @Test
    void mutatingTheWrittenObjectLeavesTheResponseUnchanged() {
        var response = ResponseMessage.ok(RequestId.of(1), JsonObject.of());
        int hash = response.hashCode();

        response.toJson().expect("result").asObject().set("injected", JsonNull.of());

        assertThat(response.result().orElseThrow().asObject().isEmpty()).isTrue();
        assertThat(response.hashCode()).isEqualTo(hash);
    }
}

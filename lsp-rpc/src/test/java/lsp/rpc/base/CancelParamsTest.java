package lsp.rpc.base;

import lsp.json.Json;
import lsp.json.JsonArray;
import lsp.json.JsonObject;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CancelParamsTest extends RpcTestBase {

    @Test
    void validatesWithoutAnEnvelope() {
        assertThat(CancelParams.validate(json("{\"id\":4}"))).contains(new CancelParams(RequestId.of(4)));
        assertThat(CancelParams.validate(json("{\"id\":\"q\"}"))).contains(new CancelParams(RequestId.of("q")));
    }

    @Test
    void rejectsMissingOrInvalidIds() {
        assertThat(CancelParams.validate(json("{}"))).isEmpty();
        assertThat(CancelParams.validate(json("{\"id\":null}"))).isEmpty();
        assertThat(CancelParams.validate(json("{\"id\":0.5}"))).isEmpty();
        assertThat(CancelParams.validate(json("[4]"))).isEmpty();
    }

    @Test
    void toNotificationBuildsACancelRequest() {
        var notification = new CancelParams(RequestId.of(4)).toNotification();
        assertThat(Json.serialize(notification.toJson()))
                .isEqualTo("{\"jsonrpc\":\"2.0\",\"method\":\"$\\/cancelRequest\",\"params\":{\"id\":4}}");
    }

    @Test
    void fromNotificationLeavesTheNotificationIntact() {
        var notification = new CancelParams(RequestId.of("r")).toNotification();
        assertThat(CancelParams.fromNotification(notification)).contains(new CancelParams(RequestId.of("r")));
        assertThat(notification.params().orElseThrow().asObject().hasKey("id")).isTrue();
    }

    @Test
    void fromNotificationIgnoresOtherMethods() {
        var params = JsonObject.of();
        params.set("id", RequestId.of(1).toJson());
        assertThat(CancelParams.fromNotification(NotificationMessage.of("$/progress", params))).isEmpty();
        assertThat(CancelParams.fromNotification(NotificationMessage.of(BaseProtocol.CANCEL_REQUEST, JsonArray.of())))
                .isEmpty();
    }
}

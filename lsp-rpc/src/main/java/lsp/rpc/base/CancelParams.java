package lsp.rpc.base;

import lsp.json.JsonObject;
import lsp.json.JsonValue;

import java.util.Objects;
import java.util.Optional;

/// The params of a `$/cancelRequest` notification.
///
/// @param id the id of the request to cancel
public record CancelParams(RequestId id) {

    public CancelParams {
        Objects.requireNonNull(id);
    }

    /// Reads cancel params, consuming the `id` member of `input`.
    ///
    /// @param input the `params` of a cancel notification
    /// @return the params, or an empty `Optional` if `input` is not an object
    ///         or its `id` is missing or neither a string nor an integer
    public static Optional<CancelParams> validate(JsonValue input) {
        if (!input.isObject()) {
            return Optional.empty();
        }
        return input.asObject().remove("id")
                .flatMap(RequestId::validate)
                .map(CancelParams::new);
    }

    /// Reads the params of `notification` if it is a `$/cancelRequest`.
    /// The notification itself is left untouched.
    public static Optional<CancelParams> fromNotification(NotificationMessage notification) {
        if (!BaseProtocol.CANCEL_REQUEST.equals(notification.method())) {
            return Optional.empty();
        }
        return notification.params()
                .filter(JsonValue::isObject)
                .map(p -> JsonObject.of(p.asObject().members()))
                .flatMap(CancelParams::validate);
    }

    /// Writes `params` into `target`.
    public static void dump(CancelParams params, JsonObject target) {
        target.set("id", params.id().toJson());
    }

    public JsonObject toJson() {
        JsonObject target = JsonObject.of();
        dump(this, target);
        return target;
    }

    /// {@return a `$/cancelRequest` notification carrying these params}
    public NotificationMessage toNotification() {
        return NotificationMessage.of(BaseProtocol.CANCEL_REQUEST, toJson());
    }
}

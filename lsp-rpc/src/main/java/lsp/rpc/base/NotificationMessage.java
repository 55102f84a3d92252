package lsp.rpc.base;

import lsp.json.Json;
import lsp.json.JsonObject;
import lsp.json.JsonString;
import lsp.json.JsonValue;

import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/// A notification. It carries no `id` and is never answered.
///
/// `params` is copied on construction and again by `dump`, so trees passed in or
/// written out are never shared with the record.
///
/// @param method the name of the method to be invoked
/// @param params the notification's params, an array or an object, if any
/// @see <a href="https://microsoft.github.io/language-server-protocol/specifications/lsp/3.17/specification/#notificationMessage">LSP NotificationMessage</a>
public record NotificationMessage(String method, Optional<JsonValue> params) implements Message {

    private static final Logger LOG = Logger.getLogger(NotificationMessage.class.getName());

    public NotificationMessage {
        Objects.requireNonNull(method);
        Objects.requireNonNull(params);
        if (params.isPresent() && !BaseProtocol.isStructured(params.get())) {
            throw new IllegalArgumentException("params must be an array or an object");
        }
        params = params.map(Json::copy);
    }

    /// {@return a notification without params}
    public static NotificationMessage of(String method) {
        return new NotificationMessage(method, Optional.empty());
    }

    /// {@return a notification with params}
    public static NotificationMessage of(String method, JsonValue params) {
        return new NotificationMessage(method, Optional.of(params));
    }

    /// Reads a notification, consuming the `jsonrpc`, `method` and `params`
    /// members of `input`. Other members are left in place.
    ///
    /// Call {@link RequestMessage#identify(JsonValue)} first: a request also
    /// passes this validation.
    ///
    /// @param input an incoming message
    /// @return the notification, or an empty `Optional` if `input` is not an
    ///         object, `jsonrpc` is not `"2.0"`, `method` is missing or not a
    ///         string, or `params` is neither an array nor an object
    public static Optional<NotificationMessage> validate(JsonValue input) {
        if (!Message.validate(input)) {
            LOG.fine(() -> "Notification rejected: not a JSON-RPC 2.0 message");
            return Optional.empty();
        }
        JsonObject obj = input.asObject();

        // NotificationMessage.method : string
        Optional<JsonValue> method = obj.remove("method");
        if (method.isEmpty() || !method.get().isString()) {
            LOG.fine(() -> "Notification rejected: missing or non-string 'method'");
            return Optional.empty();
        }

        // NotificationMessage.params : (array | object)?
        Optional<JsonValue> params = obj.remove("params");
        if (params.isPresent() && !BaseProtocol.isStructured(params.get())) {
            LOG.fine(() -> "Notification rejected: 'params' is neither an array nor an object");
            return Optional.empty();
        }

        var message = new NotificationMessage(method.get().string(), params);
        LOG.finer(() -> "Notification validated: " + message.method());
        return Optional.of(message);
    }

    /// Writes `message` into `target`, including `"jsonrpc": "2.0"`.
    public static void dump(NotificationMessage message, JsonObject target) {
        Message.dump(target);
        target.set("method", JsonString.of(message.method()));
        message.params().ifPresent(p -> target.set("params", Json.copy(p)));
    }

    @Override
    public JsonObject toJson() {
        JsonObject target = JsonObject.of();
        dump(this, target);
        return target;
    }
}

package lsp.rpc.base;

import lsp.json.Json;
import lsp.json.JsonObject;
import lsp.json.JsonString;
import lsp.json.JsonValue;

import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/// A request that expects a response.
///
/// `params` is copied on construction and again by `dump`, so trees passed in or
/// written out are never shared with the record.
///
/// @param id the request id, echoed by the response
/// @param method the name of the method to be invoked
/// @param params the method's params, an array or an object, if any
/// @see <a href="https://microsoft.github.io/language-server-protocol/specifications/lsp/3.17/specification/#requestMessage">LSP RequestMessage</a>
public record RequestMessage(RequestId id, String method, Optional<JsonValue> params) implements Message {

    private static final Logger LOG = Logger.getLogger(RequestMessage.class.getName());

    public RequestMessage {
        Objects.requireNonNull(id);
        Objects.requireNonNull(method);
        Objects.requireNonNull(params);
        if (params.isPresent() && !BaseProtocol.isStructured(params.get())) {
            throw new IllegalArgumentException("params must be an array or an object");
        }
        params = params.map(Json::copy);
    }

    /// {@return a request without params}
    public static RequestMessage of(RequestId id, String method) {
        return new RequestMessage(id, method, Optional.empty());
    }

    /// {@return a request with params}
    public static RequestMessage of(RequestId id, String method, JsonValue params) {
        return new RequestMessage(id, method, Optional.of(params));
    }

    /// Tells a request apart from a notification without validating it.
    ///
    /// Both shapes carry a `method`; only a request carries an `id`.
    ///
    /// @param value an incoming message
    /// @return `true` if `value` is an object with both an `id` and a `method`
    ///         member, whatever their values
    public static boolean identify(JsonValue value) {
        return value.isObject()
                && value.asObject().hasKey("id")
                && value.asObject().hasKey("method");
    }

    /// Reads a request, consuming the `jsonrpc`, `id`, `method` and `params`
    /// members of `input`. Other members are left in place.
    ///
    /// @param input an incoming message
    /// @return the request, or an empty `Optional` if `input` is not an object,
    ///         `jsonrpc` is not `"2.0"`, `id` is missing or neither a string nor
    ///         an integer, `method` is missing or not a string, or `params` is
    ///         neither an array nor an object
    public static Optional<RequestMessage> validate(JsonValue input) {
        if (!Message.validate(input)) {
            LOG.fine(() -> "Request rejected: not a JSON-RPC 2.0 message");
            return Optional.empty();
        }
        JsonObject obj = input.asObject();

        // RequestMessage.id : string | integer
        Optional<RequestId> id = obj.remove("id").flatMap(RequestId::validate);
        if (id.isEmpty()) {
            LOG.fine(() -> "Request rejected: missing or invalid 'id'");
            return Optional.empty();
        }

        // RequestMessage.method : string
        Optional<JsonValue> method = obj.remove("method");
        if (method.isEmpty() || !method.get().isString()) {
            LOG.fine(() -> "Request rejected: missing or non-string 'method'");
            return Optional.empty();
        }

        // RequestMessage.params : (array | object)?
        Optional<JsonValue> params = obj.remove("params");
        if (params.isPresent() && !BaseProtocol.isStructured(params.get())) {
            LOG.fine(() -> "Request rejected: 'params' is neither an array nor an object");
            return Optional.empty();
        }

        var message = new RequestMessage(id.get(), method.get().string(), params);
        LOG.finer(() -> "Request validated: " + message.method());
        return Optional.of(message);
    }

    /// Writes `message` into `target`, including `"jsonrpc": "2.0"`.
    public static void dump(RequestMessage message, JsonObject target) {
        Message.dump(target);
        target.set("id", message.id().toJson());
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

package lsp.rpc.base;

import lsp.json.Json;
import lsp.json.JsonObject;
import lsp.json.JsonValue;

import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/// A response to a request. Exactly one of `result` and `error` is present.
///
/// `result` is copied on construction and again by `dump`, so trees passed in or
/// written out are never shared with the record.
///
/// @param id the id of the request this answers, or {@link ResponseId#NULL}
///           when that id could not be determined
/// @param result the result of a successful request
/// @param error the error of a failed request
/// @see <a href="https://microsoft.github.io/language-server-protocol/specifications/lsp/3.17/specification/#responseMessage">LSP ResponseMessage</a>
public record ResponseMessage(ResponseId id, Optional<JsonValue> result, Optional<ResponseError> error)
        implements Message {

    private static final Logger LOG = Logger.getLogger(ResponseMessage.class.getName());

    public ResponseMessage {
        Objects.requireNonNull(id);
        Objects.requireNonNull(result);
        Objects.requireNonNull(error);
        if (result.isPresent() == error.isPresent()) {
            throw new IllegalArgumentException("exactly one of result and error must be present");
        }
        result = result.map(Json::copy);
    }

    /// {@return a successful response}
    public static ResponseMessage ok(ResponseId id, JsonValue result) {
        return new ResponseMessage(id, Optional.of(result), Optional.empty());
    }

    /// {@return a failed response}
    public static ResponseMessage err(ResponseId id, ResponseError error) {
        return new ResponseMessage(id, Optional.empty(), Optional.of(error));
    }

    /// {@return `true` if this response carries a result}
    public boolean isSuccess() {
        return result.isPresent();
    }

    /// Reads a response, consuming the `jsonrpc`, `id`, `result` and `error`
    /// members of `input`. Other members are left in place.
    ///
    /// @param input an incoming message
    /// @return the response, or an empty `Optional` if `input` is not an
    ///         object, `jsonrpc` is not `"2.0"`, `id` is missing or not a
    ///         string, integer or `null`, both or neither of `result` and
    ///         `error` are present, or `error` is not a valid {@link ResponseError}
    public static Optional<ResponseMessage> validate(JsonValue input) {
        if (!Message.validate(input)) {
            LOG.fine(() -> "Response rejected: not a JSON-RPC 2.0 message");
            return Optional.empty();
        }
        JsonObject obj = input.asObject();

        // ResponseMessage.id : integer | string | null
        Optional<ResponseId> id = obj.remove("id").flatMap(ResponseId::validate);
        if (id.isEmpty()) {
            LOG.fine(() -> "Response rejected: missing or invalid 'id'");
            return Optional.empty();
        }

        Optional<JsonValue> result = obj.remove("result");
        Optional<JsonValue> error = obj.remove("error");
        if (result.isPresent() == error.isPresent()) {
            LOG.fine(() -> "Response rejected: needs exactly one of 'result' and 'error'");
            return Optional.empty();
        }
        if (result.isPresent()) {
            return Optional.of(ok(id.get(), result.get()));
        }

        // ResponseMessage.error : ResponseError
        Optional<ResponseError> responseError = ResponseError.validate(error.get());
        if (responseError.isEmpty()) {
            LOG.fine(() -> "Response rejected: invalid 'error'");
            return Optional.empty();
        }
        return Optional.of(err(id.get(), responseError.get()));
    }

    /// Writes `message` into `target`, including `"jsonrpc": "2.0"`. Only the
    /// present one of `result` and `error` is written.
    public static void dump(ResponseMessage message, JsonObject target) {
        Message.dump(target);
        target.set("id", message.id().toJson());
        message.result().ifPresent(r -> target.set("result", Json.copy(r)));
        message.error().ifPresent(e -> target.set("error", e.toJson()));
    }

    @Override
    public JsonObject toJson() {
        JsonObject target = JsonObject.of();
        dump(this, target);
        return target;
    }
}

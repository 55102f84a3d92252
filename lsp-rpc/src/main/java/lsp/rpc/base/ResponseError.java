package lsp.rpc.base;

import lsp.json.Json;
import lsp.json.JsonNumber;
import lsp.json.JsonObject;
import lsp.json.JsonString;
import lsp.json.JsonValue;

import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/// The `error` member of a failed response.
///
/// `data` is copied on construction and again by `dump`, so trees passed in or
/// written out are never shared with the record.
///
/// @param code a known error code
/// @param message a short description of the error
/// @param data additional information about the error, if any
public record ResponseError(ErrorCode code, String message, Optional<JsonValue> data) {

    private static final Logger LOG = Logger.getLogger(ResponseError.class.getName());

    public ResponseError {
        Objects.requireNonNull(code);
        Objects.requireNonNull(message);
        Objects.requireNonNull(data);
        data = data.map(Json::copy);
    }

    /// {@return an error without `data`}
    public static ResponseError of(ErrorCode code, String message) {
        return new ResponseError(code, message, Optional.empty());
    }

    /// {@return an error with `data`}
    public static ResponseError of(ErrorCode code, String message, JsonValue data) {
        return new ResponseError(code, message, Optional.of(data));
    }

    /// Reads an error, consuming the `code`, `message` and `data` members of
    /// `input`. Other members are left in place.
    ///
    /// @param input the `error` member value
    /// @return the error, or an empty `Optional` if `input` is not an object,
    ///         `code` is missing, not an integer or not a known {@link ErrorCode},
    ///         or `message` is missing or not a string
    public static Optional<ResponseError> validate(JsonValue input) {
        if (!input.isObject()) {
            LOG.fine(() -> "ResponseError rejected: not an object");
            return Optional.empty();
        }
        JsonObject obj = input.asObject();

        // ResponseError.code : integer
        Optional<ErrorCode> code = obj.remove("code")
                .flatMap(c -> {
                    var integer = c.tryInteger(BaseProtocol.INTEGER_TOLERANCE);
                    return integer.isPresent() ? ErrorCode.fromCode(integer.getAsLong()) : Optional.empty();
                });
        if (code.isEmpty()) {
            LOG.fine(() -> "ResponseError rejected: missing or unknown 'code'");
            return Optional.empty();
        }

        // ResponseError.message : string
        Optional<JsonValue> message = obj.remove("message");
        if (message.isEmpty() || !message.get().isString()) {
            LOG.fine(() -> "ResponseError rejected: missing or non-string 'message'");
            return Optional.empty();
        }

        // ResponseError.data : any?
        Optional<JsonValue> data = obj.remove("data");

        return Optional.of(new ResponseError(code.get(), message.get().string(), data));
    }

    /// Writes `error` into `target`.
    public static void dump(ResponseError error, JsonObject target) {
        target.set("code", JsonNumber.of(error.code().code()));
        target.set("message", JsonString.of(error.message()));
        error.data().ifPresent(d -> target.set("data", Json.copy(d)));
    }

    /// {@return a new `JsonObject` holding every field of this error}
    public JsonObject toJson() {
        JsonObject target = JsonObject.of();
        dump(this, target);
        return target;
    }
}

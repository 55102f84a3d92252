package lsp.rpc.base;

import lsp.json.JsonNull;
import lsp.json.JsonValue;

import java.util.Optional;

/// The `id` of a `ResponseMessage`: a string, an integer, or `null`.
///
/// `null` is only legal when replying to a request whose id could not be
/// determined, e.g. because the request text did not parse.
public sealed interface ResponseId permits RequestId, ResponseId.NullId {

    /// The `null` id
    ResponseId NULL = new NullId();

    /// {@return the JSON form of this id}
    JsonValue toJson();

    /// JSON `null` as a response id
    record NullId() implements ResponseId {
        @Override
        public JsonValue toJson() {
            return JsonNull.of();
        }
    }

    /// Reads a response id: JSON `null`, a string, or a number within the
    /// configured integer tolerance.
    ///
    /// @param value the `id` member value
    /// @return the id, or an empty `Optional` if `value` is of another kind
    static Optional<ResponseId> validate(JsonValue value) {
        if (value.isNull()) {
            return Optional.of(NULL);
        }
        return RequestId.validate(value).map(ResponseId.class::cast);
    }
}

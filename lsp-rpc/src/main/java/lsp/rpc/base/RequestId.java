package lsp.rpc.base;

import lsp.json.JsonNumber;
import lsp.json.JsonString;
import lsp.json.JsonValue;

import java.util.Objects;
import java.util.Optional;

/// The `id` of a request, also used by `CancelParams`: either a string or an
/// integer, never both and never absent.
public sealed interface RequestId extends ResponseId permits RequestId.StringId, RequestId.IntegerId {

    /// The largest integer id magnitude, 2^53. Every integer up to it is exact
    /// as a `double`.
    long MAX_INTEGER = 1L << 53;

    /// A string request id
    record StringId(String value) implements RequestId {
        public StringId {
            Objects.requireNonNull(value);
        }

        @Override
        public JsonValue toJson() {
            return JsonString.of(value);
        }
    }

    /// An integer request id. Its magnitude is at most {@link #MAX_INTEGER},
    /// so it survives the trip through a JSON number unchanged.
    record IntegerId(long value) implements RequestId {
        public IntegerId {
            if (value < -MAX_INTEGER || value > MAX_INTEGER) {
                throw new IllegalArgumentException(
                        "integer id %d is outside [-2^53, 2^53]".formatted(value));
            }
        }

        @Override
        public JsonValue toJson() {
            return JsonNumber.of(value);
        }
    }

    /// {@return a string request id}
    static RequestId of(String value) {
        return new StringId(value);
    }

    /// {@return an integer request id}
    static RequestId of(long value) {
        return new IntegerId(value);
    }

    /// Reads a request id: a string, or a number that is a whole number within
    /// {@link BaseProtocol#INTEGER_TOLERANCE}.
    ///
    /// @param value the `id` member value
    /// @return the id, or an empty `Optional` if `value` is neither, or is an
    ///         integer whose magnitude exceeds {@link #MAX_INTEGER}
    static Optional<RequestId> validate(JsonValue value) {
        if (value.isString()) {
            return Optional.of(new StringId(value.string()));
        }
        var integer = value.tryInteger(BaseProtocol.INTEGER_TOLERANCE);
        if (integer.isPresent() && integer.getAsLong() >= -MAX_INTEGER && integer.getAsLong() <= MAX_INTEGER) {
            return Optional.of(new IntegerId(integer.getAsLong()));
        }
        return Optional.empty();
    }
}

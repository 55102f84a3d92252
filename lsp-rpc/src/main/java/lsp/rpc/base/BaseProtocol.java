package lsp.rpc.base;

import lsp.json.Json;
import lsp.json.JsonObject;
import lsp.json.JsonValue;

import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/// Entry points for reading and writing base-protocol message bodies.
///
/// {@link #decode(String)} parses one message body and classifies it as a
/// request, a notification or a response. Text that is not valid JSON, or not
/// a valid message, yields the error reply a server sends back instead.
///
/// {@link #encode(Message)} renders a message as compact JSON text.
///
/// ## Configuration
/// The tolerance used when reading integer fields such as `id` and
/// `error.code` defaults to `1e-9` and may be overridden with the system
/// property `lsp.rpc.integerTolerance`.
public final class BaseProtocol {

    private static final Logger LOG = Logger.getLogger(BaseProtocol.class.getName());

    /// System property naming the tolerance for integer fields
    public static final String INTEGER_TOLERANCE_PROPERTY = "lsp.rpc.integerTolerance";

    static final double DEFAULT_INTEGER_TOLERANCE = 1e-9;

    /// How far a number may lie above a whole number and still be read as that
    /// whole number
    public static final double INTEGER_TOLERANCE;

    /// The method of the notification that cancels a request
    public static final String CANCEL_REQUEST = "$/cancelRequest";

    static {
        double tolerance = DEFAULT_INTEGER_TOLERANCE;
        String configured = System.getProperty(INTEGER_TOLERANCE_PROPERTY);
        if (configured != null) {
            try {
                double parsed = Double.parseDouble(configured);
                if (parsed >= 0 && Double.isFinite(parsed)) {
                    tolerance = parsed;
                    LOG.fine(() -> "Integer tolerance set to " + parsed + " via system property");
                } else {
                    LOG.warning(() -> "Ignoring " + INTEGER_TOLERANCE_PROPERTY + "=" + configured
                            + ": must be a finite, non-negative number");
                }
            } catch (NumberFormatException e) {
                LOG.warning(() -> "Ignoring " + INTEGER_TOLERANCE_PROPERTY + "=" + configured
                        + ": " + e.getMessage());
            }
        }
        INTEGER_TOLERANCE = tolerance;
    }

    private BaseProtocol() {}

    /// {@return `true` if `method` starts with `$/`}
    ///
    /// Such notifications and requests are protocol implementation dependent
    /// and may be ignored by the receiver.
    public static boolean isImplementationDependent(String method) {
        Objects.requireNonNull(method);
        return method.startsWith("$/");
    }

    static boolean isStructured(JsonValue value) {
        return value.isArray() || value.isObject();
    }

    /// Decodes one message body.
    ///
    /// A body holding both `id` and `method` is read as a request, one holding
    /// only `method` as a notification, and one holding `result` or `error` as
    /// a response.
    ///
    /// @param text the message body, without the `Content-Length` header
    /// @return the decoded message. Text that is not JSON is rejected with a
    ///         `ParseError` reply. Text that is JSON but not a valid message
    ///         is rejected with an `InvalidRequest` reply, echoing the request
    ///         id when it could be read.
    public static InboundMessage decode(String text) {
        Objects.requireNonNull(text);
        Optional<JsonValue> parsed = Json.parse(text);
        if (parsed.isEmpty()) {
            LOG.fine(() -> "Rejecting message body: not valid JSON");
            return reject(ResponseId.NULL, ErrorCode.PARSE_ERROR, "Parse error");
        }
        JsonValue value = parsed.get();
        if (!value.isObject()) {
            LOG.fine(() -> "Rejecting message body: not a JSON object");
            return invalid(ResponseId.NULL);
        }
        JsonObject obj = value.asObject();

        if (RequestMessage.identify(obj)) {
            // read the id before validation consumes it
            ResponseId echo = RequestId.validate(obj.expect("id"))
                    .map(ResponseId.class::cast)
                    .orElse(ResponseId.NULL);
            return RequestMessage.validate(obj)
                    .<InboundMessage>map(InboundMessage.Request::new)
                    .orElseGet(() -> invalid(echo));
        }
        if (obj.hasKey("method")) {
            return NotificationMessage.validate(obj)
                    .<InboundMessage>map(InboundMessage.Notification::new)
                    .orElseGet(() -> invalid(ResponseId.NULL));
        }
        if (obj.hasKey("result") || obj.hasKey("error")) {
            return ResponseMessage.validate(obj)
                    .<InboundMessage>map(InboundMessage.Response::new)
                    .orElseGet(() -> invalid(ResponseId.NULL));
        }
        LOG.fine(() -> "Rejecting message body: neither request, notification nor response");
        return invalid(ResponseId.NULL);
    }

    /// {@return the compact JSON text of `message`}
    public static String encode(Message message) {
        Objects.requireNonNull(message);
        String text = Json.serialize(message.toJson());
        LOG.finer(() -> "Encoded " + message.getClass().getSimpleName() + ": " + text.length() + " chars");
        return text;
    }

    private static InboundMessage invalid(ResponseId id) {
        return reject(id, ErrorCode.INVALID_REQUEST, "Invalid Request");
    }

    private static InboundMessage reject(ResponseId id, ErrorCode code, String message) {
        return new InboundMessage.Rejected(ResponseMessage.err(id, ResponseError.of(code, message)));
    }
}

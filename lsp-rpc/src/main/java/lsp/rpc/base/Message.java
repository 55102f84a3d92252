package lsp.rpc.base;

import lsp.json.JsonObject;
import lsp.json.JsonString;
import lsp.json.JsonValue;

import java.util.Optional;

/// The abstract JSON-RPC message every request, notification and response
/// extends: an object carrying `"jsonrpc": "2.0"`.
///
/// The static members validate and write that envelope field; the message
/// shapes call them before handling their own fields.
///
/// @see <a href="https://microsoft.github.io/language-server-protocol/specifications/lsp/3.17/specification/#abstractMessage">LSP Abstract Message</a>
public sealed interface Message permits RequestMessage, NotificationMessage, ResponseMessage {

    /// The only JSON-RPC version accepted and written
    String JSONRPC_VERSION = "2.0";

    /// {@return a new `JsonObject` holding every field of this message}
    JsonObject toJson();

    /// Checks the message envelope, consuming the `jsonrpc` member.
    ///
    /// @param value the incoming message
    /// @return `true` if `value` is an object whose `jsonrpc` member is the
    ///         string `"2.0"`
    static boolean validate(JsonValue value) {
        if (!value.isObject()) {
            return false;
        }
        Optional<JsonValue> jsonrpc = value.asObject().remove("jsonrpc");
        return jsonrpc.isPresent()
                && jsonrpc.get().isString()
                && JSONRPC_VERSION.equals(jsonrpc.get().string());
    }

    /// Writes `"jsonrpc": "2.0"` into `target`.
    static void dump(JsonObject target) {
        target.set("jsonrpc", JsonString.of(JSONRPC_VERSION));
    }
}

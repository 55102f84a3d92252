package lsp.rpc.base;

import java.util.Optional;

/// The closed set of error codes a `ResponseError` may carry.
///
/// The values are fixed by the JSON-RPC 2.0 and Language Server Protocol
/// specifications. The reserved range bounds are plain constants since no
/// error is ever reported with them.
///
/// @see <a href="https://microsoft.github.io/language-server-protocol/specifications/lsp/3.17/specification/#errorCodes">LSP ErrorCodes</a>
public enum ErrorCode {

    // Defined by JSON-RPC
    /// Invalid JSON was received by the server.
    PARSE_ERROR(-32700),
    /// The JSON sent is not a valid Request object.
    INVALID_REQUEST(-32600),
    /// The method does not exist / is not available.
    METHOD_NOT_FOUND(-32601),
    /// Invalid method parameter(s).
    INVALID_PARAMS(-32602),
    /// Internal JSON-RPC error.
    INTERNAL_ERROR(-32603),

    /// A notification or request arrived before the `initialize` request.
    SERVER_NOT_INITIALIZED(-32002),
    UNKNOWN_ERROR_CODE(-32001),

    /// A request failed but it was syntactically correct: the method name was
    /// known and the parameters were valid. The message should say why.
    REQUEST_FAILED(-32803),
    /// The server cancelled the request. Only for requests that explicitly
    /// support being server cancellable.
    SERVER_CANCELLED(-32802),
    /// The content of a document got modified outside normal conditions.
    CONTENT_MODIFIED(-32801),
    /// The client cancelled a request and the server detected the cancel.
    REQUEST_CANCELLED(-32800);

    public static final int JSONRPC_RESERVED_ERROR_RANGE_START = -32099;
    public static final int JSONRPC_RESERVED_ERROR_RANGE_END = -32000;
    public static final int LSP_RESERVED_ERROR_RANGE_START = -32899;
    public static final int LSP_RESERVED_ERROR_RANGE_END = -32800;

    private final int code;

    ErrorCode(int code) {
        this.code = code;
    }

    /// {@return the integer value sent on the wire}
    public int code() {
        return code;
    }

    /// {@return the `ErrorCode` with the given integer value, or an empty
    /// `Optional` if the value is not a member of the closed set}
    public static Optional<ErrorCode> fromCode(long code) {
        for (ErrorCode errorCode : values()) {
            if (errorCode.code == code) {
                return Optional.of(errorCode);
            }
        }
        return Optional.empty();
    }
}

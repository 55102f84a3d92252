/// The JSON-RPC base protocol used by the Language Server Protocol.
///
/// Each message shape is a record with a static `validate` that reads it from
/// a {@link lsp.json.JsonValue}, consuming the members it recognises, and a
/// static `dump` that writes it into a {@link lsp.json.JsonObject}.
/// {@link lsp.rpc.base.BaseProtocol} decodes and encodes whole message bodies.
package lsp.rpc.base;

package lsp.rpc.base;

import java.util.Objects;

/// The outcome of {@link BaseProtocol#decode(String)}: one validated message,
/// or the error reply to send back for text that is not one.
public sealed interface InboundMessage
        permits InboundMessage.Request, InboundMessage.Notification,
                InboundMessage.Response, InboundMessage.Rejected {

    record Request(RequestMessage message) implements InboundMessage {
        public Request {
            Objects.requireNonNull(message);
        }
    }

    record Notification(NotificationMessage message) implements InboundMessage {
        public Notification {
            Objects.requireNonNull(message);
        }
    }

    record Response(ResponseMessage message) implements InboundMessage {
        public Response {
            Objects.requireNonNull(message);
        }
    }

    /// Text that did not decode. `reply` is a failed response carrying
    /// `ParseError` or `InvalidRequest`.
    record Rejected(ResponseMessage reply) implements InboundMessage {
        public Rejected {
            Objects.requireNonNull(reply);
            if (reply.isSuccess()) {
                throw new IllegalArgumentException("reply must carry an error");
            }
        }
    }
}

package lsp.rpc.base;

import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;

import static org.assertj.core.api.Assertions.assertThat;

/// Property-based testing for the message codec.
/// Encodes generated messages and checks that decoding yields the same message.
class MessageRoundTripPropertyTest extends RpcTestBase {

    @Provide
    Arbitrary<RequestId> requestIds() {
        Arbitrary<RequestId> strings = Arbitraries.strings().all().ofMaxLength(8).map(RequestId::of);
        Arbitrary<RequestId> integers = Arbitraries.longs().between(-(1L << 53), 1L << 53).map(RequestId::of);
        return Arbitraries.oneOf(strings, integers);
    }

    @Provide
    Arbitrary<String> methods() {
        return Arbitraries.strings().all().ofMaxLength(16);
    }

    @Property(tries = 200)
    void requestsDecodeToThemselves(@ForAll("requestIds") RequestId id, @ForAll("methods") String method) {
        var message = RequestMessage.of(id, method);
        assertThat(BaseProtocol.decode(BaseProtocol.encode(message)))
                .isEqualTo(new InboundMessage.Request(message));
    }

    @Property(tries = 200)
    void failedResponsesDecodeToThemselves(@ForAll("requestIds") RequestId id, @ForAll ErrorCode code,
                                           @ForAll("methods") String text) {
        var message = ResponseMessage.err(id, ResponseError.of(code, text));
        assertThat(BaseProtocol.decode(BaseProtocol.encode(message)))
                .isEqualTo(new InboundMessage.Response(message));
    }
}

package lsp.rpc.base;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;

class ErrorCodeTest extends RpcTestBase {

    @ParameterizedTest
    @EnumSource(ErrorCode.class)
    void fromCodeFindsEveryMember(ErrorCode code) {
        assertThat(ErrorCode.fromCode(code.code())).contains(code);
    }

    @Test
    void wireValuesMatchTheProtocol() {
        assertThat(ErrorCode.PARSE_ERROR.code()).isEqualTo(-32700);
        assertThat(ErrorCode.INVALID_REQUEST.code()).isEqualTo(-32600);
        assertThat(ErrorCode.SERVER_NOT_INITIALIZED.code()).isEqualTo(-32002);
        assertThat(ErrorCode.REQUEST_CANCELLED.code()).isEqualTo(-32800);
        assertThat(ErrorCode.REQUEST_FAILED.code()).isEqualTo(-32803);
    }

    @Test
    void rangeBoundsAreNotMembers() {
        assertThat(ErrorCode.fromCode(ErrorCode.JSONRPC_RESERVED_ERROR_RANGE_START)).isEmpty();
        assertThat(ErrorCode.fromCode(ErrorCode.JSONRPC_RESERVED_ERROR_RANGE_END)).isEmpty();
        assertThat(ErrorCode.fromCode(ErrorCode.LSP_RESERVED_ERROR_RANGE_START)).isEmpty();
        assertThat(ErrorCode.fromCode(0)).isEmpty();
    }
}

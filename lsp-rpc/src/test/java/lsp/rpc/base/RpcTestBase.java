package lsp.rpc.base;

import lsp.json.Json;
import lsp.json.JsonValue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInfo;

import java.util.logging.Logger;

/// Base class for lsp-rpc tests: logs a banner per test and parses fixtures.
public class RpcTestBase extends RpcLoggingConfig {

    static final Logger LOG = Logger.getLogger("lsp.rpc.base");

    @BeforeEach
    void announce(TestInfo testInfo) {
        final String cls = testInfo.getTestClass().map(Class::getSimpleName).orElse("UnknownTest");
        final String name = testInfo.getTestMethod().map(java.lang.reflect.Method::getName)
                .orElseGet(testInfo::getDisplayName);
        LOG.info(() -> "TEST: " + cls + "#" + name);
    }

    static JsonValue json(String text) {
        return Json.parse(text).orElseThrow(() -> new AssertionError("Expected valid JSON: " + text));
    }
}

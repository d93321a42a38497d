package io.github.simbo1905.mcnp.input;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInfo;

import java.util.logging.Logger;

/// Announces each test and offers the parsing shortcuts most tests need.
abstract class InputTestBase extends InputLoggingConfig {

    static final Logger LOG = Logger.getLogger("io.github.simbo1905.mcnp.input");

    final RecordParser parser = new RecordParser();

    @BeforeEach
    void announce(TestInfo testInfo) {
        final String cls = testInfo.getTestClass().map(Class::getSimpleName).orElse("UnknownTest");
        final String name = testInfo.getTestMethod().map(java.lang.reflect.Method::getName)
                .orElseGet(testInfo::getDisplayName);
        LOG.info(() -> "TEST: " + cls + "#" + name);
    }

    ParsedRecord parse(BlockType block, String text) {
        return parser.parse(InputRecord.of(block, text));
    }

    String roundTrip(BlockType block, String text) {
        return parse(block, text).tree().format();
    }
}

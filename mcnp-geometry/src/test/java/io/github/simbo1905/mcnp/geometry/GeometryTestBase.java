package io.github.simbo1905.mcnp.geometry;

import io.github.simbo1905.mcnp.input.BlockType;
import io.github.simbo1905.mcnp.input.InputRecord;
import io.github.simbo1905.mcnp.input.McnpVersion;
import io.github.simbo1905.mcnp.input.RecordParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInfo;

import java.util.logging.Logger;

abstract class GeometryTestBase extends GeometryLoggingConfig {

    static final Logger LOG = Logger.getLogger("io.github.simbo1905.mcnp.geometry");

    @BeforeEach
    void announce(TestInfo testInfo) {
        final String cls = testInfo.getTestClass().map(Class::getSimpleName).orElse("UnknownTest");
        final String name = testInfo.getTestMethod().map(java.lang.reflect.Method::getName)
                .orElseGet(testInfo::getDisplayName);
        LOG.info(() -> "TEST: " + cls + "#" + name);
    }

    static CellGeometry cell(String text) {
        return CellGeometry.of(new RecordParser().parse(InputRecord.of(BlockType.CELL, text)));
    }

    static String text(CellGeometry cell) {
        return String.join("\n", cell.format(McnpVersion.DEFAULT));
    }
}

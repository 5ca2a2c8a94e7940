package org.observatory.datapipeline.utils;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class PathExpansionTest {

    @AfterEach
    void cleanup() {
        System.clearProperty("test.property");
        System.clearProperty("test.property1");
        System.clearProperty("test.property2");
    }

    @Test
    void testExpandPath_NoVariables() {
        String path = "/absolute/path/without/variables";
        assertEquals(path, PathExpansion.expandPath(path));
    }

    @Test
    void testExpandPath_NullPath() {
        assertNull(PathExpansion.expandPath(null));
    }

    @Test
    void testExpandPath_SingleSystemProperty() {
        System.setProperty("test.property", "/worlds");
        assertEquals("/worlds/ledger.jsonl", PathExpansion.expandPath("${test.property}/ledger.jsonl"));
    }

    @Test
    void testExpandPath_MultipleVariables() {
        System.setProperty("test.property1", "/first");
        System.setProperty("test.property2", "second");

        assertEquals("/first/middle/second/end", PathExpansion.expandPath("${test.property1}/middle/${test.property2}/end"));
    }

    @Test
    void testExpandPath_UndefinedVariable() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> PathExpansion.expandPath("${surely.undefined.variable.xyz}/data"));
        assertTrue(e.getMessage().contains("surely.undefined.variable.xyz"));
    }

    @Test
    void testExpandPath_UnclosedVariable() {
        assertThrows(IllegalArgumentException.class, () -> PathExpansion.expandPath("${test.property/data"));
    }

    @Test
    void testResolve_NormalizesToAbsolute() {
        System.setProperty("test.property", "/worlds/a");
        Path resolved = PathExpansion.resolve("${test.property}/../b/ledger.jsonl");

        assertTrue(resolved.isAbsolute());
        assertEquals(Path.of("/worlds/b/ledger.jsonl").toAbsolutePath(), resolved);
    }
}

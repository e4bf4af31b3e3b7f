package com.lunaindex.store;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class SourcePathsTest {

    @Test
    void shouldNormalizeSeparatorsAndLeadingDot() {
        assertEquals("src/utils/helper.ts", SourcePaths.normalize(".\\src\\\\utils/helper.ts"));
        assertEquals("a/b.ts", SourcePaths.normalize("./a//b.ts"));
    }

    @Test
    void shouldStripOnlyFinalExtension() {
        assertEquals("src/utils/helper", SourcePaths.stripExtension("src/utils/helper.ts"));
        assertEquals("src/app.config", SourcePaths.stripExtension("src/app.config.ts"));
        assertEquals("src/v1.2/readme", SourcePaths.stripExtension("src/v1.2/readme"));
        assertEquals("config/.eslintrc", SourcePaths.stripExtension("config/.eslintrc"));
    }

    @Test
    void shouldResolveParentSegmentsAgainstDirectory() {
        assertEquals("src/shared/log.ts", SourcePaths.resolve("src/features", "../shared/log.ts"));
        assertEquals("log.ts", SourcePaths.resolve("", "../../log.ts"));
        assertEquals("src/a/b.ts", SourcePaths.resolve("src", "./a/b.ts"));
    }

    @Test
    void shouldSplitFileNameAndDirectory() {
        assertEquals("helper.ts", SourcePaths.fileName("src/utils/helper.ts"));
        assertEquals("src/utils", SourcePaths.directory("src/utils/helper.ts"));
        assertEquals("", SourcePaths.directory("root.ts"));
    }

    @Test
    void shouldRejectPathsThatDoNotNameAFile() {
        assertThrows(IllegalArgumentException.class, () -> SourcePaths.requireFilePath(""));
        assertThrows(IllegalArgumentException.class, () -> SourcePaths.requireFilePath("src/"));
    }
}

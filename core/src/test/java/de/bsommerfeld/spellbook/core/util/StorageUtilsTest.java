package de.bsommerfeld.spellbook.core.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class StorageUtilsTest {

    @TempDir
    Path tempDir;

    @Test
    void getAppDataDir_shouldEndWithAppName() {
        Path dir = StorageUtils.getAppDataDir("test-app");
        assertEquals("test-app", dir.getFileName().toString());
    }

    @Test
    void getAppDataDir_differentNames_shouldProduceDifferentPaths() {
        assertNotEquals(StorageUtils.getAppDataDir("app-one"), StorageUtils.getAppDataDir("app-two"));
    }

    @Test
    void ensureDirectory_shouldCreateNestedDirectories() throws Exception {
        Path nested = tempDir.resolve("a").resolve("b");

        Path result = StorageUtils.ensureDirectory(nested);

        assertEquals(nested, result);
        assertTrue(Files.isDirectory(nested));
    }

    @Test
    void ensureDirectory_shouldAcceptExistingDirectory() throws Exception {
        assertEquals(tempDir, StorageUtils.ensureDirectory(tempDir));
    }
}

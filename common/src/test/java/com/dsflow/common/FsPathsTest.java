package com.dsflow.common;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class FsPathsTest {
    @TempDir
    Path tempDir;

    @AfterEach
    void restore() {
        System.clearProperty(FsPaths.BASE_DIR_PROP);
        System.clearProperty(FsPaths.CACHE_DIR_PROP);
    }

    @Test
    void cacheFileResolvesUnderBaseDir() {
        System.setProperty(FsPaths.BASE_DIR_PROP, tempDir.toString());
        Path f = FsPaths.cacheFile("mnist");
        assertEquals(tempDir.toAbsolutePath().normalize().resolve("cache").resolve("mnist.entities"), f);
    }

    @Test
    void absoluteCacheDirWins() {
        Path abs = tempDir.resolve("elsewhere");
        System.setProperty(FsPaths.CACHE_DIR_PROP, abs.toString());
        assertEquals(abs.normalize(), FsPaths.cacheDir());
    }
}

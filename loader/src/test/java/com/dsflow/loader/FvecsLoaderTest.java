package com.dsflow.loader;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FVECS Loader Unit Tests")
public class FvecsLoaderTest {

    private FvecsLoader loader;

    @TempDir
    Path tempDir;

    @BeforeEach
    public void setUp() {
        loader = new FvecsLoader();
    }

    @Test
    @DisplayName("Record count matches file size")
    public void testCountRecords() throws Exception {
        Path file = TestFiles.writeFvecs(tempDir.resolve("v.fvecs"), 7, 3);
        assertEquals(7, loader.countRecords(file));
        assertEquals(3, loader.dimension(file));
    }

    @Test
    @DisplayName("Random access returns the requested record")
    public void testReadRecord() throws Exception {
        Path file = TestFiles.writeFvecs(tempDir.resolve("v.fvecs"), 5, 4);
        assertArrayEquals(new double[]{3, 3, 3, 3}, loader.readRecord(file, 3), 0.0);
        assertArrayEquals(new double[]{0, 0, 0, 0}, loader.readRecord(file, 0), 0.0);
    }

    @Test
    @DisplayName("Out-of-range record fails with IOException")
    public void testReadRecordOutOfRange() throws Exception {
        Path file = TestFiles.writeFvecs(tempDir.resolve("v.fvecs"), 2, 4);
        assertThrows(IOException.class, () -> loader.readRecord(file, 2));
        assertThrows(IllegalArgumentException.class, () -> loader.readRecord(file, -1));
    }

    @Test
    @DisplayName("Truncated file is reported as malformed")
    public void testTruncatedFile() throws Exception {
        Path file = TestFiles.writeFvecs(tempDir.resolve("v.fvecs"), 2, 4);
        byte[] bytes = Files.readAllBytes(file);
        Files.write(file, java.util.Arrays.copyOf(bytes, bytes.length - 3));
        assertThrows(IOException.class, () -> loader.countRecords(file));
    }

    @Test
    @DisplayName("Empty file has no records")
    public void testEmptyFile() throws Exception {
        Path file = Files.createFile(tempDir.resolve("empty.fvecs"));
        assertEquals(0, loader.countRecords(file));
    }
}

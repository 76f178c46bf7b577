package com.ttennebkram.imagelab.export;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class FileExportSinkTest {

    @TempDir
    Path tempDir;

    private long countTempFiles(Path dir) throws IOException {
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(p -> p.getFileName().toString().endsWith(".tmp")).count();
        }
    }

    @Test
    public void testSaveCreatesDirectoryAndReplaces() throws IOException {
        Path exports = tempDir.resolve("exports");
        FileExportSink sink = new FileExportSink(exports);

        sink.save("out.png", new byte[] {1, 2, 3});
        assertArrayEquals(new byte[] {1, 2, 3}, Files.readAllBytes(exports.resolve("out.png")));

        sink.save("out.png", new byte[] {4, 5});
        assertArrayEquals(new byte[] {4, 5}, Files.readAllBytes(exports.resolve("out.png")));
        assertEquals(0, countTempFiles(exports));
    }

    @Test
    public void testRejectsPaths() {
        FileExportSink sink = new FileExportSink(tempDir);
        assertThrows(IllegalArgumentException.class, () -> sink.save("../escape.png", new byte[1]));
        assertThrows(IllegalArgumentException.class, () -> sink.save("sub/inner.png", new byte[1]));
    }

    @Test
    public void testFailedMoveLeavesNoTempFile() throws IOException {
        Path blocker = tempDir.resolve("blocked.png");
        Files.createDirectory(blocker);
        Files.write(blocker.resolve("child"), new byte[] {1});

        FileExportSink sink = new FileExportSink(tempDir);
        assertThrows(IOException.class, () -> sink.save("blocked.png", new byte[] {9}));
        assertEquals(0, countTempFiles(tempDir));
        assertTrue(Files.isDirectory(blocker));
    }
}

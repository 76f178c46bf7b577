package com.ttennebkram.imagelab.export;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Writes exports into a directory. Bytes go to a temporary file first, which is then
 * moved over the target, so a failed write never leaves a partial image behind.
 */
public class FileExportSink implements ExportSink {

    private static final Logger logger = LoggerFactory.getLogger(FileExportSink.class);

    private final Path directory;

    public FileExportSink(Path directory) {
        this.directory = directory;
    }

    public Path getDirectory() {
        return directory;
    }

    @Override
    public void save(String fileName, byte[] data) throws IOException {
        Path target = directory.resolve(fileName).normalize();
        if (!directory.normalize().equals(target.getParent())) {
            throw new IllegalArgumentException("File name must not contain a path: " + fileName);
        }
        Files.createDirectories(directory);

        Path temp = Files.createTempFile(directory, ".export-", ".tmp");
        try {
            Files.write(temp, data);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException | RuntimeException e) {
            try {
                Files.deleteIfExists(temp);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw e;
        }
        logger.info("Exported {} bytes to {}", data.length, target);
    }
}

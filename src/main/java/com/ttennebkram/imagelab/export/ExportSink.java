package com.ttennebkram.imagelab.export;

import java.io.IOException;

/**
 * Receives exported bytes. What happens next (file, download, clipboard) is up to the sink.
 */
@FunctionalInterface
public interface ExportSink {

    /**
     * @param fileName suggested file name including the format's extension
     * @param data encoded bytes
     */
    void save(String fileName, byte[] data) throws IOException;
}

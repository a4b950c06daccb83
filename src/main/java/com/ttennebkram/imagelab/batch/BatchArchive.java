package com.ttennebkram.imagelab.batch;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * ZIP archive holding the successful outputs of one batch, in input order.
 * Built entirely in memory; nothing is staged on disk.
 */
public final class BatchArchive {

    public static final String MEDIA_TYPE = "application/zip";

    // Fixed entry timestamp keeps archives byte-identical across runs
    private static final long ENTRY_TIME = 315532800000L; // 1980-01-01T00:00:00Z

    private final byte[] content;
    private final List<String> entryNames;

    private BatchArchive(byte[] content, List<String> entryNames) {
        this.content = content;
        this.entryNames = Collections.unmodifiableList(entryNames);
    }

    /**
     * Package the successful items; failures are skipped.
     */
    static BatchArchive of(List<BatchItemResult> items) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        List<String> names = new ArrayList<>();
        try (ZipOutputStream zip = new ZipOutputStream(bytes)) {
            for (BatchItemResult item : items) {
                if (!item.isSuccess()) continue;
                ZipEntry entry = new ZipEntry(item.getOutputName());
                entry.setTime(ENTRY_TIME);
                zip.putNextEntry(entry);
                zip.write(item.getEncoded());
                zip.closeEntry();
                names.add(item.getOutputName());
            }
        } catch (IOException e) {
            // ByteArrayOutputStream does not throw; this only guards the Zip contract
            throw new UncheckedIOException("Could not build batch archive", e);
        }
        return new BatchArchive(bytes.toByteArray(), names);
    }

    public byte[] getContent() {
        return content.clone();
    }

    public int getSize() {
        return content.length;
    }

    public List<String> getEntryNames() {
        return entryNames;
    }

    public int getEntryCount() {
        return entryNames.size();
    }

    /**
     * Download file name for an archive stored under {@code batchId}.
     */
    public static String fileName(String batchId) {
        return batchId == null ? "batch_processed.zip" : "batch_processed_" + batchId + ".zip";
    }
}

package com.ttennebkram.imagelab.batch;

import java.util.Optional;

/**
 * Keeps batch archives retrievable by an identifier minted at store time.
 */
public interface BatchArchiveStore {

    /**
     * Store an archive and return the identifier it is retrievable under.
     */
    String store(BatchArchive archive);

    /**
     * Look up a previously stored archive.
     */
    Optional<BatchArchive> find(String batchId);
}

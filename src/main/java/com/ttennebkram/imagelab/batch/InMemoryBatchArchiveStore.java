package com.ttennebkram.imagelab.batch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Process-local archive store holding the most recent archives.
 * Nothing survives the process; the oldest archive is evicted once
 * {@code retention} archives are held.
 */
public class InMemoryBatchArchiveStore implements BatchArchiveStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryBatchArchiveStore.class);

    private final int retention;
    private final Map<String, BatchArchive> archives;

    public InMemoryBatchArchiveStore(int retention) {
        if (retention < 1) {
            throw new IllegalArgumentException("retention must be at least 1, got " + retention);
        }
        this.retention = retention;
        this.archives = new LinkedHashMap<String, BatchArchive>(16, 0.75f, false) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, BatchArchive> eldest) {
                boolean evict = size() > InMemoryBatchArchiveStore.this.retention;
                if (evict) {
                    log.debug("Evicting batch archive {}", eldest.getKey());
                }
                return evict;
            }
        };
    }

    @Override
    public synchronized String store(BatchArchive archive) {
        String id = UUID.randomUUID().toString();
        archives.put(id, archive);
        return id;
    }

    @Override
    public synchronized Optional<BatchArchive> find(String batchId) {
        return Optional.ofNullable(archives.get(batchId));
    }

    public synchronized int size() {
        return archives.size();
    }
}

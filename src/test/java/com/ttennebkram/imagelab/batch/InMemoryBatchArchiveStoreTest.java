package com.ttennebkram.imagelab.batch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Collections;
import org.junit.jupiter.api.Test;

class InMemoryBatchArchiveStoreTest {

    private static BatchArchive emptyArchive() {
        return BatchArchive.of(Collections.emptyList());
    }

    @Test
    void testStoreAndFind() {
        InMemoryBatchArchiveStore store = new InMemoryBatchArchiveStore(3);
        BatchArchive archive = emptyArchive();

        String id = store.store(archive);

        assertThat(id).isNotBlank();
        assertThat(store.find(id)).containsSame(archive);
        assertThat(store.find("missing")).isEmpty();
    }

    @Test
    void testIdsAreUnique() {
        InMemoryBatchArchiveStore store = new InMemoryBatchArchiveStore(3);

        assertThat(store.store(emptyArchive())).isNotEqualTo(store.store(emptyArchive()));
    }

    @Test
    void testOldestArchiveIsEvicted() {
        InMemoryBatchArchiveStore store = new InMemoryBatchArchiveStore(2);
        String first = store.store(emptyArchive());
        String second = store.store(emptyArchive());
        String third = store.store(emptyArchive());

        assertThat(store.size()).isEqualTo(2);
        assertThat(store.find(first)).isEmpty();
        assertThat(store.find(second)).isPresent();
        assertThat(store.find(third)).isPresent();
    }

    @Test
    void testRetentionMustBePositive() {
        assertThatThrownBy(() -> new InMemoryBatchArchiveStore(0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testDownloadFileName() {
        assertThat(BatchArchive.fileName("abc")).isEqualTo("batch_processed_abc.zip");
        assertThat(BatchArchive.fileName(null)).isEqualTo("batch_processed.zip");
    }
}

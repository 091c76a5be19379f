package io.avalonrest.server.core.security;

import io.avalonrest.server.spi.BlockRecordStore;
import io.avalonrest.server.spi.BlockedIpRecord;

import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * {@link BlockRecordStore} that keeps the last saved set in memory.
 *
 * <p>Suitable for tests and for deployments where blocks need not survive a restart.
 */
public final class InMemoryBlockRecordStore implements BlockRecordStore {

    private volatile List<BlockedIpRecord> records = List.of();
    private volatile int saves;

    public InMemoryBlockRecordStore() {
    }

    public InMemoryBlockRecordStore(Collection<BlockedIpRecord> initial) {
        this.records = List.copyOf(Objects.requireNonNull(initial, "initial"));
    }

    @Override
    public List<BlockedIpRecord> load() {
        return records;
    }

    @Override
    public synchronized void save(Collection<BlockedIpRecord> records) {
        Objects.requireNonNull(records, "records");
        this.records = List.copyOf(records);
        saves++;
    }

    /**
     * Number of {@link #save} calls so far.
     */
    public int saveCount() {
        return saves;
    }
}

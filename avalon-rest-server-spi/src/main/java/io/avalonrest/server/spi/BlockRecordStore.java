package io.avalonrest.server.spi;

import java.io.Closeable;
import java.io.IOException;
import java.util.Collection;
import java.util.List;

/**
 * Stable storage for {@link BlockedIpRecord}s.
 *
 * <p>The block list rewrites the full set on every mutation and reads it once at startup.
 */
public interface BlockRecordStore extends Closeable {

    /**
     * Returns every stored record, expired ones included; an absent store yields an empty list.
     */
    List<BlockedIpRecord> load() throws IOException;

    /**
     * Replaces the stored records with {@code records}.
     */
    void save(Collection<BlockedIpRecord> records) throws IOException;

    @Override
    default void close() throws IOException {
    }
}

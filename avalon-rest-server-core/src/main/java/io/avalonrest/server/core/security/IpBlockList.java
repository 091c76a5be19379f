package io.avalonrest.server.core.security;

import io.avalonrest.server.spi.BlockRecordStore;
import io.avalonrest.server.spi.BlockedIpRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Temporary address blocks, mirrored to a {@link BlockRecordStore} after every change.
 *
 * <p>Expired blocks are dropped lazily on lookup and by {@link #sweepExpired()}. A failing store
 * is logged and never fails the request that triggered the change.
 */
public final class IpBlockList {

    private static final Logger LOG = LoggerFactory.getLogger(IpBlockList.class);

    private final ConcurrentMap<String, BlockedIpRecord> blocks = new ConcurrentHashMap<>();
    private final BlockRecordStore store;
    private final Clock clock;

    public IpBlockList(BlockRecordStore store, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Replaces the in-memory state with the non-expired records of the store.
     *
     * @return the number of active blocks loaded
     */
    public int load() {
        List<BlockedIpRecord> records;
        try {
            records = store.load();
        } catch (IOException e) {
            LOG.error("Failed to load blocked addresses, starting empty", e);
            return 0;
        }
        Instant now = clock.instant();
        blocks.clear();
        for (BlockedIpRecord r : records) {
            if (!r.isExpired(now)) blocks.put(r.ip(), r);
        }
        LOG.info("Loaded {} active blocked addresses", blocks.size());
        return blocks.size();
    }

    public boolean isBlocked(String ip) {
        return find(ip).isPresent();
    }

    /**
     * The active block of {@code ip}, dropping it if it has expired.
     */
    public Optional<BlockedIpRecord> find(String ip) {
        if (ip == null) return Optional.empty();
        BlockedIpRecord r = blocks.get(ip);
        if (r == null) return Optional.empty();
        if (r.isExpired(clock.instant())) {
            if (blocks.remove(ip, r)) {
                SecurityLogger.ipUnblocked(ip, "Block expired");
                persist();
            }
            return Optional.empty();
        }
        return Optional.of(r);
    }

    /**
     * Blocks {@code ip} for {@code duration}, replacing any existing block.
     */
    public BlockedIpRecord block(String ip, Duration duration, String reason, int violationCount) {
        Objects.requireNonNull(ip, "ip");
        Instant now = clock.instant();
        BlockedIpRecord r = new BlockedIpRecord(ip, now, now.plus(duration), reason, violationCount);
        blocks.put(ip, r);
        SecurityLogger.ipBlocked(ip, reason, r.blockedUntil(), violationCount);
        persist();
        return r;
    }

    /**
     * @return true if a block was removed
     */
    public boolean unblock(String ip, String reason) {
        if (ip == null || blocks.remove(ip) == null) return false;
        SecurityLogger.ipUnblocked(ip, reason);
        persist();
        return true;
    }

    /**
     * Active blocks; expired entries are left for the sweep.
     */
    public List<BlockedIpRecord> all() {
        Instant now = clock.instant();
        List<BlockedIpRecord> out = new ArrayList<>();
        for (BlockedIpRecord r : blocks.values()) {
            if (!r.isExpired(now)) out.add(r);
        }
        return out;
    }

    /**
     * All records currently held, including ones that expired since the last sweep.
     */
    Collection<BlockedIpRecord> records() {
        return blocks.values();
    }

    public int size() {
        return all().size();
    }

    /**
     * Drops expired blocks.
     *
     * @return the number removed
     */
    public int sweepExpired() {
        Instant now = clock.instant();
        int removed = 0;
        for (BlockedIpRecord r : blocks.values()) {
            if (r.isExpired(now) && blocks.remove(r.ip(), r)) {
                SecurityLogger.ipUnblocked(r.ip(), "Block expired");
                removed++;
            }
        }
        if (removed > 0) {
            LOG.debug("Removed {} expired address blocks", removed);
            persist();
        }
        return removed;
    }

    private synchronized void persist() {
        try {
            store.save(new ArrayList<>(blocks.values()));
        } catch (IOException e) {
            LOG.error("Failed to persist {} blocked addresses", blocks.size(), e);
        }
    }
}

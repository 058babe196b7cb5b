package com.agentmesh.engine.memory;

import com.agentmesh.core.exception.VersionConflictException;
import com.agentmesh.core.model.MemoryEntry;
import com.agentmesh.core.model.ScopeKey;
import com.agentmesh.core.model.ScopeType;
import com.agentmesh.core.repository.MemoryRepository;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Versioned, scope-partitioned knowledge store.
 *
 * Every write appends a new version; reads default to the latest. A delete appends a
 * tombstone, after which the key reads as absent while its history stays listable until
 * compaction. There are no cross-key transactions: callers keep compound values under one key.
 */
public class MemoryManager {

    private static final Logger log = LoggerFactory.getLogger(MemoryManager.class);

    private final MemoryRepository repository;
    private final MemorySettings settings;
    private final Clock clock;

    public MemoryManager(MemoryRepository repository, MemorySettings settings, Clock clock) {
        this.repository = repository;
        this.settings = settings;
        this.clock = clock;
    }

    /**
     * Write a new version unconditionally.
     *
     * @return the version assigned to the write
     */
    public long put(ScopeKey key, JsonNode value) {
        Objects.requireNonNull(value, "value");
        return repository.append(key.render(), value, false, clock.instant()).version();
    }

    /**
     * Write a new version only if the key's latest version is still expectedVersion
     * (0 for a key that was never written).
     *
     * @throws VersionConflictException if someone else wrote first
     */
    public long put(ScopeKey key, JsonNode value, long expectedVersion) {
        Objects.requireNonNull(value, "value");
        return repository.appendIfVersion(key.render(), expectedVersion, value, false, clock.instant()).version();
    }

    /**
     * Latest live version, or empty if the key was never written or is tombstoned.
     */
    public Optional<MemoryEntry> get(ScopeKey key) {
        return repository.findLatest(key.render()).filter(e -> !e.tombstone());
    }

    /**
     * Explicit historical read. Tombstone versions read as absent.
     */
    public Optional<MemoryEntry> get(ScopeKey key, long version) {
        return repository.findVersion(key.render(), version).filter(e -> !e.tombstone());
    }

    /**
     * Every retained version, oldest first, tombstones included.
     */
    public List<MemoryEntry> listVersions(ScopeKey key) {
        return repository.findVersions(key.render());
    }

    /**
     * Latest version number including tombstones, 0 if never written.
     */
    public long currentVersion(ScopeKey key) {
        return repository.findLatest(key.render()).map(MemoryEntry::version).orElse(0L);
    }

    /**
     * Tombstone the key. Deleting an absent or already deleted key is a no-op.
     *
     * @return the tombstone version, or the current version if nothing was deleted
     */
    public long delete(ScopeKey key) {
        Optional<MemoryEntry> latest = repository.findLatest(key.render());
        if (latest.isEmpty() || latest.get().tombstone()) {
            return latest.map(MemoryEntry::version).orElse(0L);
        }
        long version = latest.get().version();
        try {
            MemoryEntry tombstone = repository.appendIfVersion(key.render(), version, null, true, clock.instant());
            log.debug("Deleted {} at version {}", key, tombstone.version());
            return tombstone.version();
        } catch (VersionConflictException e) {
            // a concurrent write landed after our read; the delete still wins
            return repository.append(key.render(), null, true, clock.instant()).version();
        }
    }

    /**
     * Live keys of one scope type.
     */
    public List<ScopeKey> listKeys(ScopeType type) {
        return repository.findKeys(ScopeKey.prefixOf(type)).stream()
            .filter(k -> repository.findLatest(k).map(e -> !e.tombstone()).orElse(false))
            .map(ScopeKey::parse)
            .collect(Collectors.toList());
    }

    /**
     * Live keys of one owner (one workflow or one agent).
     */
    public List<ScopeKey> listKeys(ScopeType type, String owner) {
        return listKeys(type).stream()
            .filter(k -> owner.equals(k.owner()))
            .collect(Collectors.toList());
    }

    /**
     * Apply the retention policy: keep the newest {@code retainVersions} versions of every key,
     * and reduce keys tombstoned longer than the grace period to their tombstone alone.
     */
    public CompactionReport compact() {
        Instant tombstoneCutoff = clock.instant().minus(settings.tombstoneGracePeriod());
        int scanned = 0;
        int compacted = 0;
        int removed = 0;

        for (String key : repository.findKeys("")) {
            scanned++;
            List<MemoryEntry> versions = repository.findVersions(key);
            if (versions.size() <= 1) {
                continue;
            }
            MemoryEntry latest = versions.get(versions.size() - 1);
            long keepFrom;
            if (latest.tombstone() && latest.writtenAt().isBefore(tombstoneCutoff)) {
                keepFrom = latest.version();
            } else if (versions.size() > settings.retainVersions()) {
                keepFrom = versions.get(versions.size() - settings.retainVersions()).version();
            } else {
                continue;
            }
            int n = repository.deleteVersionsBefore(key, keepFrom);
            if (n > 0) {
                compacted++;
                removed += n;
            }
        }

        if (removed > 0) {
            log.info("Memory compaction removed {} versions across {} keys ({} scanned)", removed, compacted, scanned);
        }
        return new CompactionReport(scanned, compacted, removed);
    }
}

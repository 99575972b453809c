package io.stakemining.core.state;

import io.stakemining.core.protocol.Fingerprint;
import org.rocksdb.*;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persistent MiningStateStore using RocksDB.
 *
 * Layout (column families):
 *  - "sessions"  : key = fingerprint(32), val = SessionRecord
 *  - "callers"   : key = address(utf8),   val = fingerprint(32)
 *  - "streaks"   : key = address(utf8),   val = lastFinishedAt(8) + count(4)
 *  - "referrals" : key = target(utf8),    val = referrer fingerprints(32 * n)
 *  - "meta"      : key = "pool",          val = activeSessions(8) + activeStake(8)
 *
 * Every change set is written with a single WriteBatch.
 */
public final class RocksDBMiningStateStore implements MiningStateStore, AutoCloseable {

    static {
        RocksDB.loadLibrary();
    }

    private static final byte[] POOL_KEY = "pool".getBytes(StandardCharsets.UTF_8);

    private final RocksDB db;
    private final ColumnFamilyHandle cfSessions;
    private final ColumnFamilyHandle cfCallers;
    private final ColumnFamilyHandle cfStreaks;
    private final ColumnFamilyHandle cfReferrals;
    private final ColumnFamilyHandle cfMeta;
    private final List<ColumnFamilyHandle> handles;
    private final DBOptions dbOptions;

    private RocksDBMiningStateStore(RocksDB db, List<ColumnFamilyHandle> handles, DBOptions dbOptions) {
        this.db = db;
        this.handles = handles;
        this.cfSessions = handles.get(1);
        this.cfCallers = handles.get(2);
        this.cfStreaks = handles.get(3);
        this.cfReferrals = handles.get(4);
        this.cfMeta = handles.get(5);
        this.dbOptions = dbOptions;
    }

    /** Factory: open/create a store in the given directory path. */
    public static RocksDBMiningStateStore open(String dataDir) {
        DBOptions dbOpts = new DBOptions()
                .setCreateIfMissing(true)
                .setCreateMissingColumnFamilies(true);
        List<ColumnFamilyDescriptor> cfDescs = Arrays.asList(
                new ColumnFamilyDescriptor(RocksDB.DEFAULT_COLUMN_FAMILY),
                new ColumnFamilyDescriptor("sessions".getBytes(StandardCharsets.UTF_8)),
                new ColumnFamilyDescriptor("callers".getBytes(StandardCharsets.UTF_8)),
                new ColumnFamilyDescriptor("streaks".getBytes(StandardCharsets.UTF_8)),
                new ColumnFamilyDescriptor("referrals".getBytes(StandardCharsets.UTF_8)),
                new ColumnFamilyDescriptor("meta".getBytes(StandardCharsets.UTF_8))
        );
        List<ColumnFamilyHandle> cfHandles = new ArrayList<>();
        try {
            RocksDB db = RocksDB.open(dbOpts, dataDir, cfDescs, cfHandles);
            return new RocksDBMiningStateStore(db, cfHandles, dbOpts);
        } catch (RocksDBException e) {
            dbOpts.close();
            throw new IllegalStateException("Failed to open RocksDB at " + dataDir, e);
        }
    }

    @Override
    public synchronized Optional<SessionRecord> session(Fingerprint fingerprint) {
        return read(cfSessions, fingerprint.bytes()).map(RecordCodec::decodeSession);
    }

    @Override
    public synchronized Optional<Fingerprint> activeFingerprint(String caller) {
        return read(cfCallers, RecordCodec.utf8(caller)).map(Fingerprint::new);
    }

    @Override
    public synchronized StreakRecord streak(String caller) {
        return read(cfStreaks, RecordCodec.utf8(caller)).map(RecordCodec::decodeStreak).orElse(StreakRecord.NONE);
    }

    @Override
    public synchronized List<Fingerprint> pendingReferrals(String target) {
        return read(cfReferrals, RecordCodec.utf8(target)).map(RecordCodec::decodeFingerprints).orElse(List.of());
    }

    @Override
    public synchronized PoolState pool() {
        return read(cfMeta, POOL_KEY).map(RecordCodec::decodePool).orElse(PoolState.EMPTY);
    }

    @Override
    public synchronized long openSessionCount() {
        try (RocksIterator it = db.newIterator(cfSessions)) {
            long n = 0;
            for (it.seekToFirst(); it.isValid(); it.next()) {
                if (RecordCodec.decodeSession(it.value()).isOpen()) n++;
            }
            return n;
        }
    }

    @Override
    public synchronized StateChanges apply(StateChanges changes) {
        StateChanges undo = new StateChanges();
        try (WriteOptions wo = new WriteOptions().setSync(false);
             WriteBatch batch = new WriteBatch()) {
            for (Map.Entry<Fingerprint, Optional<SessionRecord>> e : changes.sessions().entrySet()) {
                undo.restoreSession(e.getKey(), session(e.getKey()));
                stage(batch, cfSessions, e.getKey().bytes(), e.getValue().map(RecordCodec::encodeSession));
            }
            for (Map.Entry<String, Optional<Fingerprint>> e : changes.callers().entrySet()) {
                undo.restoreCaller(e.getKey(), activeFingerprint(e.getKey()));
                stage(batch, cfCallers, RecordCodec.utf8(e.getKey()), e.getValue().map(Fingerprint::bytes));
            }
            for (Map.Entry<String, Optional<StreakRecord>> e : changes.streaks().entrySet()) {
                undo.restoreStreak(e.getKey(), read(cfStreaks, RecordCodec.utf8(e.getKey())).map(RecordCodec::decodeStreak));
                stage(batch, cfStreaks, RecordCodec.utf8(e.getKey()), e.getValue().map(RecordCodec::encodeStreak));
            }
            for (Map.Entry<String, Optional<List<Fingerprint>>> e : changes.pendingReferrals().entrySet()) {
                undo.restorePendingReferrals(e.getKey(), pendingReferrals(e.getKey()));
                stage(batch, cfReferrals, RecordCodec.utf8(e.getKey()), e.getValue().map(RecordCodec::encodeFingerprints));
            }
            if (changes.pool().isPresent()) {
                undo.pool(pool());
                batch.put(cfMeta, POOL_KEY, RecordCodec.encodePool(changes.pool().get()));
            }
            db.write(wo, batch);
        } catch (RocksDBException e) {
            throw new IllegalStateException("apply failed", e);
        }
        return undo;
    }

    @Override
    public void close() {
        // Close CF handles first, then DB/options
        for (ColumnFamilyHandle handle : handles) {
            handle.close();
        }
        db.close();
        dbOptions.close();
    }

    // -------------- helpers ----------------

    private Optional<byte[]> read(ColumnFamilyHandle cf, byte[] key) {
        try {
            return Optional.ofNullable(db.get(cf, key));
        } catch (RocksDBException e) {
            throw new IllegalStateException("read failed", e);
        }
    }

    private static void stage(WriteBatch batch, ColumnFamilyHandle cf, byte[] key, Optional<byte[]> value)
            throws RocksDBException {
        if (value.isPresent()) {
            batch.put(cf, key, value.get());
        } else {
            batch.delete(cf, key);
        }
    }
}

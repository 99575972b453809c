package io.stakemining.core.state;

import io.stakemining.core.protocol.Amounts;
import io.stakemining.core.protocol.Fingerprint;
import io.stakemining.core.protocol.Hashes;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class RocksDBMiningStateStoreTest {

    private static final Fingerprint ALICE_FP = new Fingerprint(Hashes.hashToField("person-alice"));
    private static final Fingerprint BOB_FP = new Fingerprint(Hashes.hashToField("person-bob"));

    @TempDir
    Path tempDir;

    @Test
    void ledgersSurviveReopen() {
        String dir = tempDir.resolve("db").toString();
        SessionRecord alice = new SessionRecord(1_000L, 3 * Amounts.UNIT, "bob", "alice").withReferredOpenedAt(1_500L);
        SessionRecord bob = new SessionRecord(2_000L, Amounts.UNIT, null, "bob");

        try (RocksDBMiningStateStore store = RocksDBMiningStateStore.open(dir)) {
            store.apply(new StateChanges()
                    .pool(PoolState.EMPTY.admit(alice.stakedAmount()).admit(bob.stakedAmount()))
                    .putSession(ALICE_FP, alice)
                    .putSession(BOB_FP, bob)
                    .putCaller("alice", ALICE_FP)
                    .putCaller("bob", BOB_FP)
                    .putPendingReferrals("carol", List.of(ALICE_FP, BOB_FP))
                    .putStreak("alice", new StreakRecord(900L, 4)));
        }

        try (RocksDBMiningStateStore store = RocksDBMiningStateStore.open(dir)) {
            assertEquals(new PoolState(2, 4 * Amounts.UNIT), store.pool());
            assertEquals(Optional.of(alice), store.session(ALICE_FP));
            assertEquals(Optional.of(bob), store.session(BOB_FP));
            assertEquals(Optional.of(BOB_FP), store.activeFingerprint("bob"));
            assertEquals(List.of(ALICE_FP, BOB_FP), store.pendingReferrals("carol"));
            assertTrue(store.pendingReferrals("bob").isEmpty());
            assertEquals(1_500L, store.session(ALICE_FP).orElseThrow().referredOpenedAt());
            assertEquals(new StreakRecord(900L, 4), store.streak("alice"));
            assertEquals(StreakRecord.NONE, store.streak("bob"));
            assertEquals(2, store.openSessionCount());
        }
    }

    @Test
    void clearingDeletesEntriesAndUndoRestoresThem() {
        try (RocksDBMiningStateStore store = RocksDBMiningStateStore.open(tempDir.resolve("undo").toString())) {
            SessionRecord record = new SessionRecord(500L, Amounts.UNIT, null, "alice");
            store.apply(new StateChanges()
                    .pool(PoolState.EMPTY.admit(Amounts.UNIT))
                    .putSession(ALICE_FP, record)
                    .putCaller("alice", ALICE_FP));

            StateChanges undo = store.apply(new StateChanges()
                    .pool(store.pool().release(Amounts.UNIT))
                    .clearSession(ALICE_FP)
                    .clearCaller("alice")
                    .putStreak("alice", new StreakRecord(600L, 1)));
            assertTrue(store.session(ALICE_FP).isEmpty());
            assertTrue(store.activeFingerprint("alice").isEmpty());
            assertEquals(0, store.openSessionCount());

            store.apply(undo);
            assertEquals(Optional.of(record), store.session(ALICE_FP));
            assertEquals(Optional.of(ALICE_FP), store.activeFingerprint("alice"));
            assertEquals(StreakRecord.NONE, store.streak("alice"));
            assertEquals(new PoolState(1, Amounts.UNIT), store.pool());
        }
    }
}

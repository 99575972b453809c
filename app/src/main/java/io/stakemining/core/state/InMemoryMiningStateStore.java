package io.stakemining.core.state;

import io.stakemining.core.protocol.Fingerprint;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory implementation of MiningStateStore.
 * Not persistent; resets every process run.
 */
public final class InMemoryMiningStateStore implements MiningStateStore {

    private final Map<Fingerprint, SessionRecord> sessions = new HashMap<>();
    private final Map<String, Fingerprint> callers = new HashMap<>();
    private final Map<String, StreakRecord> streaks = new HashMap<>();
    private final Map<String, List<Fingerprint>> pendingReferrals = new HashMap<>();
    private PoolState pool = PoolState.EMPTY;

    @Override
    public synchronized Optional<SessionRecord> session(Fingerprint fingerprint) {
        return Optional.ofNullable(sessions.get(fingerprint));
    }

    @Override
    public synchronized Optional<Fingerprint> activeFingerprint(String caller) {
        return Optional.ofNullable(callers.get(caller));
    }

    @Override
    public synchronized StreakRecord streak(String caller) {
        return streaks.getOrDefault(caller, StreakRecord.NONE);
    }

    @Override
    public synchronized List<Fingerprint> pendingReferrals(String target) {
        return pendingReferrals.getOrDefault(target, List.of());
    }

    @Override
    public synchronized PoolState pool() {
        return pool;
    }

    @Override
    public synchronized long openSessionCount() {
        return sessions.values().stream().filter(SessionRecord::isOpen).count();
    }

    @Override
    public synchronized StateChanges apply(StateChanges changes) {
        StateChanges undo = new StateChanges();
        changes.sessions().forEach((fp, value) -> {
            undo.restoreSession(fp, Optional.ofNullable(sessions.get(fp)));
            write(sessions, fp, value);
        });
        changes.callers().forEach((caller, value) -> {
            undo.restoreCaller(caller, Optional.ofNullable(callers.get(caller)));
            write(callers, caller, value);
        });
        changes.streaks().forEach((caller, value) -> {
            undo.restoreStreak(caller, Optional.ofNullable(streaks.get(caller)));
            write(streaks, caller, value);
        });
        changes.pendingReferrals().forEach((target, value) -> {
            undo.restorePendingReferrals(target, pendingReferrals.getOrDefault(target, List.of()));
            write(pendingReferrals, target, value);
        });
        if (changes.pool().isPresent()) {
            undo.pool(pool);
            pool = changes.pool().get();
        }
        return undo;
    }

    private static <K, V> void write(Map<K, V> map, K key, Optional<V> value) {
        if (value.isPresent()) {
            map.put(key, value.get());
        } else {
            map.remove(key);
        }
    }
}

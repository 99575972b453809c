package io.stakemining.core.state;

import io.stakemining.core.protocol.Fingerprint;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A set of ledger writes applied atomically by a {@link MiningStateStore}. An empty optional
 * deletes the entry. Applying a change set returns its inverse, which restores the prior state.
 */
public final class StateChanges {
    private final Map<Fingerprint, Optional<SessionRecord>> sessions = new LinkedHashMap<>();
    private final Map<String, Optional<Fingerprint>> callers = new LinkedHashMap<>();
    private final Map<String, Optional<StreakRecord>> streaks = new LinkedHashMap<>();
    private final Map<String, Optional<List<Fingerprint>>> pendingReferrals = new LinkedHashMap<>();
    private PoolState pool;

    public StateChanges putSession(Fingerprint fingerprint, SessionRecord record) {
        sessions.put(fingerprint, Optional.of(record));
        return this;
    }

    public StateChanges clearSession(Fingerprint fingerprint) {
        sessions.put(fingerprint, Optional.empty());
        return this;
    }

    public StateChanges putCaller(String caller, Fingerprint fingerprint) {
        callers.put(caller, Optional.of(fingerprint));
        return this;
    }

    public StateChanges clearCaller(String caller) {
        callers.put(caller, Optional.empty());
        return this;
    }

    public StateChanges putStreak(String caller, StreakRecord record) {
        streaks.put(caller, Optional.of(record));
        return this;
    }

    /** Replace the sessions waiting for {@code target} to start; an empty list deletes the entry. */
    public StateChanges putPendingReferrals(String target, List<Fingerprint> referrers) {
        pendingReferrals.put(target, referrers.isEmpty() ? Optional.empty() : Optional.of(List.copyOf(referrers)));
        return this;
    }

    StateChanges restoreSession(Fingerprint fingerprint, Optional<SessionRecord> prior) {
        sessions.put(fingerprint, prior);
        return this;
    }

    StateChanges restoreCaller(String caller, Optional<Fingerprint> prior) {
        callers.put(caller, prior);
        return this;
    }

    StateChanges restoreStreak(String caller, Optional<StreakRecord> prior) {
        streaks.put(caller, prior);
        return this;
    }

    StateChanges restorePendingReferrals(String target, List<Fingerprint> prior) {
        pendingReferrals.put(target, prior.isEmpty() ? Optional.empty() : Optional.of(prior));
        return this;
    }

    public StateChanges pool(PoolState pool) {
        this.pool = pool;
        return this;
    }

    public Map<Fingerprint, Optional<SessionRecord>> sessions() { return Collections.unmodifiableMap(sessions); }
    public Map<String, Optional<Fingerprint>> callers() { return Collections.unmodifiableMap(callers); }
    public Map<String, Optional<StreakRecord>> streaks() { return Collections.unmodifiableMap(streaks); }
    public Map<String, Optional<List<Fingerprint>>> pendingReferrals() { return Collections.unmodifiableMap(pendingReferrals); }
    public Optional<PoolState> pool() { return Optional.ofNullable(pool); }

    public boolean isEmpty() {
        return sessions.isEmpty() && callers.isEmpty() && streaks.isEmpty() && pendingReferrals.isEmpty() && pool == null;
    }
}

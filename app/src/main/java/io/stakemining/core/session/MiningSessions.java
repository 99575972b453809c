package io.stakemining.core.session;

import io.stakemining.core.config.ConfigStore;
import io.stakemining.core.config.MiningConfig;
import io.stakemining.core.identity.IdentityProof;
import io.stakemining.core.identity.IdentityProofVerifier;
import io.stakemining.core.identity.ProofScope;
import io.stakemining.core.metrics.MiningMetrics;
import io.stakemining.core.protocol.Address;
import io.stakemining.core.protocol.Fingerprint;
import io.stakemining.core.protocol.MiningException;
import io.stakemining.core.reward.RewardBreakdown;
import io.stakemining.core.reward.RewardEngine;
import io.stakemining.core.reward.RewardRange;
import io.stakemining.core.reward.SolvencyGuard;
import io.stakemining.core.state.MiningStateStore;
import io.stakemining.core.state.PoolState;
import io.stakemining.core.state.SessionRecord;
import io.stakemining.core.state.StateChanges;
import io.stakemining.core.state.StreakRecord;
import io.stakemining.core.token.FungibleToken;
import io.stakemining.core.token.TransferAuthorization;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Opens and closes mining sessions against the shared ledger.
 *
 * <p>Each public call is one serialized transaction: every precondition is checked before any
 * write, ledger writes are committed before tokens move, and a failed token movement rolls the
 * ledger back to where it was.
 */
public final class MiningSessions {
    private static final Logger LOG = Logger.getLogger(MiningSessions.class.getName());

    private final MiningStateStore store;
    private final ConfigStore config;
    private final FungibleToken spendToken;
    private final FungibleToken rewardToken;
    private final IdentityProofVerifier verifier;
    private final ProofScope scope;
    private final String poolAddress;
    private final Clock clock;
    private final List<SessionListener> listeners = new CopyOnWriteArrayList<>();

    public MiningSessions(MiningStateStore store,
                          ConfigStore config,
                          FungibleToken spendToken,
                          FungibleToken rewardToken,
                          IdentityProofVerifier verifier,
                          ProofScope scope,
                          String poolAddress,
                          Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.config = Objects.requireNonNull(config, "config");
        this.spendToken = Objects.requireNonNull(spendToken, "spendToken");
        this.rewardToken = Objects.requireNonNull(rewardToken, "rewardToken");
        this.verifier = Objects.requireNonNull(verifier, "verifier");
        this.scope = Objects.requireNonNull(scope, "scope");
        this.poolAddress = Address.require(poolAddress, "poolAddress");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public void addListener(SessionListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    /**
     * Lock {@code amount} of the spend token and start a session for the proof's identity.
     *
     * @param referral address nominated for the referral bonus, or {@code null}
     */
    public synchronized SessionOpened openSession(String caller,
                                                  String referral,
                                                  long amount,
                                                  IdentityProof proof,
                                                  TransferAuthorization authorization) {
        Address.require(caller, "caller");
        Objects.requireNonNull(proof, "proof");
        Objects.requireNonNull(authorization, "authorization");
        String referralTarget = (referral == null || referral.isBlank()) ? null : Address.require(referral, "referral");
        try {
            return open(caller, referralTarget, amount, proof, authorization);
        } catch (MiningException e) {
            MiningMetrics.recordRejected("open", e.error());
            throw e;
        }
    }

    private SessionOpened open(String caller, String referralTarget, long amount, IdentityProof proof,
                               TransferAuthorization authorization) {
        MiningConfig cfg = config.get();
        Fingerprint fingerprint = proof.fingerprint();

        // 1) Local checks, cheapest first
        boolean identityBusy = store.session(fingerprint).filter(SessionRecord::isOpen).isPresent();
        if (identityBusy || store.activeFingerprint(caller).isPresent()) {
            throw MiningException.alreadyMining(caller);
        }
        if (caller.equals(referralTarget)) {
            throw MiningException.cannotReferSelf(caller);
        }
        if (amount < cfg.stakeMin() || amount > cfg.stakeMax()) {
            throw new InvalidStakeAmountException(amount, cfg.stakeMin(), cfg.stakeMax());
        }
        PoolState pool = store.pool();
        long required = SolvencyGuard.requiredReserve(cfg, Math.addExact(pool.activeStake(), amount));
        long available = rewardToken.balanceOf(poolAddress);
        if (available < required) {
            throw new InsufficientReserveException(required, available);
        }

        // 2) External identity check
        verifier.verify(proof, caller, scope);

        // 3) Ledger writes
        long now = now();
        StateChanges changes = new StateChanges()
                .pool(pool.admit(amount))
                .putSession(fingerprint, new SessionRecord(now, amount, referralTarget, caller))
                .putCaller(caller, fingerprint);
        markReferrersOf(caller, now, changes);
        if (referralTarget != null) {
            List<Fingerprint> waiting = new ArrayList<>(store.pendingReferrals(referralTarget));
            waiting.add(fingerprint);
            changes.putPendingReferrals(referralTarget, waiting);
        }
        StateChanges undo = store.apply(changes);

        // 4) Stake transfer
        try {
            authorization.collect(spendToken, poolAddress, caller, amount);
        } catch (RuntimeException e) {
            rollBack(undo, e);
            LOG.log(Level.WARNING, "Stake transfer failed for " + caller + ", session rolled back", e);
            throw e;
        }

        SessionOpened event = new SessionOpened(caller, referralTarget, fingerprint, amount, now);
        MiningMetrics.recordOpened(amount);
        LOG.info(() -> "Session opened by " + caller + " stake=" + amount
                + (referralTarget != null ? " referral=" + referralTarget : "")
                + " pool=" + (pool.activeSessions() + 1));
        for (SessionListener listener : listeners) {
            try {
                listener.onOpened(event);
            } catch (RuntimeException e) {
                LOG.log(Level.WARNING, "Session listener failed on open", e);
            }
        }
        return event;
    }

    /** Close the caller's session and pay the reward from the pool treasury. */
    public synchronized SessionFinished closeSession(String caller) {
        Address.require(caller, "caller");
        try {
            return close(caller);
        } catch (MiningException e) {
            MiningMetrics.recordRejected("close", e.error());
            throw e;
        }
    }

    /**
     * Close a session on behalf of its owner after checking the owner's signature. Used where the
     * caller address alone is not proof of who is asking, such as the HTTP API.
     */
    public synchronized SessionFinished closeSession(SignedClose request) {
        Objects.requireNonNull(request, "request");
        String caller = Address.require(request.caller(), "caller");
        try {
            long openedAt = store.activeFingerprint(caller)
                    .flatMap(store::session)
                    .filter(SessionRecord::isOpen)
                    .map(SessionRecord::openedAt)
                    .orElseThrow(() -> MiningException.sessionNotOpen(caller));
            String rejection = request.rejection(poolAddress, openedAt, now());
            if (rejection != null) {
                throw MiningException.closeNotAuthorized(caller, rejection);
            }
            return close(caller);
        } catch (MiningException e) {
            MiningMetrics.recordRejected("close", e.error());
            throw e;
        }
    }

    private SessionFinished close(String caller) {
        Fingerprint fingerprint = store.activeFingerprint(caller)
                .orElseThrow(() -> MiningException.sessionNotOpen(caller));
        SessionRecord session = store.session(fingerprint)
                .filter(SessionRecord::isOpen)
                .orElseThrow(() -> MiningException.sessionNotOpen(caller));

        MiningConfig cfg = config.get();
        long now = now();
        long unlocksAt = Math.addExact(session.openedAt(), cfg.cooldownSeconds());
        if (now < unlocksAt) {
            throw new CooldownNotElapsedException(unlocksAt, now);
        }

        PoolState pool = store.pool();
        RewardBreakdown reward = RewardEngine.price(cfg, pool, session, caller, referredStart(session),
                store.streak(caller), now);

        StateChanges changes = new StateChanges()
                .pool(pool.release(session.stakedAmount()))
                .clearSession(fingerprint)
                .clearCaller(caller)
                .putStreak(caller, new StreakRecord(now, reward.newStreakCount()));
        if (session.awaitingReferral()) {
            List<Fingerprint> waiting = new ArrayList<>(store.pendingReferrals(session.referralTarget()));
            if (waiting.remove(fingerprint)) {
                changes.putPendingReferrals(session.referralTarget(), waiting);
            }
        }
        StateChanges undo = store.apply(changes);

        long total = reward.total();
        if (total > 0) {
            try {
                rewardToken.transfer(poolAddress, caller, total);
            } catch (RuntimeException e) {
                rollBack(undo, e);
                LOG.log(Level.WARNING, "Reward transfer failed for " + caller + ", close rolled back", e);
                throw e;
            }
        }

        SessionFinished event = new SessionFinished(caller, session.referralTarget(), fingerprint, total,
                reward.payout(), reward.referralBonus(), reward.streakBonus(), reward.newStreakCount(),
                reward.referralApplied(), reward.rewardLevel(), session.stakedAmount(), now);
        MiningMetrics.recordClosed(total, reward.referralApplied());
        LOG.info(() -> "Session closed by " + caller + " level=" + reward.rewardLevel() + " payout=" + reward.payout()
                + " referral=" + reward.referralBonus() + " streak=" + reward.streakBonus()
                + " (" + reward.newStreakCount() + ")");
        for (SessionListener listener : listeners) {
            try {
                listener.onFinished(event);
            } catch (RuntimeException e) {
                LOG.log(Level.WARNING, "Session listener failed on close", e);
            }
        }
        return event;
    }

    // -------------------- queries --------------------

    public synchronized SessionStatus status(String caller) {
        Optional<Fingerprint> fingerprint = store.activeFingerprint(caller);
        Optional<SessionRecord> session = fingerprint.flatMap(store::session).filter(SessionRecord::isOpen);
        if (session.isEmpty()) {
            return SessionStatus.idle(caller);
        }
        SessionRecord record = session.get();
        long unlocksAt = record.openedAt() + config.get().cooldownSeconds();
        SessionPhase phase = now() >= unlocksAt ? SessionPhase.CLAIMABLE : SessionPhase.COOLING_DOWN;
        return new SessionStatus(caller, phase, fingerprint.get(), record.openedAt(), unlocksAt,
                record.stakedAmount(), record.referralTarget());
    }

    /** Whether the caller's open session would earn the referral bonus if closed now. */
    public synchronized boolean isReferralEligible(String caller) {
        Optional<SessionRecord> session = store.activeFingerprint(caller)
                .flatMap(store::session)
                .filter(SessionRecord::isOpen);
        return session.isPresent() && RewardEngine.isReferralEligible(session.get(), caller,
                referredStart(session.get()), config.get().cooldownSeconds());
    }

    public RewardRange estimateReward(long stakeAmount) {
        return RewardEngine.estimate(config.get(), stakeAmount);
    }

    public long requiredReserve(long totalActiveStake) {
        return SolvencyGuard.requiredReserve(config.get(), totalActiveStake);
    }

    public synchronized PoolState pool() {
        return store.pool();
    }

    public long treasuryBalance() {
        return rewardToken.balanceOf(poolAddress);
    }

    public MiningConfig config() {
        return config.get();
    }

    public String poolAddress() {
        return poolAddress;
    }

    public ProofScope scope() {
        return scope;
    }

    private long referredStart(SessionRecord session) {
        return session.hasReferral() ? session.referredOpenedAt() : 0L;
    }

    /**
     * Stamp {@code now} on every open session still waiting for {@code target} to start one. A
     * session opened in this same second keeps waiting, since only strictly later starts count.
     */
    private void markReferrersOf(String target, long now, StateChanges changes) {
        List<Fingerprint> waiting = store.pendingReferrals(target);
        if (waiting.isEmpty()) {
            return;
        }
        List<Fingerprint> remaining = new ArrayList<>();
        for (Fingerprint referrer : waiting) {
            Optional<SessionRecord> session = store.session(referrer)
                    .filter(SessionRecord::awaitingReferral)
                    .filter(r -> target.equals(r.referralTarget()));
            if (session.isEmpty()) {
                continue;
            }
            if (now > session.get().openedAt()) {
                changes.putSession(referrer, session.get().withReferredOpenedAt(now));
            } else {
                remaining.add(referrer);
            }
        }
        changes.putPendingReferrals(target, remaining);
    }

    private void rollBack(StateChanges undo, RuntimeException cause) {
        try {
            store.apply(undo);
        } catch (RuntimeException undoFailure) {
            cause.addSuppressed(undoFailure);
            LOG.log(Level.SEVERE, "Rollback failed, ledger may be inconsistent", undoFailure);
        }
    }

    private long now() {
        long now = clock.instant().getEpochSecond();
        if (now <= 0) {
            throw new IllegalStateException("Clock must be past the epoch, got " + now);
        }
        return now;
    }
}

package io.stakemining.core.node;

import io.stakemining.core.admin.MiningAdmin;
import io.stakemining.core.config.ConfigStore;
import io.stakemining.core.config.MiningConfig;
import io.stakemining.core.identity.IdentityProofVerifier;
import io.stakemining.core.metrics.MiningMetrics;
import io.stakemining.core.session.MiningSessions;
import io.stakemining.core.state.InMemoryMiningStateStore;
import io.stakemining.core.state.MiningStateStore;
import io.stakemining.core.state.RocksDBMiningStateStore;
import io.stakemining.core.token.InMemoryFungibleToken;

import java.time.Clock;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Wires state, tokens, identity verification, the session orchestrator and administration.
 * Call start() once to fund the genesis balances.
 */
public final class MiningNode {
    private static final Logger LOG = Logger.getLogger(MiningNode.class.getName());

    public static final String SPEND_SYMBOL = "SPEND";
    public static final String REWARD_SYMBOL = "MINE";

    private final MiningStateStore state;
    private final InMemoryFungibleToken spendToken;
    private final InMemoryFungibleToken rewardToken;
    private final ConfigStore config;
    private final MiningSessions sessions;
    private final MiningAdmin admin;
    private final NodeConfig nodeConfig;
    private boolean started;
    private MiningMetrics.PoolBinding poolGauges;

    public MiningNode(MiningStateStore state, NodeConfig nodeConfig, MiningConfig miningConfig,
                      IdentityProofVerifier verifier, Clock clock) {
        this.state = state;
        this.nodeConfig = nodeConfig;
        this.spendToken = new InMemoryFungibleToken(SPEND_SYMBOL, clock);
        this.rewardToken = new InMemoryFungibleToken(REWARD_SYMBOL, clock, nodeConfig.rewardMaxSupply);
        this.config = new ConfigStore(miningConfig);
        this.sessions = new MiningSessions(state, config, spendToken, rewardToken, verifier,
                nodeConfig.scope, nodeConfig.poolAddress, clock);
        this.admin = new MiningAdmin(config, nodeConfig.administrator);
    }

    /** Convenience factory for an in-memory local node. */
    public static MiningNode inMemory(NodeConfig nodeConfig, MiningConfig miningConfig,
                                      IdentityProofVerifier verifier, Clock clock) {
        return new MiningNode(new InMemoryMiningStateStore(), nodeConfig, miningConfig, verifier, clock);
    }

    /** Convenience factory for a RocksDB-backed node. */
    public static MiningNode rocks(NodeConfig nodeConfig, MiningConfig miningConfig,
                                   IdentityProofVerifier verifier, Clock clock, String dataDir) {
        return new MiningNode(RocksDBMiningStateStore.open(dataDir), nodeConfig, miningConfig, verifier, clock);
    }

    /** Mint the treasury and participant allocations. Safe to call multiple times. */
    public synchronized void start() {
        if (started) {
            return;
        }
        if (nodeConfig.treasuryFunding > 0) {
            rewardToken.mint(nodeConfig.poolAddress, nodeConfig.treasuryFunding);
        }
        if (nodeConfig.spendAllocations != null) {
            for (Map.Entry<String, Long> e : nodeConfig.spendAllocations.entrySet()) {
                long amount = e.getValue() == null ? 0L : e.getValue();
                if (amount > 0) {
                    spendToken.mint(e.getKey(), amount);
                }
            }
        }
        poolGauges = MiningMetrics.bindPool(
                () -> sessions.pool().activeSessions(),
                () -> sessions.pool().activeStake(),
                sessions::treasuryBalance);
        started = true;
        LOG.info(() -> "Mining node started: pool=" + nodeConfig.poolAddress
                + " treasury=" + rewardToken.balanceOf(nodeConfig.poolAddress)
                + " openSessions=" + state.pool().activeSessions());
    }

    /** Unbind pool gauges, then close underlying resources if any (e.g., RocksDB). */
    public synchronized void close() {
        if (poolGauges != null) {
            poolGauges.close();
            poolGauges = null;
        }
        if (state instanceof AutoCloseable closeable) {
            try {
                closeable.close();
            } catch (Exception e) {
                LOG.log(Level.WARNING, "Failed to close state store", e);
            }
        }
    }

    // Properly typed accessors
    public MiningStateStore state() { return state; }
    public InMemoryFungibleToken spendToken() { return spendToken; }
    public InMemoryFungibleToken rewardToken() { return rewardToken; }
    public MiningSessions sessions() { return sessions; }
    public MiningAdmin admin() { return admin; }
    public NodeConfig nodeConfig() { return nodeConfig; }
}

package io.stakemining.core.node;

import io.stakemining.core.identity.ProofScope;
import io.stakemining.core.protocol.Amounts;

import java.util.LinkedHashMap;
import java.util.Map;

/** Simple config holder for a local mining node. */
public final class NodeConfig {
    public final String poolAddress;
    public final String administrator;
    public final long rewardMaxSupply;
    public final long treasuryFunding;
    public final Map<String, Long> spendAllocations;
    public final ProofScope scope;

    public NodeConfig(String poolAddress, String administrator, long rewardMaxSupply, long treasuryFunding,
                      Map<String, Long> spendAllocations, ProofScope scope) {
        if (treasuryFunding < 0 || treasuryFunding > rewardMaxSupply) {
            throw new IllegalArgumentException("treasuryFunding must be within [0, rewardMaxSupply]");
        }
        this.poolAddress = poolAddress;
        this.administrator = administrator;
        this.rewardMaxSupply = rewardMaxSupply;
        this.treasuryFunding = treasuryFunding;
        this.spendAllocations = spendAllocations;
        this.scope = scope;
    }

    public static NodeConfig defaultLocal() {
        Map<String, Long> alloc = new LinkedHashMap<>();
        alloc.put("alice123456", 1_000 * Amounts.UNIT);
        alloc.put("bob654321",     500 * Amounts.UNIT);
        return new NodeConfig(
                "mining-pool",
                "pool-admin",
                21_000_000L * Amounts.UNIT,   // fixed reward-token supply
                1_000_000L * Amounts.UNIT,    // minted to the pool treasury at genesis
                alloc,
                ProofScope.defaultScope()
        );
    }

    public NodeConfig withAdministrator(String administrator) {
        return new NodeConfig(poolAddress, administrator, rewardMaxSupply, treasuryFunding, spendAllocations, scope);
    }

    public NodeConfig withTreasuryFunding(long treasuryFunding) {
        return new NodeConfig(poolAddress, administrator, rewardMaxSupply, treasuryFunding, spendAllocations, scope);
    }

    public NodeConfig withScope(ProofScope scope) {
        return new NodeConfig(poolAddress, administrator, rewardMaxSupply, treasuryFunding, spendAllocations, scope);
    }
}

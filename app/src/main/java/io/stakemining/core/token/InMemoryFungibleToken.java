package io.stakemining.core.token;

import java.time.Clock;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * In-memory implementation of FungibleToken.
 * Tracks balances, allowances and used permit nonces using simple HashMaps.
 * Not persistent; resets every process run.
 */
public final class InMemoryFungibleToken implements FungibleToken {

    private final String symbol;
    private final Clock clock;
    private final long maxSupply;
    private final Map<String, Long> balances = new HashMap<>();
    private final Map<String, Map<String, Long>> allowances = new HashMap<>();
    private final Map<String, Set<Long>> usedNonces = new HashMap<>();
    private long totalSupply;

    public InMemoryFungibleToken(String symbol, Clock clock, long maxSupply) {
        this.symbol = Objects.requireNonNull(symbol, "symbol");
        this.clock = Objects.requireNonNull(clock, "clock");
        if (maxSupply <= 0) {
            throw new IllegalArgumentException("maxSupply must be > 0");
        }
        this.maxSupply = maxSupply;
    }

    public InMemoryFungibleToken(String symbol, Clock clock) {
        this(symbol, clock, Long.MAX_VALUE);
    }

    @Override
    public String symbol() {
        return symbol;
    }

    @Override
    public synchronized long balanceOf(String holder) {
        return balances.getOrDefault(holder, 0L);
    }

    public synchronized long totalSupply() {
        return totalSupply;
    }

    /** Genesis issuance; fails once {@code maxSupply} would be exceeded. */
    public synchronized void mint(String to, long amount) {
        requirePositive(amount);
        if (amount > maxSupply - totalSupply) {
            throw new TokenTransferException(symbol + ": mint of " + amount + " exceeds max supply " + maxSupply);
        }
        totalSupply += amount;
        balances.put(to, balanceOf(to) + amount);
    }

    @Override
    public synchronized void transfer(String sender, String to, long amount) {
        move(sender, to, amount);
    }

    @Override
    public synchronized void approve(String owner, String spender, long amount) {
        if (amount < 0) {
            throw new TokenTransferException(symbol + ": allowance must be >= 0");
        }
        allowances.computeIfAbsent(owner, k -> new HashMap<>()).put(spender, amount);
    }

    @Override
    public synchronized long allowance(String owner, String spender) {
        Map<String, Long> byOwner = allowances.get(owner);
        return byOwner == null ? 0L : byOwner.getOrDefault(spender, 0L);
    }

    @Override
    public synchronized void transferFrom(String spender, String holder, String to, long amount) {
        long allowed = allowance(holder, spender);
        if (allowed < amount) {
            throw new TokenTransferException(symbol + ": allowance " + allowed + " below " + amount);
        }
        move(holder, to, amount);
        allowances.get(holder).put(spender, allowed - amount);
    }

    @Override
    public synchronized void permitTransferFrom(String spender, SignedPermit permit, String holder, String to, long amount) {
        if (clock.instant().getEpochSecond() > permit.deadline()) {
            throw new TokenTransferException(symbol + ": permit expired");
        }
        if (!permit.signerAddress().equals(holder)) {
            throw new TokenTransferException(symbol + ": permit not signed by holder " + holder);
        }
        if (!permit.verifies(symbol, spender)) {
            throw new TokenTransferException(symbol + ": invalid permit signature");
        }
        if (amount > permit.maxAmount()) {
            throw new TokenTransferException(symbol + ": amount " + amount + " exceeds permitted " + permit.maxAmount());
        }
        Set<Long> used = usedNonces.computeIfAbsent(holder, k -> new HashSet<>());
        if (used.contains(permit.nonce())) {
            throw new TokenTransferException(symbol + ": permit nonce " + permit.nonce() + " already used");
        }
        move(holder, to, amount);
        used.add(permit.nonce());
    }

    private void move(String from, String to, long amount) {
        requirePositive(amount);
        long fromBal = balanceOf(from);
        if (fromBal < amount) {
            throw new TokenTransferException(symbol + ": insufficient balance for " + from);
        }
        // debit sender, then credit recipient
        balances.put(from, fromBal - amount);
        balances.put(to, balanceOf(to) + amount);
    }

    private void requirePositive(long amount) {
        if (amount <= 0) {
            throw new TokenTransferException(symbol + ": amount must be > 0");
        }
    }
}

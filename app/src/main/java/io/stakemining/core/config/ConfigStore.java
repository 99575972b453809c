package io.stakemining.core.config;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/** Holds the live configuration snapshot. Readers always get a complete, validated snapshot. */
public final class ConfigStore {
    private final AtomicReference<MiningConfig> current;

    public ConfigStore(MiningConfig initial) {
        this.current = new AtomicReference<>(Objects.requireNonNull(initial, "initial"));
    }

    public MiningConfig get() {
        return current.get();
    }

    /** Apply a change; the updater may throw IllegalArgumentException to reject it. */
    public MiningConfig update(UnaryOperator<MiningConfig> updater) {
        return current.updateAndGet(cfg -> Objects.requireNonNull(updater.apply(cfg), "updated config"));
    }
}

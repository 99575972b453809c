package io.stakemining.core.metrics;

import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.stakemining.core.protocol.MiningError;

import java.util.List;
import java.util.function.Supplier;

public final class MiningMetrics {
    private static final MeterRegistry registry = new SimpleMeterRegistry();
    private static final Counter sessionsOpened = registry.counter("mining.sessions.opened");
    private static final Counter sessionsClosed = registry.counter("mining.sessions.closed");
    private static final Counter referralsPaid = registry.counter("mining.referrals.paid");
    private static final DistributionSummary rewardsPaid = DistributionSummary.builder("mining.rewards.paid")
            .baseUnit("minor")
            .description("Total reward transferred per closed session")
            .register(registry);
    private static final DistributionSummary stakeAdmitted = DistributionSummary.builder("mining.stake.admitted")
            .baseUnit("minor")
            .description("Stake locked per opened session")
            .register(registry);

    private MiningMetrics() {}

    public static void recordOpened(long stake) {
        sessionsOpened.increment();
        stakeAdmitted.record(stake);
    }

    public static void recordClosed(long totalReward, boolean referralApplied) {
        sessionsClosed.increment();
        rewardsPaid.record(totalReward);
        if (referralApplied) {
            referralsPaid.increment();
        }
    }

    public static void recordRejected(String operation, MiningError error) {
        registry.counter("mining.sessions.rejected",
                "operation", operation,
                "error", error.code(),
                "category", error.category().name().toLowerCase(java.util.Locale.ROOT)).increment();
    }

    private static final String[] POOL_GAUGES = {
            "mining.pool.active.sessions", "mining.pool.active.stake", "mining.treasury.balance"
    };

    /**
     * Register pool gauges; the suppliers are sampled on each scrape. Gauges bound earlier by
     * another pool are replaced. Close the returned binding before the suppliers' backing state
     * goes away.
     */
    public static synchronized PoolBinding bindPool(Supplier<Number> activeSessions,
                                                    Supplier<Number> activeStake,
                                                    Supplier<Number> treasury) {
        for (String name : POOL_GAUGES) {
            for (Gauge stale : registry.find(name).gauges()) {
                registry.remove(stale);
            }
        }
        List<Gauge> gauges = List.of(
                Gauge.builder(POOL_GAUGES[0], activeSessions).register(registry),
                Gauge.builder(POOL_GAUGES[1], activeStake).baseUnit("minor").register(registry),
                Gauge.builder(POOL_GAUGES[2], treasury).baseUnit("minor").register(registry));
        return new PoolBinding(gauges);
    }

    /** Pool gauges of one node; closing unregisters them unless another pool has replaced them.
     * Meters compare equal by id, so ownership is checked by identity. */
    public static final class PoolBinding implements AutoCloseable {
        private final List<Gauge> gauges;

        private PoolBinding(List<Gauge> gauges) {
            this.gauges = gauges;
        }

        @Override
        public void close() {
            synchronized (MiningMetrics.class) {
                for (Gauge gauge : gauges) {
                    if (registry.find(gauge.getId().getName()).gauges().stream().anyMatch(g -> g == gauge)) {
                        registry.remove(gauge);
                    }
                }
            }
        }
    }

    /** Time one API request; {@code endpoint} is the mining operation the route serves. */
    public static Timer.Sample startRequest() {
        return Timer.start(registry);
    }

    public static void recordRequest(Timer.Sample sample, String endpoint, String method, int status) {
        Timer timer = Timer.builder("mining.api.requests")
                .description("Mining API request duration")
                .tag("endpoint", endpoint)
                .tag("method", method)
                .tag("outcome", outcome(status))
                .tag("status", Integer.toString(status))
                .register(registry);
        sample.stop(timer);
    }

    private static String outcome(int status) {
        if (status < 400) return "success";
        if (status == 503) return "retry";
        return status < 500 ? "rejected" : "error";
    }

    public static String scrapeMetrics() {
        StringBuilder sb = new StringBuilder();
        for (Meter m : registry.getMeters()) {
            for (Measurement meas : m.measure()) {
                sb.append(m.getId().getName());
                sb.append("{stat=").append(meas.getStatistic());
                for (Tag tag : m.getId().getTags()) {
                    sb.append(',').append(tag.getKey()).append('=').append(tag.getValue());
                }
                sb.append("} ")
                  .append(meas.getValue())
                  .append("\n");
            }
        }
        return sb.toString();
    }

    public static MeterRegistry registry() {
        return registry;
    }
}

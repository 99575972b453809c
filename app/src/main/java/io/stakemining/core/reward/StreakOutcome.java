package io.stakemining.core.reward;

public record StreakOutcome(int newCount, long bonus, boolean maintained) {
}

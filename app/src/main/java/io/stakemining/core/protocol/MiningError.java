package io.stakemining.core.protocol;

/**
 * Named failure codes surfaced by the mining engine. The category tells integrators whether a
 * call may succeed later without changes ({@link Category#CAPACITY}) or needs different input.
 */
public enum MiningError {
    ALREADY_MINING(Category.INPUT),
    CANNOT_REFER_SELF(Category.INPUT),
    INVALID_STAKE_AMOUNT(Category.INPUT),
    SESSION_NOT_OPEN(Category.INPUT),
    COOLDOWN_NOT_ELAPSED(Category.INPUT),
    INVALID_CONFIGURATION(Category.INPUT),
    INSUFFICIENT_RESERVE(Category.CAPACITY),
    PROOF_INVALID(Category.EXTERNAL),
    TRANSFER_FAILED(Category.EXTERNAL),
    NOT_ADMINISTRATOR(Category.ACCESS),
    CLOSE_NOT_AUTHORIZED(Category.ACCESS);

    public enum Category { INPUT, CAPACITY, EXTERNAL, ACCESS }

    private final Category category;

    MiningError(Category category) {
        this.category = category;
    }

    public Category category() {
        return category;
    }

    public boolean retryable() {
        return category == Category.CAPACITY;
    }

    /** Lower-case wire code, e.g. {@code already_mining}. */
    public String code() {
        return name().toLowerCase(java.util.Locale.ROOT);
    }
}

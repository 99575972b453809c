package io.stakemining.core.token;

/**
 * How a holder authorized the pool to pull their stake.
 */
public interface TransferAuthorization {

    /** Pull {@code amount} from {@code holder} into {@code spender}'s account. */
    void collect(FungibleToken token, String spender, String holder, long amount);

    /** Authorization through a prior {@link FungibleToken#approve} call. */
    static TransferAuthorization allowance() {
        return ApprovedAllowance.INSTANCE;
    }

    final class ApprovedAllowance implements TransferAuthorization {
        static final ApprovedAllowance INSTANCE = new ApprovedAllowance();

        private ApprovedAllowance() {}

        @Override
        public void collect(FungibleToken token, String spender, String holder, long amount) {
            token.transferFrom(spender, holder, spender, amount);
        }

        @Override
        public String toString() {
            return "allowance";
        }
    }
}

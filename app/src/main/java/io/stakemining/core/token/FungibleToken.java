package io.stakemining.core.token;

/**
 * Contract of an external fungible-token ledger. The first argument of each mutating call is
 * the account on whose behalf the call is made. Failures throw {@link TokenTransferException}
 * and leave balances unchanged.
 */
public interface FungibleToken {
    String symbol();

    long balanceOf(String holder);

    void transfer(String sender, String to, long amount);

    void approve(String owner, String spender, long amount);

    long allowance(String owner, String spender);

    /** Move {@code amount} from {@code holder} to {@code to}, consuming the spender's allowance. */
    void transferFrom(String spender, String holder, String to, long amount);

    /** Move tokens under a holder-signed permit instead of a prior allowance. */
    void permitTransferFrom(String spender, SignedPermit permit, String holder, String to, long amount);
}

package io.stakemining.core.token;

import io.stakemining.core.protocol.Keys;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.KeyPair;
import java.security.PublicKey;
import java.util.Objects;

/**
 * One-shot, holder-signed permission for a spender to pull up to {@code maxAmount} tokens
 * before {@code deadline} (epoch seconds). Each nonce can be redeemed once per holder.
 */
public final class SignedPermit implements TransferAuthorization {
    private final long maxAmount;
    private final long nonce;
    private final long deadline;
    private final byte[] signature;
    private final PublicKey signer;

    public SignedPermit(long maxAmount, long nonce, long deadline, byte[] signature, PublicKey signer) {
        this.maxAmount = maxAmount;
        this.nonce = nonce;
        this.deadline = deadline;
        this.signature = signature != null ? signature.clone() : new byte[0];
        this.signer = Objects.requireNonNull(signer, "signer");
    }

    public static SignedPermit sign(KeyPair holderKeys, String tokenSymbol, String spender,
                                    long maxAmount, long nonce, long deadline) {
        byte[] message = permitBytes(tokenSymbol, spender, maxAmount, nonce, deadline);
        return new SignedPermit(maxAmount, nonce, deadline, Keys.sign(message, holderKeys.getPrivate()), holderKeys.getPublic());
    }

    static byte[] permitBytes(String tokenSymbol, String spender, long maxAmount, long nonce, long deadline) {
        byte[] sym = tokenSymbol.getBytes(StandardCharsets.UTF_8);
        byte[] sp = spender.getBytes(StandardCharsets.UTF_8);
        return ByteBuffer.allocate(4 + sym.length + 4 + sp.length + 24)
                .putInt(sym.length).put(sym)
                .putInt(sp.length).put(sp)
                .putLong(maxAmount)
                .putLong(nonce)
                .putLong(deadline)
                .array();
    }

    public boolean verifies(String tokenSymbol, String spender) {
        return Keys.verify(permitBytes(tokenSymbol, spender, maxAmount, nonce, deadline), signature, signer);
    }

    /** Address of the key that signed this permit. */
    public String signerAddress() {
        return Keys.deriveAddress(signer);
    }

    @Override
    public void collect(FungibleToken token, String spender, String holder, long amount) {
        token.permitTransferFrom(spender, this, holder, spender, amount);
    }

    public long maxAmount() { return maxAmount; }
    public long nonce() { return nonce; }
    public long deadline() { return deadline; }
    public byte[] signature() { return signature.clone(); }
    public PublicKey signer() { return signer; }

    @Override
    public String toString() {
        return "permit(nonce=" + nonce + ", deadline=" + deadline + ")";
    }
}

package io.stakemining.core.protocol;

import java.util.Arrays;

/**
 * Per-person, per-action identity value issued by the proof-of-personhood oracle.
 * Opaque to the engine; only used as a map key.
 */
public final class Fingerprint {
    public static final int LENGTH = 32;
    private final byte[] bytes;

    public Fingerprint(byte[] bytes) {
        if (bytes == null || bytes.length != LENGTH) {
            throw new IllegalArgumentException("Fingerprint must be 32 bytes");
        }
        this.bytes = bytes.clone();
    }

    public static Fingerprint fromHex(String hex) {
        return new Fingerprint(Hashes.fromHex(hex));
    }

    public byte[] bytes() { return bytes.clone(); }
    public String hex() { return Hashes.toHex(bytes); }

    @Override public boolean equals(Object o){ return o instanceof Fingerprint && Arrays.equals(bytes, ((Fingerprint)o).bytes); }
    @Override public int hashCode(){ return Arrays.hashCode(bytes); }
    @Override public String toString(){ return "Fingerprint("+hex().substring(0,8)+"…)"; }
}

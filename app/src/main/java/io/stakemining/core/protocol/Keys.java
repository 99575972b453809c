package io.stakemining.core.protocol;

import java.security.*;
import java.security.spec.ECGenParameterSpec;
import java.security.spec.X509EncodedKeySpec;

public final class Keys {
    private Keys() {}

    public static KeyPair generate() {
        try {
            KeyPairGenerator gen = KeyPairGenerator.getInstance("EC");
            gen.initialize(new ECGenParameterSpec("secp256r1"), new SecureRandom());
            return gen.generateKeyPair();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("EC key generation unavailable", e);
        }
    }

    public static byte[] sign(byte[] data, PrivateKey priv) {
        try {
            Signature sig = Signature.getInstance("SHA256withECDSA");
            sig.initSign(priv);
            sig.update(data);
            return sig.sign();
        } catch (Exception e) {
            throw new RuntimeException("Signing failed", e);
        }
    }

    public static boolean verify(byte[] data, byte[] signature, PublicKey pub) {
        if (data == null || signature == null || pub == null) {
            return false;
        }
        try {
            Signature sig = Signature.getInstance("SHA256withECDSA");
            sig.initVerify(pub);
            sig.update(data);
            return sig.verify(signature);
        } catch (Exception e) {
            return false;
        }
    }

    public static String deriveAddress(PublicKey pub) {
        byte[] hash = Hashes.sha256(pub.getEncoded());
        // hex string, first 40 chars
        byte[] head = new byte[20];
        System.arraycopy(hash, 0, head, 0, head.length);
        return Hashes.toHex(head);
    }

    public static PublicKey decodePublicKey(byte[] encoded) {
        try {
            return KeyFactory.getInstance("EC").generatePublic(new X509EncodedKeySpec(encoded));
        } catch (GeneralSecurityException e) {
            throw new IllegalArgumentException("Invalid EC public key", e);
        }
    }
}

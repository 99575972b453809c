package io.stakemining.core.protocol;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

public final class Hashes {
    private Hashes(){}

    public static byte[] sha256(byte[] in){
        try {
            return MessageDigest.getInstance("SHA-256").digest(in);
        } catch (NoSuchAlgorithmException e) {
            throw new RuntimeException("SHA-256 not available", e);
        }
    }

    /**
     * SHA-256 shifted right by one byte, so the result always fits a 248-bit field element.
     */
    public static byte[] hashToField(byte[] in) {
        byte[] digest = sha256(in);
        byte[] out = new byte[digest.length];
        System.arraycopy(digest, 0, out, 1, digest.length - 1);
        return out;
    }

    public static byte[] hashToField(String in) {
        return hashToField(in == null ? new byte[0] : in.getBytes(StandardCharsets.UTF_8));
    }

    public static String toHex(byte[] b) {
        final char[] HEX = "0123456789abcdef".toCharArray();
        char[] out = new char[b.length * 2];
        for (int i = 0, j = 0; i < b.length; i++) {
            int v = b[i] & 0xff;
            out[j++] = HEX[v >>> 4];
            out[j++] = HEX[v & 0x0f];
        }
        return new String(out);
    }

    public static byte[] fromHex(String hex) {
        if (hex == null || hex.isBlank()) {
            return new byte[0];
        }
        String normalized = hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
        if (normalized.length() % 2 != 0) {
            normalized = "0" + normalized;
        }
        int len = normalized.length();
        byte[] out = new byte[len / 2];
        for (int i = 0; i < len; i += 2) {
            int hi = Character.digit(normalized.charAt(i), 16);
            int lo = Character.digit(normalized.charAt(i + 1), 16);
            if (hi < 0 || lo < 0) {
                throw new IllegalArgumentException("Value must be hexadecimal");
            }
            out[i / 2] = (byte) ((hi << 4) + lo);
        }
        return out;
    }
}

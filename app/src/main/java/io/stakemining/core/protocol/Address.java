package io.stakemining.core.protocol;

public final class Address {
    public static final int MIN_ADDRESS_LEN = 3;
    public static final int MAX_ADDRESS_LEN = 64;

    private Address(){}

    public static boolean isValid(String addr) {
        if (addr == null) return false;
        int len = addr.length();
        if (len < MIN_ADDRESS_LEN || len > MAX_ADDRESS_LEN) return false;
        for (int i = 0; i < len; i++) {
            char c = addr.charAt(i);
            boolean ok = Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == ':';
            if (!ok) return false;
        }
        return true;
    }

    public static String require(String addr, String field) {
        if (!isValid(addr)) {
            throw new IllegalArgumentException("Invalid address for " + field + ": " + addr);
        }
        return addr;
    }
}

package io.stakemining.core.state;

import io.stakemining.core.protocol.Fingerprint;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/** Binary layouts for ledger records stored in RocksDB. All integers big-endian. */
final class RecordCodec {
    private RecordCodec(){}

    static byte[] encodeSession(SessionRecord r) {
        byte[] referral = utf8(r.referralTarget());
        byte[] owner = utf8(r.owner());
        ByteBuffer buf = ByteBuffer.allocate(8 + 8 + 4 + referral.length + 4 + owner.length + 8);
        buf.putLong(r.openedAt());
        buf.putLong(r.stakedAmount());
        putBytes(buf, referral);
        putBytes(buf, owner);
        buf.putLong(r.referredOpenedAt());
        return buf.array();
    }

    static SessionRecord decodeSession(byte[] bytes) {
        try {
            ByteBuffer buf = ByteBuffer.wrap(bytes);
            long openedAt = buf.getLong();
            long staked = buf.getLong();
            String referral = readString(buf);
            String owner = readString(buf);
            // records written before the referred-start field carry no trailer
            long referredOpenedAt = buf.remaining() >= 8 ? buf.getLong() : 0L;
            return new SessionRecord(openedAt, staked, referral.isEmpty() ? null : referral, owner, referredOpenedAt);
        } catch (RuntimeException ex) {
            throw new IllegalArgumentException("Malformed SessionRecord bytes", ex);
        }
    }

    static byte[] encodeStreak(StreakRecord r) {
        return ByteBuffer.allocate(12).putLong(r.lastFinishedAt()).putInt(r.consecutiveCount()).array();
    }

    static StreakRecord decodeStreak(byte[] bytes) {
        if (bytes.length != 12) {
            throw new IllegalArgumentException("Malformed StreakRecord bytes: length " + bytes.length);
        }
        ByteBuffer buf = ByteBuffer.wrap(bytes);
        return new StreakRecord(buf.getLong(), buf.getInt());
    }

    static byte[] encodePool(PoolState p) {
        return ByteBuffer.allocate(16).putLong(p.activeSessions()).putLong(p.activeStake()).array();
    }

    static PoolState decodePool(byte[] bytes) {
        if (bytes.length != 16) {
            throw new IllegalArgumentException("Malformed PoolState bytes: length " + bytes.length);
        }
        ByteBuffer buf = ByteBuffer.wrap(bytes);
        return new PoolState(buf.getLong(), buf.getLong());
    }

    static byte[] encodeFingerprints(List<Fingerprint> fingerprints) {
        ByteBuffer buf = ByteBuffer.allocate(fingerprints.size() * Fingerprint.LENGTH);
        for (Fingerprint fp : fingerprints) {
            buf.put(fp.bytes());
        }
        return buf.array();
    }

    static List<Fingerprint> decodeFingerprints(byte[] bytes) {
        if (bytes.length % Fingerprint.LENGTH != 0) {
            throw new IllegalArgumentException("Malformed fingerprint list: length " + bytes.length);
        }
        List<Fingerprint> out = new ArrayList<>(bytes.length / Fingerprint.LENGTH);
        for (int off = 0; off < bytes.length; off += Fingerprint.LENGTH) {
            out.add(new Fingerprint(Arrays.copyOfRange(bytes, off, off + Fingerprint.LENGTH)));
        }
        return out;
    }

    static byte[] utf8(String s) {
        return s == null ? new byte[0] : s.getBytes(StandardCharsets.UTF_8);
    }

    private static void putBytes(ByteBuffer buf, byte[] b) {
        buf.putInt(b.length);
        buf.put(b);
    }

    private static String readString(ByteBuffer b) {
        int len = b.getInt();
        if (len < 0 || len > b.remaining()) {
            throw new IllegalArgumentException("Bad length: " + len + " (remaining=" + b.remaining() + ")");
        }
        byte[] out = new byte[len];
        b.get(out);
        return new String(out, StandardCharsets.UTF_8);
    }
}

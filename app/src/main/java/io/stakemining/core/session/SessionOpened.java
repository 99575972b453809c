package io.stakemining.core.session;

import io.stakemining.core.protocol.Fingerprint;

public record SessionOpened(String caller, String referralTarget, Fingerprint fingerprint, long amount, long openedAt) {
}

package com.ironcage.gateway.budget;

import java.time.Instant;

/**
 * Provisional hold on an agent's budget for one in-flight request.
 * Created at admission, resolved exactly once by commit, release or expiry.
 */
public record Reservation(String id, String agentId, long amountMicros, Instant createdAt, Instant expiresAt) {

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }
}

package com.github.salilvnair.coopassist.session;

import com.github.salilvnair.coopassist.engine.model.PendingClarification;
import com.github.salilvnair.coopassist.engine.model.ProductCandidate;
import lombok.Getter;

import java.time.Instant;

/**
 * Per-user dialogue state. Written only inside the session map's per-key compute; read from outside it,
 * hence volatile.
 */
@Getter
public class UserSession {

    private final String userId;
    private volatile PendingClarification pending;
    private volatile ProductCandidate lastProduct;
    private volatile Instant lastSeenAt;

    UserSession(String userId, Instant now) {
        this.userId = userId;
        this.lastSeenAt = now;
    }

    void seen(Instant now) {
        this.lastSeenAt = now;
    }

    void pending(PendingClarification pending) {
        this.pending = pending;
    }

    void lastProduct(ProductCandidate lastProduct) {
        this.lastProduct = lastProduct;
    }

    SessionState state(Instant now) {
        PendingClarification current = pending;
        return current != null && !current.isExpired(now) ? SessionState.AWAITING_SELECTION : SessionState.IDLE;
    }
}

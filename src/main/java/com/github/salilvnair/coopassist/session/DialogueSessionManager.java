package com.github.salilvnair.coopassist.session;

import com.github.salilvnair.coopassist.config.CoopAssistFlowConfig;
import com.github.salilvnair.coopassist.engine.model.PendingClarification;
import com.github.salilvnair.coopassist.engine.model.ProductCandidate;
import com.github.salilvnair.coopassist.engine.model.SelectableOption;
import com.github.salilvnair.coopassist.engine.type.ClarificationKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns pending clarifications and last-resolved context per user. At most one pending clarification
 * exists per user; setting a new one replaces the old. Every mutation runs inside the map's per-key compute,
 * so two messages of the same user never interleave on its session.
 */
@Slf4j
@RequiredArgsConstructor
@Component
public class DialogueSessionManager {

    private final CoopAssistFlowConfig flowConfig;
    private final Clock clock;

    private final ConcurrentHashMap<String, UserSession> sessions = new ConcurrentHashMap<>();

    public Optional<PendingClarification> getPending(String userId) {
        Instant now = clock.instant();
        AtomicReference<PendingClarification> found = new AtomicReference<>();
        sessions.computeIfPresent(userId, (id, session) -> {
            PendingClarification pending = session.getPending();
            if (pending != null && pending.isExpired(now)) {
                log.debug("Co-op Assist: pending clarification for user={} expired", id);
                session.pending(null);
            } else {
                found.set(pending);
            }
            return session;
        });
        return Optional.ofNullable(found.get());
    }

    public PendingClarification setPending(String userId, ClarificationKind kind, List<SelectableOption> options) {
        Instant now = clock.instant();
        PendingClarification pending = new PendingClarification(
                kind, options, now, now.plus(flowConfig.getSession().getPendingTtl()));
        setPending(userId, pending);
        return pending;
    }

    public void setPending(String userId, PendingClarification pending) {
        Instant now = clock.instant();
        sessions.compute(userId, (id, session) -> {
            UserSession target = session == null ? new UserSession(id, now) : session;
            target.pending(pending);
            target.seen(now);
            return target;
        });
    }

    public void clearPending(String userId) {
        Instant now = clock.instant();
        sessions.computeIfPresent(userId, (id, session) -> {
            session.pending(null);
            session.seen(now);
            return session;
        });
    }

    public Optional<ProductCandidate> getLastContext(String userId) {
        UserSession session = sessions.get(userId);
        return session == null ? Optional.empty() : Optional.ofNullable(session.getLastProduct());
    }

    public void setLastContext(String userId, ProductCandidate product) {
        Instant now = clock.instant();
        sessions.compute(userId, (id, session) -> {
            UserSession target = session == null ? new UserSession(id, now) : session;
            target.lastProduct(product);
            target.seen(now);
            return target;
        });
    }

    public void touch(String userId) {
        Instant now = clock.instant();
        sessions.compute(userId, (id, session) -> {
            UserSession target = session == null ? new UserSession(id, now) : session;
            target.seen(now);
            return target;
        });
    }

    public SessionState state(String userId) {
        UserSession session = sessions.get(userId);
        return session == null ? SessionState.IDLE : session.state(clock.instant());
    }

    /** Drops whole sessions idle longer than the configured idle TTL. */
    public int evictIdle() {
        Instant cutoff = clock.instant().minus(flowConfig.getSession().getIdleTtl());
        int evicted = 0;
        for (String userId : List.copyOf(sessions.keySet())) {
            AtomicReference<Boolean> removed = new AtomicReference<>(false);
            sessions.computeIfPresent(userId, (id, session) -> {
                if (session.getLastSeenAt().isBefore(cutoff)) {
                    removed.set(true);
                    return null;
                }
                return session;
            });
            if (removed.get()) {
                evicted++;
            }
        }
        return evicted;
    }

    public int activeSessions() {
        return sessions.size();
    }
}

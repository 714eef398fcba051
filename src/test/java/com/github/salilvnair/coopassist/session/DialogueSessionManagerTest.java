package com.github.salilvnair.coopassist.session;

import com.github.salilvnair.coopassist.engine.model.PendingClarification;
import com.github.salilvnair.coopassist.engine.model.ProductCandidate;
import com.github.salilvnair.coopassist.engine.model.SelectableOption;
import com.github.salilvnair.coopassist.engine.type.ClarificationKind;
import com.github.salilvnair.coopassist.support.ConcurrentRunner;
import com.github.salilvnair.coopassist.support.CoopAssistFixtures;
import com.github.salilvnair.coopassist.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static com.github.salilvnair.coopassist.support.TestConstants.KEY_STRAWBERRY;
import static com.github.salilvnair.coopassist.support.TestConstants.NAME_STRAWBERRY;
import static com.github.salilvnair.coopassist.support.TestConstants.USER_ALICE;
import static com.github.salilvnair.coopassist.support.TestConstants.USER_BOB;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DialogueSessionManagerTest {

    private MutableClock clock;
    private DialogueSessionManager sessions;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAtEpochDay();
        sessions = new DialogueSessionManager(CoopAssistFixtures.flowConfig(), clock);
    }

    @Test
    void pendingClarificationExpiresAfterTenMinutes() {
        sessions.setPending(USER_ALICE, ClarificationKind.PRODUCT, options());

        clock.advance(Duration.ofMinutes(9));
        assertEquals(SessionState.AWAITING_SELECTION, sessions.state(USER_ALICE));
        assertTrue(sessions.getPending(USER_ALICE).isPresent());

        clock.advance(Duration.ofMinutes(2));
        assertEquals(SessionState.IDLE, sessions.state(USER_ALICE));
        assertTrue(sessions.getPending(USER_ALICE).isEmpty());
    }

    @Test
    void newClarificationReplacesTheOldOne() {
        sessions.setPending(USER_ALICE, ClarificationKind.PRODUCT, options());
        sessions.setPending(USER_ALICE, ClarificationKind.POLICY_CATEGORY,
                List.of(new SelectableOption("付款方式", "policy_category:payment")));

        PendingClarification pending = sessions.getPending(USER_ALICE).orElseThrow();

        assertEquals(ClarificationKind.POLICY_CATEGORY, pending.kind());
        assertEquals(1, pending.options().size());
    }

    @Test
    void usersDoNotShareState() {
        sessions.setPending(USER_ALICE, ClarificationKind.PRODUCT, options());

        assertEquals(SessionState.IDLE, sessions.state(USER_BOB));
        sessions.clearPending(USER_ALICE);
        assertEquals(SessionState.IDLE, sessions.state(USER_ALICE));
    }

    @Test
    void lastContextIsRemembered() {
        sessions.setLastContext(USER_ALICE, new ProductCandidate(KEY_STRAWBERRY, NAME_STRAWBERRY, "2lb/盒", "水果", 1.0d));

        assertEquals(KEY_STRAWBERRY, sessions.getLastContext(USER_ALICE).orElseThrow().key());
        assertTrue(sessions.getLastContext(USER_BOB).isEmpty());
    }

    @Test
    void idleSessionsAreEvicted() {
        sessions.touch(USER_ALICE);
        clock.advance(Duration.ofMinutes(30));
        sessions.touch(USER_BOB);
        clock.advance(Duration.ofMinutes(31));

        assertEquals(1, sessions.evictIdle());
        assertEquals(1, sessions.activeSessions());
        assertTrue(sessions.getLastContext(USER_ALICE).isEmpty());
    }

    @Test
    void racingSetAndClearLeaveAConsistentSession() throws Exception {
        ConcurrentRunner.run(8, t -> {
            for (int i = 0; i < 500; i++) {
                if ((t + i) % 2 == 0) {
                    sessions.setPending(USER_ALICE, ClarificationKind.PRODUCT, options());
                } else {
                    sessions.clearPending(USER_ALICE);
                }
                sessions.getPending(USER_ALICE).ifPresent(p -> {
                    assertEquals(ClarificationKind.PRODUCT, p.kind());
                    assertEquals(2, p.options().size());
                });
            }
        });

        assertEquals(sessions.getPending(USER_ALICE).isPresent(),
                sessions.state(USER_ALICE) == SessionState.AWAITING_SELECTION);
        sessions.clearPending(USER_ALICE);
        assertEquals(SessionState.IDLE, sessions.state(USER_ALICE));
        assertEquals(1, sessions.activeSessions());
    }

    @Test
    void concurrentPendingAndContextWritesDoNotOverwriteEachOther() throws Exception {
        ProductCandidate strawberry = new ProductCandidate(KEY_STRAWBERRY, NAME_STRAWBERRY, "2lb/盒", "水果", 1.0d);

        ConcurrentRunner.run(8, t -> {
            for (int i = 0; i < 200; i++) {
                String user = "user-" + (i % 20);
                if (t % 2 == 0) {
                    sessions.setPending(user, ClarificationKind.PRODUCT, options());
                } else {
                    sessions.setLastContext(user, strawberry);
                }
            }
        });

        assertEquals(20, sessions.activeSessions());
        for (int u = 0; u < 20; u++) {
            String user = "user-" + u;
            assertTrue(sessions.getPending(user).isPresent(), user);
            assertEquals(KEY_STRAWBERRY, sessions.getLastContext(user).orElseThrow().key());
            assertEquals(SessionState.AWAITING_SELECTION, sessions.state(user));
        }
        assertFalse(sessions.getPending(USER_BOB).isPresent());
    }

    private static List<SelectableOption> options() {
        return List.of(
                new SelectableOption("土鸡 (约2.5lb/只)", "product_selection:farm-chicken"),
                new SelectableOption("鸡翅 (2lb/袋)", "product_selection:chicken-wings"));
    }
}

package com.github.salilvnair.coopassist.session;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@RequiredArgsConstructor
@Component
public class SessionHousekeeping {

    private final DialogueSessionManager sessions;

    @Scheduled(
            initialDelayString = "${coopassist.flow.session.housekeeping-interval-ms:300000}",
            fixedDelayString = "${coopassist.flow.session.housekeeping-interval-ms:300000}"
    )
    public void evictIdleSessions() {
        int evicted = sessions.evictIdle();
        if (evicted > 0) {
            log.info("Co-op Assist: evicted {} idle sessions, {} remain.", evicted, sessions.activeSessions());
        }
    }
}

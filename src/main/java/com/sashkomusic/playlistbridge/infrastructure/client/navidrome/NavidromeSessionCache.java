package com.sashkomusic.playlistbridge.infrastructure.client.navidrome;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-wide Navidrome session. Concurrent callers that find the session missing or
 * expiring share a single login.
 */
@Slf4j
@Component
public class NavidromeSessionCache {

    static final Duration REFRESH_MARGIN = Duration.ofMinutes(5);

    private final NavidromeAuthClient authClient;
    private final Clock clock;
    private final ReentrantLock refreshLock = new ReentrantLock();

    private volatile NavidromeSession session;

    public NavidromeSessionCache(NavidromeAuthClient authClient, Clock clock) {
        this.authClient = authClient;
        this.clock = clock;
    }

    public NavidromeSession current() {
        NavidromeSession cached = session;
        if (cached != null && cached.isUsableAt(clock.instant(), REFRESH_MARGIN)) {
            return cached;
        }

        refreshLock.lock();
        try {
            cached = session;
            if (cached != null && cached.isUsableAt(clock.instant(), REFRESH_MARGIN)) {
                return cached;
            }
            log.debug("Refreshing Navidrome session");
            session = authClient.login();
            return session;
        } finally {
            refreshLock.unlock();
        }
    }

    /**
     * Drops {@code rejected} after the server refused it. A session that another caller has
     * already replaced is left alone.
     */
    public void invalidate(NavidromeSession rejected) {
        refreshLock.lock();
        try {
            if (session == rejected) {
                session = null;
            }
        } finally {
            refreshLock.unlock();
        }
    }
}

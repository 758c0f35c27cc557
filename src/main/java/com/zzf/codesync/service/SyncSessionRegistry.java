package com.zzf.codesync.service;

import com.zzf.codesync.config.SyncProperties;
import com.zzf.codesync.model.SyncErrorCode;
import com.zzf.codesync.model.SyncException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * At most one open session per project. Opening a new one supersedes the previous session,
 * whose further calls then fail with {@code UNKNOWN_SESSION}.
 */
@Slf4j
@Component
public class SyncSessionRegistry {

    private final Map<String, SyncSession> open = new ConcurrentHashMap<>();
    private final long ttlMs;

    @Autowired
    public SyncSessionRegistry(SyncProperties properties) {
        this(properties.getServer().getSessionTtlMs());
    }

    SyncSessionRegistry(long ttlMs) {
        this.ttlMs = ttlMs;
    }

    /**
     * Returns the session this one supersedes, or null.
     */
    public SyncSession open(SyncSession session) {
        SyncSession previous = open.put(session.getProjectKey(), session);
        if (previous != null) {
            log.info("session.superseded projectId={} sessionId={} by={}", previous.getProjectId(), previous.getSessionId(), session.getSessionId());
        }
        return previous;
    }

    public SyncSession require(String projectKey, String sessionId) {
        SyncSession s = open.get(projectKey);
        if (s == null || sessionId == null || !s.getSessionId().equals(sessionId)) {
            throw new SyncException(SyncErrorCode.UNKNOWN_SESSION, "no open session " + sessionId + " for project");
        }
        s.touch(System.currentTimeMillis());
        return s;
    }

    public void close(SyncSession session) {
        open.remove(session.getProjectKey(), session);
    }

    public int size() {
        return open.size();
    }

    /**
     * Chunk hashes that open sessions have stored or reference through accepted paths. Callers
     * hold the store write lock so no session is adding to them meanwhile.
     */
    public Set<String> referencedHashes() {
        Set<String> out = new HashSet<>();
        for (SyncSession s : open.values()) {
            out.addAll(s.getStoredHashes());
            for (List<String> hashes : s.getAccepted().values()) {
                out.addAll(hashes);
            }
        }
        return out;
    }

    public List<SyncSession> expireIdle(long now) {
        List<SyncSession> expired = new ArrayList<>();
        Iterator<SyncSession> it = open.values().iterator();
        while (it.hasNext()) {
            SyncSession s = it.next();
            if (now - s.getLastTouched() > ttlMs && open.remove(s.getProjectKey(), s)) {
                expired.add(s);
                log.info("session.expired projectId={} sessionId={} idleMs={}", s.getProjectId(), s.getSessionId(), now - s.getLastTouched());
            }
        }
        return expired;
    }
}

package com.zzf.codesync.service;

import com.zzf.codesync.core.index.EmbeddingRecord;
import com.zzf.codesync.core.index.EmbeddingStore;
import com.zzf.codesync.core.merkle.ChangeSet;
import com.zzf.codesync.core.merkle.MerkleTree;
import com.zzf.codesync.core.merkle.MerkleTreeBuilder;
import com.zzf.codesync.core.merkle.TreeDiffer;
import com.zzf.codesync.core.merkle.TreeSnapshotCodec;
import com.zzf.codesync.core.pipeline.EmbeddingPipeline;
import com.zzf.codesync.core.pipeline.IngestOutcome;
import com.zzf.codesync.core.util.ProjectKeys;
import com.zzf.codesync.core.util.Sha256;
import com.zzf.codesync.model.EncryptionException;
import com.zzf.codesync.model.HashMismatchException;
import com.zzf.codesync.model.SyncErrorCode;
import com.zzf.codesync.model.SyncException;
import com.zzf.codesync.protocol.CommitRequest;
import com.zzf.codesync.protocol.CommitResponse;
import com.zzf.codesync.protocol.FilePayload;
import com.zzf.codesync.protocol.NegotiateRequest;
import com.zzf.codesync.protocol.NegotiateResponse;
import com.zzf.codesync.protocol.ProbeRequest;
import com.zzf.codesync.protocol.ProbeResponse;
import com.zzf.codesync.protocol.PushChangesRequest;
import com.zzf.codesync.protocol.PushChangesResponse;
import com.zzf.codesync.protocol.PushRemovalsRequest;
import com.zzf.codesync.protocol.PushRemovalsResponse;
import com.zzf.codesync.protocol.RejectedPath;
import com.zzf.codesync.protocol.UpsertEmbeddingResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Server role of the sync protocol. All calls for one project run under that project's lock;
 * the acknowledged snapshot and chunk ledger change only inside {@link #commit}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SyncServerService {

    private final ProjectRegistryService projects;
    private final SyncSessionRegistry sessions;
    private final EmbeddingPipeline pipeline;
    private final EmbeddingStore embeddingStore;
    private final TreeDiffer differ;
    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    // ingest holds the read side, deleting embeddings the write side
    private final ReentrantReadWriteLock storeGuard = new ReentrantReadWriteLock();

    public ProbeResponse probe(ProbeRequest request) {
        requireProjectId(request == null ? null : request.getProjectId());
        String ack = acknowledgedRootHash(request.getProjectId());
        boolean upToDate = ack.equals(request.getRootHash());
        log.info("sync.probe projectId={} clientRoot={} ackRoot={} upToDate={}", request.getProjectId(), request.getRootHash(), ack, upToDate);
        return new ProbeResponse(upToDate, ack);
    }

    public NegotiateResponse negotiate(NegotiateRequest request) {
        requireProjectId(request == null ? null : request.getProjectId());
        if (request.getSnapshot() == null) {
            throw new SyncException(SyncErrorCode.INVALID_REQUEST, "snapshot is required");
        }
        MerkleTree clientTree = TreeSnapshotCodec.fromSnapshot(request.getSnapshot());
        ProjectRecord record = projects.ensure(request.getProjectId());
        String key = record.getProjectKey();
        return withLock(key, () -> {
            long t0 = System.nanoTime();
            MerkleTree acknowledged = projects.acknowledgedTree(key);
            Set<String> held = new TreeSet<>();
            MerkleTree effective = holdUnreadable(clientTree, acknowledged, request.getUnreadablePaths(), held);
            ChangeSet changes = differ.diff(acknowledged, effective);
            SyncSession session = new SyncSession(UUID.randomUUID().toString(), request.getProjectId(), key,
                    effective, acknowledged, changes, held, System.currentTimeMillis());
            SyncSession superseded = sessions.open(session);
            if (superseded != null) {
                discard(superseded, "superseded");
            }
            log.info("sync.negotiate ok projectId={} sessionId={} added={} modified={} removed={} held={} tookMs={}",
                    request.getProjectId(), session.getSessionId(), changes.getAdded().size(), changes.getModified().size(),
                    changes.getRemoved().size(), held.size(), (System.nanoTime() - t0) / 1_000_000L);
            return NegotiateResponse.of(session.getSessionId(), changes);
        });
    }

    public PushChangesResponse pushChanges(PushChangesRequest request) {
        requireProjectId(request == null ? null : request.getProjectId());
        String key = ProjectKeys.projectKey(request.getProjectId());
        return withLock(key, () -> {
            SyncSession session = sessions.require(key, request.getSessionId());
            List<String> accepted = new ArrayList<>();
            List<RejectedPath> rejected = new ArrayList<>();
            List<String> warnings = new ArrayList<>();
            long t0 = System.nanoTime();
            for (FilePayload file : request.getFiles()) {
                RejectedPath rejection = check(session, file);
                if (rejection != null) {
                    session.reject(rejection);
                    rejected.add(rejection);
                    log.warn("sync.push.reject projectId={} path={} code={}", session.getProjectId(), rejection.getPath(), rejection.getCode());
                    continue;
                }
                IngestOutcome outcome;
                try {
                    outcome = ingest(session, file);
                } catch (EncryptionException e) {
                    sessions.close(session);
                    log.error("sync.push.abort projectId={} sessionId={} path={} err={}", session.getProjectId(), session.getSessionId(), file.getPath(), e.getMessage());
                    discard(session, "aborted");
                    throw e;
                }
                warnings.addAll(outcome.getWarnings());
                if (outcome.isAccepted()) {
                    accepted.add(file.getPath());
                } else {
                    RejectedPath r = new RejectedPath(file.getPath(), outcome.getRejectCode(), outcome.getRejectReason());
                    session.reject(r);
                    rejected.add(r);
                }
            }
            log.info("sync.push ok projectId={} sessionId={} files={} accepted={} rejected={} tookMs={}",
                    session.getProjectId(), session.getSessionId(), request.getFiles().size(), accepted.size(), rejected.size(),
                    (System.nanoTime() - t0) / 1_000_000L);
            return new PushChangesResponse(accepted, rejected, warnings);
        });
    }

    public PushRemovalsResponse pushRemovals(PushRemovalsRequest request) {
        requireProjectId(request == null ? null : request.getProjectId());
        String key = ProjectKeys.projectKey(request.getProjectId());
        return withLock(key, () -> {
            SyncSession session = sessions.require(key, request.getSessionId());
            int staged = 0;
            for (String path : request.getPaths()) {
                if (session.getChangeSet().getRemoved().contains(path)) {
                    session.stageRemoval(path);
                    staged++;
                } else {
                    log.warn("sync.remove.ignored projectId={} path={} reason=not_negotiated", session.getProjectId(), path);
                }
            }
            log.info("sync.remove ok projectId={} sessionId={} staged={}", session.getProjectId(), session.getSessionId(), staged);
            return new PushRemovalsResponse(true, staged);
        });
    }

    public CommitResponse commit(CommitRequest request) {
        requireProjectId(request == null ? null : request.getProjectId());
        String key = ProjectKeys.projectKey(request.getProjectId());
        return withLock(key, () -> {
            long t0 = System.nanoTime();
            SyncSession session = sessions.require(key, request.getSessionId());
            ChangeSet changes = session.getChangeSet();
            Map<String, List<String>> accepted = session.getAccepted();
            SortedMap<String, String> previousLeaves = session.getAcknowledgedTree() == null
                    ? new TreeMap<String, String>() : session.getAcknowledgedTree().leafHashes();

            TreeMap<String, String> leaves = new TreeMap<>(session.getClientTree().leafHashes());
            Set<String> pending = new TreeSet<>();
            for (String path : changes.changedPaths()) {
                if (accepted.containsKey(path)) {
                    continue;
                }
                pending.add(path);
                String prev = previousLeaves.get(path);
                if (prev == null) {
                    leaves.remove(path);
                } else {
                    leaves.put(path, prev);
                }
            }
            for (String path : changes.getRemoved()) {
                if (session.getStagedRemovals().contains(path)) {
                    continue;
                }
                if (conflicts(leaves, path)) {
                    log.warn("sync.commit.drop projectId={} path={} reason=replaced_by_directory", session.getProjectId(), path);
                    continue;
                }
                pending.add(path);
                leaves.put(path, previousLeaves.get(path));
            }
            pending.addAll(session.getHeldPaths());
            MerkleTree acknowledged = MerkleTreeBuilder.fromLeaves(leaves);

            ProjectRecord current = projects.ensure(session.getProjectId());
            Map<String, List<String>> previousLedger = current.getPathChunks() == null
                    ? Collections.<String, List<String>>emptyMap() : current.getPathChunks();
            Map<String, List<String>> ledger = new TreeMap<>();
            for (String path : leaves.keySet()) {
                List<String> hashes = accepted.get(path);
                if (hashes == null) {
                    hashes = previousLedger.get(path);
                }
                ledger.put(path, hashes == null ? Collections.<String>emptyList() : new ArrayList<>(hashes));
            }
            ProjectRecord updated = current.toBuilder()
                    .acknowledgedRootHash(acknowledged.getRootHash())
                    .lastSync(System.currentTimeMillis())
                    .fileCount(acknowledged.fileCount())
                    .pathChunks(ledger)
                    .build();
            projects.publish(updated, acknowledged);
            sessions.close(session);

            int evicted = evict(key, previousLedger, session.getStoredHashes(), ledger);
            List<RejectedPath> rejected = new ArrayList<>(session.getRejected().values());
            log.info("sync.commit ok projectId={} sessionId={} root={} accepted={} rejected={} pending={} evicted={} retries={} tookMs={}",
                    session.getProjectId(), session.getSessionId(), acknowledged.getRootHash(), accepted.size(), rejected.size(),
                    pending.size(), evicted, session.getRetryCount(), (System.nanoTime() - t0) / 1_000_000L);
            return new CommitResponse(true, acknowledged.getRootHash(), new ArrayList<>(accepted.keySet()), rejected,
                    new ArrayList<>(pending), evicted);
        });
    }

    public UpsertEmbeddingResponse upsertEmbedding(EmbeddingRecord record) {
        if (record == null || !Sha256.isDigest(record.getChunkHash())) {
            throw new SyncException(SyncErrorCode.INVALID_REQUEST, "chunkHash must be a sha-256 hex digest");
        }
        if (record.getEncryptedVector() == null || record.getEncryptedVector().length == 0
                || record.getNonce() == null || record.getNonce().length != 12 || record.getKeyId() == null) {
            throw new SyncException(SyncErrorCode.INVALID_REQUEST, "encryptedVector, 12-byte nonce and keyId are required");
        }
        boolean stored = embeddingStore.upsert(record);
        log.info("embedding.upsert chunkHash={} keyId={} stored={}", record.getChunkHash(), record.getKeyId(), stored);
        return new UpsertEmbeddingResponse(stored);
    }

    /**
     * Embeds one file and records its chunk hashes in the session. Eviction cannot run in
     * between, so a chunk skipped as already stored is still there when the session references it.
     */
    private IngestOutcome ingest(SyncSession session, FilePayload file) {
        storeGuard.readLock().lock();
        try {
            IngestOutcome outcome = pipeline.ingest(file.getPath(), file.getContent());
            session.recordStored(outcome.getStoredHashes());
            if (outcome.isAccepted()) {
                session.accept(file.getPath(), outcome.getChunkHashes());
            }
            return outcome;
        } finally {
            storeGuard.readLock().unlock();
        }
    }

    private RejectedPath check(SyncSession session, FilePayload file) {
        if (file == null || file.getPath() == null) {
            return new RejectedPath(file == null ? null : file.getPath(), SyncErrorCode.INVALID_REQUEST, "path is required");
        }
        if (!session.expects(file.getPath(), file.getClaimedHash())) {
            return new RejectedPath(file.getPath(), SyncErrorCode.NOT_IN_CHANGE_SET,
                    "path with claimed hash " + file.getClaimedHash() + " was not negotiated in this session");
        }
        if (file.getContent() == null) {
            return new RejectedPath(file.getPath(), SyncErrorCode.INVALID_REQUEST, "content is required");
        }
        String actual = Sha256.hex(file.getContent());
        if (!actual.equals(file.getClaimedHash())) {
            HashMismatchException e = new HashMismatchException(file.getPath(), file.getClaimedHash(), actual);
            return new RejectedPath(e.getPath(), e.getErrorCode(), e.getMessage());
        }
        return null;
    }

    /**
     * Deletes chunk embeddings that neither this project's new ledger, any other project nor an
     * open session references. Runs after the snapshot is persisted; a failure here only leaves orphans.
     */
    private int evict(String key, Map<String, List<String>> previousLedger, Set<String> stored, Map<String, List<String>> ledger) {
        Set<String> candidates = new HashSet<>(stored);
        for (List<String> hashes : previousLedger.values()) {
            candidates.addAll(hashes);
        }
        for (List<String> hashes : ledger.values()) {
            candidates.removeAll(hashes);
        }
        if (candidates.isEmpty()) {
            return 0;
        }
        storeGuard.writeLock().lock();
        try {
            candidates.removeAll(projects.referencedHashesExcept(key));
            candidates.removeAll(sessions.referencedHashes());
            return delete(candidates, "evict");
        } finally {
            storeGuard.writeLock().unlock();
        }
    }

    /**
     * Drops embeddings stored by a session that will never commit, keeping those any ledger or
     * open session references. The session must already be out of the registry.
     */
    private int discard(SyncSession session, String reason) {
        Set<String> candidates = new HashSet<>(session.getStoredHashes());
        int removed = 0;
        if (!candidates.isEmpty()) {
            storeGuard.writeLock().lock();
            try {
                candidates.removeAll(projects.referencedHashes());
                candidates.removeAll(sessions.referencedHashes());
                removed = delete(candidates, "discard");
            } finally {
                storeGuard.writeLock().unlock();
            }
        }
        log.info("sync.session.discard projectId={} sessionId={} reason={} stored={} removed={}",
                session.getProjectId(), session.getSessionId(), reason, session.getStoredHashes().size(), removed);
        return removed;
    }

    private int delete(Set<String> hashes, String op) {
        if (hashes.isEmpty()) {
            return 0;
        }
        try {
            return embeddingStore.delete(hashes);
        } catch (SyncException e) {
            log.warn("sync.{} failed store={} candidates={} err={}", op, embeddingStore.name(), hashes.size(), e.getMessage());
            return 0;
        }
    }

    /**
     * Expires idle sessions and drops what they stored.
     */
    @Scheduled(fixedDelayString = "${codesync.server.session-sweep-ms:60000}")
    public void sweepSessions() {
        expireSessions(System.currentTimeMillis());
    }

    int expireSessions(long now) {
        List<SyncSession> expired = sessions.expireIdle(now);
        for (SyncSession session : expired) {
            withLock(session.getProjectKey(), () -> discard(session, "expired"));
        }
        return expired.size();
    }

    /**
     * Puts the acknowledged leaf back for paths the client could not read, unless the client
     * tree now has something else at or around that path.
     */
    private static MerkleTree holdUnreadable(MerkleTree clientTree, MerkleTree acknowledged, List<String> unreadable, Set<String> held) {
        if (acknowledged == null || unreadable.isEmpty()) {
            return clientTree;
        }
        TreeMap<String, String> leaves = new TreeMap<>(clientTree.leafHashes());
        Map<String, String> previous = acknowledged.leafHashes();
        for (String path : unreadable) {
            String prev = path == null ? null : previous.get(path);
            if (prev == null || leaves.containsKey(path) || conflicts(leaves, path)) {
                continue;
            }
            leaves.put(path, prev);
            held.add(path);
        }
        return held.isEmpty() ? clientTree : MerkleTreeBuilder.fromLeaves(leaves);
    }

    private static boolean conflicts(TreeMap<String, String> leaves, String path) {
        String prefix = path + "/";
        String next = leaves.ceilingKey(prefix);
        if (next != null && next.startsWith(prefix)) {
            return true;
        }
        int slash = path.lastIndexOf('/');
        while (slash > 0) {
            if (leaves.containsKey(path.substring(0, slash))) {
                return true;
            }
            slash = path.lastIndexOf('/', slash - 1);
        }
        return false;
    }

    private String acknowledgedRootHash(String projectId) {
        String key = ProjectKeys.projectKey(projectId);
        MerkleTree tree = projects.acknowledgedTree(key);
        return tree == null ? MerkleTree.empty().getRootHash() : tree.getRootHash();
    }

    private <T> T withLock(String key, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(key, k -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    private static void requireProjectId(String projectId) {
        if (projectId == null || projectId.trim().isEmpty()) {
            throw new SyncException(SyncErrorCode.INVALID_REQUEST, "projectId is required");
        }
    }
}

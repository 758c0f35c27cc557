package com.zzf.codesync.service;

import com.zzf.codesync.core.merkle.ChangeSet;
import com.zzf.codesync.core.merkle.MerkleTree;
import com.zzf.codesync.protocol.RejectedPath;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Server-side state of one sync cycle between negotiate and commit. Lives in memory only;
 * callers hold the project lock while touching it.
 */
public final class SyncSession {
    private final String sessionId;
    private final String projectId;
    private final String projectKey;
    private final MerkleTree clientTree;
    private final MerkleTree acknowledgedTree;
    private final ChangeSet changeSet;
    private final Set<String> heldPaths;
    private final long createdAt;
    private volatile long lastTouched;

    private final Map<String, List<String>> accepted = new TreeMap<String, List<String>>();
    private final Map<String, RejectedPath> rejected = new LinkedHashMap<String, RejectedPath>();
    private final Set<String> stagedRemovals = new TreeSet<String>();
    private final Set<String> storedHashes = new LinkedHashSet<String>();
    private int retryCount;

    public SyncSession(String sessionId, String projectId, String projectKey, MerkleTree clientTree,
                       MerkleTree acknowledgedTree, ChangeSet changeSet, long now) {
        this(sessionId, projectId, projectKey, clientTree, acknowledgedTree, changeSet, Collections.<String>emptySet(), now);
    }

    public SyncSession(String sessionId, String projectId, String projectKey, MerkleTree clientTree,
                       MerkleTree acknowledgedTree, ChangeSet changeSet, Set<String> heldPaths, long now) {
        this.sessionId = sessionId;
        this.projectId = projectId;
        this.projectKey = projectKey;
        this.clientTree = clientTree;
        this.acknowledgedTree = acknowledgedTree;
        this.changeSet = changeSet;
        this.heldPaths = Collections.unmodifiableSet(new TreeSet<String>(heldPaths));
        this.createdAt = now;
        this.lastTouched = now;
    }

    public void accept(String path, List<String> chunkHashes) {
        if (rejected.remove(path) != null) {
            retryCount++;
        }
        accepted.put(path, chunkHashes);
    }

    public void reject(RejectedPath rejection) {
        if (accepted.containsKey(rejection.getPath())) {
            // an earlier push of the same path already succeeded
            return;
        }
        if (rejected.put(rejection.getPath(), rejection) != null) {
            retryCount++;
        }
    }

    public void stageRemoval(String path) {
        stagedRemovals.add(path);
    }

    public void recordStored(List<String> hashes) {
        storedHashes.addAll(hashes);
    }

    /**
     * True when {@code path} was negotiated as added or modified with exactly this leaf hash.
     */
    public boolean expects(String path, String claimedHash) {
        if (!changeSet.getAdded().contains(path) && !changeSet.getModified().contains(path)) {
            return false;
        }
        String leaf = clientTree.leafHashes().get(path);
        return leaf != null && leaf.equals(claimedHash);
    }

    public void touch(long now) {
        lastTouched = now;
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getProjectId() {
        return projectId;
    }

    public String getProjectKey() {
        return projectKey;
    }

    public MerkleTree getClientTree() {
        return clientTree;
    }

    /**
     * Snapshot the diff was computed against; null when the server had nothing for the project.
     */
    public MerkleTree getAcknowledgedTree() {
        return acknowledgedTree;
    }

    public ChangeSet getChangeSet() {
        return changeSet;
    }

    /**
     * Paths the client could not read; the client tree carries their acknowledged leaf.
     */
    public Set<String> getHeldPaths() {
        return heldPaths;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public long getLastTouched() {
        return lastTouched;
    }

    public Map<String, List<String>> getAccepted() {
        return Collections.unmodifiableMap(accepted);
    }

    public Map<String, RejectedPath> getRejected() {
        return Collections.unmodifiableMap(rejected);
    }

    public Set<String> getStagedRemovals() {
        return Collections.unmodifiableSet(stagedRemovals);
    }

    public Set<String> getStoredHashes() {
        return Collections.unmodifiableSet(storedHashes);
    }

    public int getRetryCount() {
        return retryCount;
    }
}

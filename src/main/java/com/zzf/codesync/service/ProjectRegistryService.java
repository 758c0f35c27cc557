package com.zzf.codesync.service;

import com.zzf.codesync.core.merkle.MerkleTree;
import com.zzf.codesync.core.util.ProjectKeys;
import com.zzf.codesync.model.SyncErrorCode;
import com.zzf.codesync.model.SyncException;
import com.zzf.codesync.protocol.HealthResponse;
import com.zzf.codesync.protocol.ProjectListResponse;
import com.zzf.codesync.protocol.ProjectSummary;
import com.zzf.codesync.protocol.RegisterProjectRequest;
import com.zzf.codesync.protocol.RegisterProjectResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import javax.annotation.PostConstruct;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns the in-memory view of every project's acknowledged state and keeps it in step with
 * {@link SnapshotStore}. The acknowledged tree and the chunk ledger of a project only change
 * through {@link #publish}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProjectRegistryService {

    private final SnapshotStore snapshotStore;
    private final Map<String, ProjectRecord> records = new ConcurrentHashMap<>();
    private final Map<String, MerkleTree> acknowledgedTrees = new ConcurrentHashMap<>();
    private final long startedAt = System.currentTimeMillis();

    @PostConstruct
    public void init() {
        for (ProjectRecord record : snapshotStore.loadProjects()) {
            String key = record.getProjectKey();
            String rootHash = record.getAcknowledgedRootHash();
            if (rootHash != null) {
                MerkleTree tree = null;
                try {
                    tree = snapshotStore.loadSnapshot(key, rootHash);
                } catch (SyncException e) {
                    log.warn("registry.restore snapshot_invalid projectId={} rootHash={} err={}", record.getProjectId(), rootHash, e.getMessage());
                }
                if (tree == null) {
                    log.warn("registry.restore full_resync projectId={} rootHash={}", record.getProjectId(), rootHash);
                    record.setAcknowledgedRootHash(null);
                } else {
                    acknowledgedTrees.put(key, tree);
                }
            }
            records.put(key, record);
        }
        log.info("registry.restore ok projects={} snapshots={}", records.size(), acknowledgedTrees.size());
    }

    public RegisterProjectResponse register(RegisterProjectRequest request) {
        if (request == null || isBlank(request.getProjectPath())) {
            throw new SyncException(SyncErrorCode.INVALID_REQUEST, "projectPath is required");
        }
        String projectId = request.getProjectPath().trim();
        String key = ProjectKeys.projectKey(projectId);
        ProjectRecord existing = records.get(key);
        if (existing != null) {
            return new RegisterProjectResponse(existing.getProjectId(), "Project already registered", existing.getRegisteredAt());
        }
        ProjectRecord created = create(projectId, request.getProjectName());
        return new RegisterProjectResponse(created.getProjectId(), "Project registered successfully", created.getRegisteredAt());
    }

    /**
     * Returns the project's record, registering it with a default name on first contact.
     */
    public ProjectRecord ensure(String projectId) {
        ProjectRecord existing = records.get(ProjectKeys.projectKey(projectId));
        if (existing != null) {
            return existing;
        }
        return create(projectId, null);
    }

    public Optional<ProjectRecord> find(String projectId) {
        return Optional.ofNullable(records.get(ProjectKeys.projectKey(projectId)));
    }

    public MerkleTree acknowledgedTree(String projectKey) {
        return acknowledgedTrees.get(projectKey);
    }

    /**
     * Persists the new snapshot and record, then swaps them into memory. The previous snapshot
     * file is deleted only after both writes succeeded.
     */
    public void publish(ProjectRecord updated, MerkleTree tree) {
        String key = updated.getProjectKey();
        ProjectRecord previous = records.get(key);
        snapshotStore.saveSnapshot(key, tree);
        snapshotStore.saveProject(updated);
        acknowledgedTrees.put(key, tree);
        records.put(key, updated);
        String oldHash = previous == null ? null : previous.getAcknowledgedRootHash();
        if (oldHash != null && !oldHash.equals(tree.getRootHash())) {
            snapshotStore.deleteSnapshot(key, oldHash);
        }
    }

    public Set<String> referencedHashes() {
        return referencedHashesExcept(null);
    }

    /**
     * Chunk hashes referenced by any project other than {@code projectKey}.
     */
    public Set<String> referencedHashesExcept(String projectKey) {
        Set<String> out = new HashSet<>();
        for (ProjectRecord r : records.values()) {
            if (r.getProjectKey().equals(projectKey) || r.getPathChunks() == null) {
                continue;
            }
            for (List<String> hashes : r.getPathChunks().values()) {
                out.addAll(hashes);
            }
        }
        return out;
    }

    public ProjectListResponse list() {
        List<ProjectSummary> projects = new ArrayList<>();
        for (ProjectRecord r : records.values()) {
            projects.add(new ProjectSummary(r.getProjectId(), r.getProjectName(), r.getAcknowledgedRootHash(),
                    r.getRegisteredAt(), r.getLastSync(), r.getFileCount()));
        }
        projects.sort(Comparator.comparing(ProjectSummary::getProjectId));
        return new ProjectListResponse(projects.size(), projects);
    }

    public HealthResponse health() {
        long uptime = (System.currentTimeMillis() - startedAt) / 1000L;
        return new HealthResponse("healthy", "code-sync server is running", records.size(), uptime);
    }

    public int size() {
        return records.size();
    }

    private synchronized ProjectRecord create(String projectId, String projectName) {
        String key = ProjectKeys.projectKey(projectId);
        ProjectRecord existing = records.get(key);
        if (existing != null) {
            return existing;
        }
        ProjectRecord record = ProjectRecord.builder()
                .projectId(projectId)
                .projectKey(key)
                .projectName(isBlank(projectName) ? defaultName(projectId) : projectName.trim())
                .registeredAt(System.currentTimeMillis())
                .build();
        snapshotStore.saveProject(record);
        records.put(key, record);
        log.info("registry.register projectId={} projectKey={} name={}", projectId, key, record.getProjectName());
        return record;
    }

    private static String defaultName(String projectId) {
        String s = projectId.replace('\\', '/');
        while (s.endsWith("/") && s.length() > 1) {
            s = s.substring(0, s.length() - 1);
        }
        int slash = s.lastIndexOf('/');
        String name = slash >= 0 ? s.substring(slash + 1) : s;
        return name.isEmpty() ? projectId : name;
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }
}

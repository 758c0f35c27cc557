package com.zzf.codesync.client;

import com.zzf.codesync.core.merkle.BuildResult;
import com.zzf.codesync.core.merkle.ChangeSet;
import com.zzf.codesync.core.merkle.MerkleTree;
import com.zzf.codesync.core.merkle.MerkleTreeBuilder;
import com.zzf.codesync.core.merkle.TreeSnapshotCodec;
import com.zzf.codesync.core.scan.FileContentReader;
import com.zzf.codesync.core.scan.FileEnumerator;
import com.zzf.codesync.core.scan.IgnoreRules;
import com.zzf.codesync.core.scan.RejectedFile;
import com.zzf.codesync.model.EncryptionException;
import com.zzf.codesync.model.SyncErrorCode;
import com.zzf.codesync.model.SyncException;
import com.zzf.codesync.model.TransientNetworkException;
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
import com.zzf.codesync.protocol.SyncTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CancellationException;

/**
 * Client side of one sync cycle: build the tree, probe, negotiate, push changed contents in
 * batches, push removals, commit. The server's acknowledged snapshot only moves at commit, so
 * a cycle that stops early leaves no trace.
 */
public class SyncCycleRunner implements CycleRunner {
    private static final Logger logger = LoggerFactory.getLogger(SyncCycleRunner.class);

    private final SyncTransport transport;
    private final RetryPolicy retry;
    private final int pushBatchSize;
    private final long maxFileBytes;
    private final FileContentReader reader;

    public SyncCycleRunner(SyncTransport transport, RetryPolicy retry, int pushBatchSize, long maxFileBytes) {
        this(transport, retry, pushBatchSize, maxFileBytes, FileContentReader.DEFAULT);
    }

    public SyncCycleRunner(SyncTransport transport, RetryPolicy retry, int pushBatchSize, long maxFileBytes, FileContentReader reader) {
        this.transport = transport;
        this.retry = retry;
        this.pushBatchSize = Math.max(1, pushBatchSize);
        this.maxFileBytes = maxFileBytes;
        this.reader = reader;
    }

    @Override
    public CycleResult runCycle(ProjectConfig project) {
        String traceId = "cycle-" + UUID.randomUUID();
        String previousTrace = MDC.get("traceId");
        MDC.put("traceId", traceId);
        long t0 = System.nanoTime();
        CycleResult.Builder result = CycleResult.builder(project.getProjectId(), traceId);
        try {
            CycleResult r = run(project, result, t0);
            logger.info("cycle.done projectId={} status={} accepted={} rejected={} pending={} tookMs={}",
                    project.getProjectId(), r.getStatus(), r.getAccepted().size(), r.getRejected().size(), r.getPending().size(), r.getTookMs());
            return r;
        } catch (TransientNetworkException e) {
            logger.warn("cycle.degraded projectId={} err={}", project.getProjectId(), e.getMessage());
            return result.error(e.getErrorCode(), e.getMessage()).build(CycleStatus.DEGRADED, elapsedMs(t0));
        } catch (CancellationException e) {
            logger.info("cycle.cancelled projectId={} reason={}", project.getProjectId(), e.getMessage());
            return result.build(CycleStatus.CANCELLED, elapsedMs(t0));
        } catch (EncryptionException e) {
            logger.error("cycle.failed projectId={} code=ENCRYPTION err={}", project.getProjectId(), e.getMessage());
            return result.error(e.getErrorCode(), e.getMessage()).build(CycleStatus.FAILED, elapsedMs(t0));
        } catch (SyncException e) {
            logger.warn("cycle.failed projectId={} code={} err={}", project.getProjectId(), e.getErrorCode(), e.getMessage());
            return result.error(e.getErrorCode(), e.getMessage()).build(CycleStatus.FAILED, elapsedMs(t0));
        } finally {
            if (previousTrace == null) {
                MDC.remove("traceId");
            } else {
                MDC.put("traceId", previousTrace);
            }
        }
    }

    private CycleResult run(ProjectConfig project, CycleResult.Builder result, long t0) {
        String projectId = project.getProjectId();
        Path root = project.getRoot();

        FileEnumerator enumerator = new FileEnumerator(IgnoreRules.load(root), reader, maxFileBytes);
        BuildResult built = new MerkleTreeBuilder(enumerator).build(root);
        MerkleTree tree = built.getTree();
        result.clientRootHash(tree.getRootHash());
        List<String> unreadable = new ArrayList<String>();
        for (RejectedFile reject : built.getRejects()) {
            unreadable.add(reject.getPath());
            result.warning(SyncErrorCode.ENUMERATION + " path=" + reject.getPath() + " reason=" + reject.getReason());
        }
        checkCancelled();

        ProbeResponse probe = retry.execute("probe", () -> transport.probe(new ProbeRequest(projectId, tree.getRootHash())));
        if (probe.isUpToDate()) {
            result.acknowledgedRootHash(probe.getAcknowledgedRootHash()).pending(unreadable);
            return result.build(unreadable.isEmpty() ? CycleStatus.UP_TO_DATE : CycleStatus.PARTIAL, elapsedMs(t0));
        }
        checkCancelled();

        NegotiateResponse negotiated = retry.execute("negotiate",
                () -> transport.negotiate(new NegotiateRequest(projectId, TreeSnapshotCodec.toSnapshot(tree), unreadable)));
        String sessionId = negotiated.getSessionId();
        ChangeSet changes = negotiated.toChangeSet();
        result.changeSet(changes);
        logger.info("cycle.negotiated projectId={} sessionId={} added={} modified={} removed={}",
                projectId, sessionId, changes.getAdded().size(), changes.getModified().size(), changes.getRemoved().size());

        Map<String, String> leaves = tree.leafHashes();
        List<FilePayload> batch = new ArrayList<FilePayload>();
        for (String path : changes.changedPaths()) {
            checkCancelled();
            String claimed = leaves.get(path);
            if (claimed == null) {
                result.warning("server asked for unknown path=" + path);
                continue;
            }
            byte[] content;
            try {
                content = reader.read(root.resolve(path));
            } catch (IOException e) {
                // gone or unreadable since enumeration; stays pending until the next cycle
                result.warning("cannot read path=" + path + " err=" + e.getMessage());
                continue;
            }
            batch.add(new FilePayload(path, content, claimed));
            if (batch.size() >= pushBatchSize) {
                push(projectId, sessionId, batch, result);
                batch = new ArrayList<FilePayload>();
            }
        }
        if (!batch.isEmpty()) {
            push(projectId, sessionId, batch, result);
        }

        if (!changes.getRemoved().isEmpty()) {
            checkCancelled();
            List<String> removed = new ArrayList<String>(changes.getRemoved());
            retry.execute("pushRemovals", () -> transport.pushRemovals(new PushRemovalsRequest(projectId, sessionId, removed)));
        }

        checkCancelled();
        CommitResponse commit = retry.execute("commit", () -> transport.commit(new CommitRequest(projectId, sessionId)));
        List<String> pending = pendingOnly(commit);
        for (String path : unreadable) {
            if (!pending.contains(path)) {
                pending.add(path);
            }
        }
        result.acknowledgedRootHash(commit.getAcknowledgedRootHash())
                .accepted(commit.getAccepted())
                .rejected(commit.getRejected())
                .pending(pending);
        boolean complete = commit.getRejected().isEmpty() && pending.isEmpty();
        return result.build(complete ? CycleStatus.COMMITTED : CycleStatus.PARTIAL, elapsedMs(t0));
    }

    private void push(String projectId, String sessionId, List<FilePayload> batch, CycleResult.Builder result) {
        PushChangesResponse resp = retry.execute("pushChanges",
                () -> transport.pushChanges(new PushChangesRequest(projectId, sessionId, batch)));
        result.warnings(resp.getWarnings());
        logger.info("cycle.push projectId={} files={} accepted={} rejected={}", projectId, batch.size(), resp.getAccepted().size(), resp.getRejected().size());
    }

    /**
     * Paths the server kept back without an explicit rejection: never pushed, or unreadable here.
     */
    private static List<String> pendingOnly(CommitResponse commit) {
        List<String> out = new ArrayList<String>(commit.getPendingRetry());
        for (int i = 0; i < commit.getRejected().size(); i++) {
            out.remove(commit.getRejected().get(i).getPath());
        }
        return out;
    }

    private static void checkCancelled() {
        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException("cycle interrupted");
        }
    }

    private static long elapsedMs(long t0) {
        return (System.nanoTime() - t0) / 1_000_000L;
    }
}

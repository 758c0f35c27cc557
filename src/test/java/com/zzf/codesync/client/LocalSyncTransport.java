package com.zzf.codesync.client;

import com.zzf.codesync.model.TransientNetworkException;
import com.zzf.codesync.protocol.CommitRequest;
import com.zzf.codesync.protocol.CommitResponse;
import com.zzf.codesync.protocol.NegotiateRequest;
import com.zzf.codesync.protocol.NegotiateResponse;
import com.zzf.codesync.protocol.ProbeRequest;
import com.zzf.codesync.protocol.ProbeResponse;
import com.zzf.codesync.protocol.PushChangesRequest;
import com.zzf.codesync.protocol.PushChangesResponse;
import com.zzf.codesync.protocol.PushRemovalsRequest;
import com.zzf.codesync.protocol.PushRemovalsResponse;
import com.zzf.codesync.protocol.SyncTransport;
import com.zzf.codesync.service.SyncServerService;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * In-process transport straight into a {@link SyncServerService}, with injectable transient
 * failures per operation.
 */
final class LocalSyncTransport implements SyncTransport {
    private final SyncServerService server;
    private final Map<String, AtomicInteger> calls = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> failures = new ConcurrentHashMap<>();

    LocalSyncTransport(SyncServerService server) {
        this.server = server;
    }

    void failNext(String operation, int times) {
        failures.put(operation, new AtomicInteger(times));
    }

    int calls(String operation) {
        AtomicInteger n = calls.get(operation);
        return n == null ? 0 : n.get();
    }

    @Override
    public ProbeResponse probe(ProbeRequest request) {
        return call("probe", () -> server.probe(request));
    }

    @Override
    public NegotiateResponse negotiate(NegotiateRequest request) {
        return call("negotiate", () -> server.negotiate(request));
    }

    @Override
    public PushChangesResponse pushChanges(PushChangesRequest request) {
        return call("pushChanges", () -> server.pushChanges(request));
    }

    @Override
    public PushRemovalsResponse pushRemovals(PushRemovalsRequest request) {
        return call("pushRemovals", () -> server.pushRemovals(request));
    }

    @Override
    public CommitResponse commit(CommitRequest request) {
        return call("commit", () -> server.commit(request));
    }

    private <T> T call(String operation, Supplier<T> action) {
        calls.computeIfAbsent(operation, k -> new AtomicInteger()).incrementAndGet();
        AtomicInteger remaining = failures.get(operation);
        if (remaining != null && remaining.getAndDecrement() > 0) {
            throw new TransientNetworkException("injected failure op=" + operation);
        }
        return action.get();
    }
}

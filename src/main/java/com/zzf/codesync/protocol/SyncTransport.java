package com.zzf.codesync.protocol;

/**
 * Client view of the sync protocol. Implementations throw
 * {@link com.zzf.codesync.model.TransientNetworkException} for failures worth retrying and
 * another {@link com.zzf.codesync.model.SyncException} for everything else.
 */
public interface SyncTransport {
    ProbeResponse probe(ProbeRequest request);

    NegotiateResponse negotiate(NegotiateRequest request);

    PushChangesResponse pushChanges(PushChangesRequest request);

    PushRemovalsResponse pushRemovals(PushRemovalsRequest request);

    CommitResponse commit(CommitRequest request);
}

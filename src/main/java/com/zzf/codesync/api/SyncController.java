package com.zzf.codesync.api;

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
import com.zzf.codesync.service.SyncServerService;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/sync")
public final class SyncController {
    private final SyncServerService syncServerService;

    public SyncController(SyncServerService syncServerService) {
        this.syncServerService = syncServerService;
    }

    @PostMapping("/probe")
    public ProbeResponse probe(@RequestBody ProbeRequest req) {
        return syncServerService.probe(req);
    }

    @PostMapping("/negotiate")
    public NegotiateResponse negotiate(@RequestBody NegotiateRequest req) {
        return syncServerService.negotiate(req);
    }

    @PostMapping("/push")
    public PushChangesResponse pushChanges(@RequestBody PushChangesRequest req) {
        return syncServerService.pushChanges(req);
    }

    @PostMapping("/remove")
    public PushRemovalsResponse pushRemovals(@RequestBody PushRemovalsRequest req) {
        return syncServerService.pushRemovals(req);
    }

    @PostMapping("/commit")
    public CommitResponse commit(@RequestBody CommitRequest req) {
        return syncServerService.commit(req);
    }
}

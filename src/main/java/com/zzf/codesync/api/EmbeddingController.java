package com.zzf.codesync.api;

import com.zzf.codesync.core.index.EmbeddingRecord;
import com.zzf.codesync.protocol.UpsertEmbeddingResponse;
import com.zzf.codesync.service.SyncServerService;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public final class EmbeddingController {
    private final SyncServerService syncServerService;

    public EmbeddingController(SyncServerService syncServerService) {
        this.syncServerService = syncServerService;
    }

    @PostMapping("/api/embeddings/upsert")
    public UpsertEmbeddingResponse upsert(@RequestBody EmbeddingRecord record) {
        return syncServerService.upsertEmbedding(record);
    }
}

package com.zzf.codesync.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zzf.codesync.core.chunk.Chunker;
import com.zzf.codesync.core.chunk.DeclarationAwareChunker;
import com.zzf.codesync.core.chunk.LineWindowChunker;
import com.zzf.codesync.core.crypto.KeyRing;
import com.zzf.codesync.core.crypto.VectorCipher;
import com.zzf.codesync.core.merkle.TreeDiffer;
import com.zzf.codesync.core.merkle.TreeSnapshotCodec;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SyncConfiguration {

    @Bean
    public Chunker chunker(SyncProperties properties) {
        return new DeclarationAwareChunker(new LineWindowChunker(properties.getChunk().getMaxChars(), properties.getChunk().getMaxLines()));
    }

    @Bean
    public TreeDiffer treeDiffer() {
        return new TreeDiffer();
    }

    @Bean
    public TreeSnapshotCodec treeSnapshotCodec(ObjectMapper objectMapper) {
        return new TreeSnapshotCodec(objectMapper);
    }

    @Bean
    public KeyRing keyRing(SyncProperties properties) {
        SyncProperties.Crypto crypto = properties.getCrypto();
        if (crypto.getKeys() == null || crypto.getKeys().isEmpty()) {
            return KeyRing.ephemeral(crypto.getActiveKeyId());
        }
        return KeyRing.fromBase64(crypto.getActiveKeyId(), crypto.getKeys());
    }

    @Bean
    public VectorCipher vectorCipher(KeyRing keyRing) {
        return new VectorCipher(keyRing);
    }
}

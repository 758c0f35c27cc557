package com.zzf.codesync.core.index;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;

@Configuration
public class VectorStoreConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(VectorStoreConfiguration.class);

    @Bean
    public EmbeddingStore embeddingStore(
            @Value("${vectorstore.type:memory}") String type,
            @Value("${elasticsearch.scheme:http}") String scheme,
            @Value("${elasticsearch.host:localhost}") String host,
            @Value("${elasticsearch.port:9200}") int port,
            @Value("${elasticsearch.index:code_sync_embeddings}") String index,
            @Value("${elasticsearch.timeout-ms:8000}") int timeoutMs,
            ObjectMapper objectMapper
    ) {
        if (type != null && type.trim().equalsIgnoreCase("elasticsearch")) {
            URI baseUri = URI.create(scheme + "://" + host + ":" + port);
            HttpClient http = HttpClient.newBuilder().connectTimeout(Duration.ofMillis(timeoutMs)).build();
            logger.info("vectorstore selected=elasticsearch es={} index={}", baseUri, index);
            return new ElasticsearchEmbeddingStore(http, baseUri, index, objectMapper, Duration.ofMillis(timeoutMs));
        }
        logger.info("vectorstore selected=memory");
        return new InMemoryEmbeddingStore();
    }
}

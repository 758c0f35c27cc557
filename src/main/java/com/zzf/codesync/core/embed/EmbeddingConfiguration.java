package com.zzf.codesync.core.embed;

import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class EmbeddingConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(EmbeddingConfiguration.class);

    @Bean
    public EmbeddingService embeddingService(
            @Value("${embedding.provider:sha256}") String provider,
            @Value("${embedding.api.url:https://api.openai.com/v1}") String baseUrl,
            @Value("${embedding.api.key:}") String apiKey,
            @Value("${embedding.api.model:text-embedding-3-small}") String model,
            @Value("${embedding.api.dimension:256}") int dimension,
            @Value("${embedding.api.timeout-ms:15000}") int timeoutMs
    ) {
        if (provider == null || !provider.trim().equalsIgnoreCase("openai")) {
            logger.info("embed.provider selected=sha256 dims={}", dimension);
            return new Sha256EmbeddingService(dimension);
        }
        if (apiKey == null || apiKey.trim().isEmpty()) {
            logger.warn("embed.provider selected=sha256 reason=no_api_key dims={}", dimension);
            return new Sha256EmbeddingService(dimension);
        }
        OpenAiEmbeddingModel embeddingModel = OpenAiEmbeddingModel.builder()
                .baseUrl(baseUrl)
                .apiKey(apiKey.trim())
                .modelName(model)
                .dimensions(dimension > 0 ? dimension : null)
                .timeout(Duration.ofMillis(timeoutMs))
                .maxRetries(0)
                .build();
        logger.info("embed.provider selected=openai url={} model={} dims={} timeoutMs={} apiKeyPresent=true", safeBaseUrl(baseUrl), model, dimension, timeoutMs);
        return new LangChain4jEmbeddingService(embeddingModel, model, dimension);
    }

    private static String safeBaseUrl(String url) {
        if (url == null) {
            return "";
        }
        int q = url.indexOf('?');
        return q >= 0 ? url.substring(0, q) : url;
    }
}

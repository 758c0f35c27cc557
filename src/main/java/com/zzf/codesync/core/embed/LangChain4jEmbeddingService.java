package com.zzf.codesync.core.embed;

import com.zzf.codesync.model.EmbeddingProviderException;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Adapts a langchain4j {@link EmbeddingModel} (OpenAI or any compatible endpoint).
 */
public final class LangChain4jEmbeddingService implements EmbeddingService {
    private static final Logger logger = LoggerFactory.getLogger(LangChain4jEmbeddingService.class);

    private final EmbeddingModel model;
    private final String modelName;
    private final int expectedDims;

    public LangChain4jEmbeddingService(EmbeddingModel model, String modelName, int expectedDims) {
        this.model = model;
        this.modelName = modelName;
        this.expectedDims = expectedDims;
    }

    @Override
    public float[] embed(String text) {
        long t0 = System.nanoTime();
        String fp = fingerprint(text);
        int chars = text == null ? 0 : text.length();
        Response<Embedding> resp;
        try {
            resp = model.embed(text == null ? "" : text);
        } catch (RuntimeException e) {
            long tookMs = (System.nanoTime() - t0) / 1_000_000L;
            logger.warn("embed.provider.fail model={} tookMs={} inputChars={} inputFp={} err={}", modelName, tookMs, chars, fp, e.toString());
            throw new EmbeddingProviderException("embedding request failed: " + e.getMessage(), e);
        }
        if (resp == null || resp.content() == null || resp.content().vector() == null || resp.content().vector().length == 0) {
            throw new EmbeddingProviderException("embedding response missing vector model=" + modelName);
        }
        float[] v = resp.content().vector();
        if (expectedDims > 0 && v.length != expectedDims) {
            throw new EmbeddingProviderException("embedding dims mismatch expected=" + expectedDims + " actual=" + v.length);
        }
        logger.debug("embed.provider.ok model={} dims={} tookMs={} inputFp={}", modelName, v.length, (System.nanoTime() - t0) / 1_000_000L, fp);
        return v;
    }

    @Override
    public String providerName() {
        return "openai:" + modelName;
    }

    private static String fingerprint(String s) {
        try {
            byte[] data = (s == null ? "" : s).getBytes(StandardCharsets.UTF_8);
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] digest = md.digest(data);
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < 6 && i < digest.length; i++) {
                sb.append(String.format("%02x", digest[i]));
            }
            return sb.toString();
        } catch (Exception e) {
            return "na";
        }
    }
}

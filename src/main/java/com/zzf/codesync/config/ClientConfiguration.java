package com.zzf.codesync.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zzf.codesync.client.CycleRunner;
import com.zzf.codesync.client.HttpSyncTransport;
import com.zzf.codesync.client.RetryPolicy;
import com.zzf.codesync.client.SyncCycleRunner;
import com.zzf.codesync.protocol.SyncTransport;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;

@Configuration
public class ClientConfiguration {

    @Bean
    public SyncTransport syncTransport(SyncProperties properties, ObjectMapper objectMapper) {
        SyncProperties.Client client = properties.getClient();
        Duration timeout = Duration.ofMillis(client.getTimeoutMs());
        HttpClient http = HttpClient.newBuilder().connectTimeout(timeout).build();
        return new HttpSyncTransport(http, URI.create(client.getServerUrl()), objectMapper, timeout);
    }

    @Bean
    public RetryPolicy retryPolicy(SyncProperties properties) {
        SyncProperties.Retry r = properties.getClient().getRetry();
        return new RetryPolicy(r.getMaxAttempts(), r.getInitialDelayMs(), r.getBackoffFactor(), r.getMaxDelayMs());
    }

    @Bean
    public CycleRunner cycleRunner(SyncTransport syncTransport, RetryPolicy retryPolicy, SyncProperties properties) {
        SyncProperties.Client client = properties.getClient();
        return new SyncCycleRunner(syncTransport, retryPolicy, client.getPushBatchSize(), client.getMaxFileBytes());
    }
}

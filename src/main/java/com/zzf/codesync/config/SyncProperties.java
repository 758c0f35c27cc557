package com.zzf.codesync.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Configuration
@ConfigurationProperties(prefix = "codesync")
public class SyncProperties {
    private final Server server = new Server();
    private final Chunk chunk = new Chunk();
    private final Crypto crypto = new Crypto();
    private final Client client = new Client();

    public Server getServer() {
        return server;
    }

    public Chunk getChunk() {
        return chunk;
    }

    public Crypto getCrypto() {
        return crypto;
    }

    public Client getClient() {
        return client;
    }

    public static class Server {
        private String storageDir = ".codesync/storage";
        private long sessionTtlMs = 10 * 60 * 1000L;
        private int embedMaxAttempts = 3;
        private long embedBackoffMs = 200;
        private long maxPushBytes = 5L * 1024 * 1024;

        public String getStorageDir() {
            return storageDir;
        }

        public void setStorageDir(String storageDir) {
            this.storageDir = storageDir;
        }

        public long getSessionTtlMs() {
            return sessionTtlMs;
        }

        public void setSessionTtlMs(long sessionTtlMs) {
            this.sessionTtlMs = sessionTtlMs;
        }

        public int getEmbedMaxAttempts() {
            return embedMaxAttempts;
        }

        public void setEmbedMaxAttempts(int embedMaxAttempts) {
            this.embedMaxAttempts = embedMaxAttempts;
        }

        public long getEmbedBackoffMs() {
            return embedBackoffMs;
        }

        public void setEmbedBackoffMs(long embedBackoffMs) {
            this.embedBackoffMs = embedBackoffMs;
        }

        public long getMaxPushBytes() {
            return maxPushBytes;
        }

        public void setMaxPushBytes(long maxPushBytes) {
            this.maxPushBytes = maxPushBytes;
        }
    }

    public static class Chunk {
        private int maxChars = 2000;
        private int maxLines = 200;

        public int getMaxChars() {
            return maxChars;
        }

        public void setMaxChars(int maxChars) {
            this.maxChars = maxChars;
        }

        public int getMaxLines() {
            return maxLines;
        }

        public void setMaxLines(int maxLines) {
            this.maxLines = maxLines;
        }
    }

    public static class Crypto {
        private String activeKeyId = "k1";
        /**
         * keyId to base64 AES key. Empty means an ephemeral key is generated at startup.
         */
        private Map<String, String> keys = new LinkedHashMap<String, String>();

        public String getActiveKeyId() {
            return activeKeyId;
        }

        public void setActiveKeyId(String activeKeyId) {
            this.activeKeyId = activeKeyId;
        }

        public Map<String, String> getKeys() {
            return keys;
        }

        public void setKeys(Map<String, String> keys) {
            this.keys = keys;
        }
    }

    public static class Client {
        private boolean enabled = false;
        private String serverUrl = "http://localhost:8080";
        private int timeoutMs = 15000;
        private int pushBatchSize = 32;
        private long maxFileBytes = 5L * 1024 * 1024;
        private final Retry retry = new Retry();
        private final Watch watch = new Watch();
        private List<Project> projects = new ArrayList<Project>();

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getServerUrl() {
            return serverUrl;
        }

        public void setServerUrl(String serverUrl) {
            this.serverUrl = serverUrl;
        }

        public int getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(int timeoutMs) {
            this.timeoutMs = timeoutMs;
        }

        public int getPushBatchSize() {
            return pushBatchSize;
        }

        public void setPushBatchSize(int pushBatchSize) {
            this.pushBatchSize = pushBatchSize;
        }

        public long getMaxFileBytes() {
            return maxFileBytes;
        }

        public void setMaxFileBytes(long maxFileBytes) {
            this.maxFileBytes = maxFileBytes;
        }

        public Retry getRetry() {
            return retry;
        }

        public Watch getWatch() {
            return watch;
        }

        public List<Project> getProjects() {
            return projects;
        }

        public void setProjects(List<Project> projects) {
            this.projects = projects;
        }
    }

    public static class Retry {
        private int maxAttempts = 4;
        private long initialDelayMs = 500;
        private double backoffFactor = 2.0;
        private long maxDelayMs = 8000;

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public long getInitialDelayMs() {
            return initialDelayMs;
        }

        public void setInitialDelayMs(long initialDelayMs) {
            this.initialDelayMs = initialDelayMs;
        }

        public double getBackoffFactor() {
            return backoffFactor;
        }

        public void setBackoffFactor(double backoffFactor) {
            this.backoffFactor = backoffFactor;
        }

        public long getMaxDelayMs() {
            return maxDelayMs;
        }

        public void setMaxDelayMs(long maxDelayMs) {
            this.maxDelayMs = maxDelayMs;
        }
    }

    public static class Watch {
        private boolean fileEvents = true;
        private long debounceMs = 750;
        private long intervalMs = 5 * 60 * 1000L;

        public boolean isFileEvents() {
            return fileEvents;
        }

        public void setFileEvents(boolean fileEvents) {
            this.fileEvents = fileEvents;
        }

        public long getDebounceMs() {
            return debounceMs;
        }

        public void setDebounceMs(long debounceMs) {
            this.debounceMs = debounceMs;
        }

        public long getIntervalMs() {
            return intervalMs;
        }

        public void setIntervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
        }
    }

    public static class Project {
        private String projectId;
        private String root;
        private String name;

        public String getProjectId() {
            return projectId;
        }

        public void setProjectId(String projectId) {
            this.projectId = projectId;
        }

        public String getRoot() {
            return root;
        }

        public void setRoot(String root) {
            this.root = root;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }
    }
}

package io.etl4j.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runtime configuration for the ETL scheduler, credential handling and pipeline stages.
 */
@ConfigurationProperties(prefix = "etl4j")
public class EtlProperties {
    private boolean enabled = true;
    private boolean ensureIndexesOnStartup = false;
    private final Scheduler scheduler = new Scheduler();
    private final Crypto crypto = new Crypto();
    private final OAuth oauth = new OAuth();
    private final Upload upload = new Upload();
    private final Format format = new Format();
    private final Validation validation = new Validation();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isEnsureIndexesOnStartup() {
        return ensureIndexesOnStartup;
    }

    public void setEnsureIndexesOnStartup(boolean ensureIndexesOnStartup) {
        this.ensureIndexesOnStartup = ensureIndexesOnStartup;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public Crypto getCrypto() {
        return crypto;
    }

    public OAuth getOauth() {
        return oauth;
    }

    public Upload getUpload() {
        return upload;
    }

    public Format getFormat() {
        return format;
    }

    public Validation getValidation() {
        return validation;
    }

    public static class Scheduler {
        private Duration processEvery = Duration.ofSeconds(5);
        private Duration lockLifetime = Duration.ofMinutes(30);
        private int maxConcurrency = 10;
        private int batchSize = 5;
        private String workerId;
        private int maxConsecutiveFailures = 5; // 0 = never pause

        public Duration getProcessEvery() {
            return processEvery;
        }

        public void setProcessEvery(Duration processEvery) {
            this.processEvery = processEvery;
        }

        /**
         * How long a claim stays valid without renewal. Claims of running schedules are renewed
         * every third of this, so it bounds how long a crashed worker blocks a schedule, not how
         * long a run may take.
         */
        public Duration getLockLifetime() {
            return lockLifetime;
        }

        public void setLockLifetime(Duration lockLifetime) {
            this.lockLifetime = lockLifetime;
        }

        public int getMaxConcurrency() {
            return maxConcurrency;
        }

        public void setMaxConcurrency(int maxConcurrency) {
            this.maxConcurrency = maxConcurrency;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public String getWorkerId() {
            return workerId;
        }

        public void setWorkerId(String workerId) {
            this.workerId = workerId;
        }

        public int getMaxConsecutiveFailures() {
            return maxConsecutiveFailures;
        }

        public void setMaxConsecutiveFailures(int maxConsecutiveFailures) {
            this.maxConsecutiveFailures = maxConsecutiveFailures;
        }
    }

    public static class Crypto {
        private String masterSecret;
        private int iterations = 100_000;

        public String getMasterSecret() {
            return masterSecret;
        }

        public void setMasterSecret(String masterSecret) {
            this.masterSecret = masterSecret;
        }

        public int getIterations() {
            return iterations;
        }

        public void setIterations(int iterations) {
            this.iterations = iterations;
        }
    }

    public static class Retry {
        private int maxAttempts = 3;
        private Duration baseDelay;

        Retry(Duration baseDelay) {
            this.baseDelay = baseDelay;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getBaseDelay() {
            return baseDelay;
        }

        public void setBaseDelay(Duration baseDelay) {
            this.baseDelay = baseDelay;
        }
    }

    public static class OAuth {
        private Duration refreshThreshold = Duration.ofMinutes(5);
        private Duration stateTtl = Duration.ofMinutes(10);
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(5);
        private final Retry retry = new Retry(Duration.ofSeconds(1));

        public Duration getRefreshThreshold() {
            return refreshThreshold;
        }

        public void setRefreshThreshold(Duration refreshThreshold) {
            this.refreshThreshold = refreshThreshold;
        }

        public Duration getStateTtl() {
            return stateTtl;
        }

        public void setStateTtl(Duration stateTtl) {
            this.stateTtl = stateTtl;
        }

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public void setConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
        }

        public Duration getReadTimeout() {
            return readTimeout;
        }

        public void setReadTimeout(Duration readTimeout) {
            this.readTimeout = readTimeout;
        }

        public Retry getRetry() {
            return retry;
        }
    }

    public static class Upload {
        private final Retry retry = new Retry(Duration.ofSeconds(5));

        public Retry getRetry() {
            return retry;
        }
    }

    public static class Format {
        private Path outputDir = Path.of(System.getProperty("java.io.tmpdir"), "etl4j");

        public Path getOutputDir() {
            return outputDir;
        }

        public void setOutputDir(Path outputDir) {
            this.outputDir = outputDir;
        }
    }

    public static class Validation {
        private List<String> requiredFields = new ArrayList<>(List.of("id", "created_at"));
        private Map<String, String> fieldTypes = new LinkedHashMap<>(Map.of(
                "id", "NUMBER",
                "created_at", "STRING",
                "updated_at", "STRING"));

        public List<String> getRequiredFields() {
            return requiredFields;
        }

        public void setRequiredFields(List<String> requiredFields) {
            this.requiredFields = requiredFields;
        }

        public Map<String, String> getFieldTypes() {
            return fieldTypes;
        }

        public void setFieldTypes(Map<String, String> fieldTypes) {
            this.fieldTypes = fieldTypes;
        }
    }
}

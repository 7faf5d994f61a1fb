package com.eyelevel.jobrelay.config;

import com.eyelevel.jobrelay.model.BatchMode;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Binds application properties under the "app.relay" prefix to a strongly-typed
 * configuration object. This provides centralized control over chunking, polling,
 * retry and the catalogue of tools whose workers consume the object store.
 */
@Data
@ConfigurationProperties(prefix = "app.relay")
public class JobRelayConfig {

    /**
     * Which blob store backs the tools: {@code s3} or {@code memory}.
     */
    private String store = "s3";

    /**
     * Name of the shared, append-only progress ledger object.
     */
    private String ledgerKey = "progress.jsonl";

    /**
     * Folder holding session registry entries.
     */
    private String registryFolder = "registry";

    private Polling polling = new Polling();
    private Chunking chunking = new Chunking();
    private StoreRetry storeRetry = new StoreRetry();
    private Map<String, Tool> tools = new LinkedHashMap<>();

    @Data
    public static class Polling {
        private Duration interval = Duration.ofSeconds(5);
        private Duration maxWait = Duration.ofSeconds(300);
        /**
         * How long a ledger-mode batch is watched before its chunks are reported as timed out.
         */
        private Duration batchMaxWait = Duration.ofMinutes(60);
    }

    @Data
    public static class Chunking {
        private int defaultSize = 50;
        private int minSize = 10;
        private int maxSize = 1000;
        /**
         * Total submissions allowed per chunk, the first one included.
         */
        private int maxAttempts = 2;
        /**
         * Chunk pipelines that may run at once. 1 keeps the sequential submit-and-wait behaviour.
         */
        private int maxInFlight = 1;
    }

    @Data
    public static class StoreRetry {
        private int attempts = 3;
        private long delayMs = 500;
    }

    @Data
    public static class Tool {
        private String name;
        private String description;
        private String bucket;
        private String inputFolder = "input";
        private String resultsFolder = "results";
        private String statusFolder = "status";
        private BatchMode mode = BatchMode.JOB;
        /**
         * Classpath location of the worker rules the tool starts from. Tools without one keep no rules.
         */
        private String defaultRules;
    }
}

package com.kgagent.config;

import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Typed settings of the query planner, bound from the {@code kgagent.*} namespace.
 * LLM connection settings stay under {@code llm.*} and are injected where they are used.
 */
@Data
@ConfigurationProperties(prefix = "kgagent")
public class KgAgentProperties {

    private Packs packs = new Packs();
    private Execution execution = new Execution();
    private Refiner refiner = new Refiner();
    private Jobs jobs = new Jobs();

    @Data
    public static class Packs {
        private String defaultPack = "wobd";
        /**
         * Optional directory with additional or overriding {@code <id>.json} pack files.
         */
        private String directory;
        private Cache cache = new Cache();
    }

    @Data
    public static class Cache {
        private Duration maxAge = Duration.ofHours(24);
        private long maxEntries = 16;
    }

    @Data
    public static class Execution {
        private Duration timeout = Duration.ofSeconds(60);
        /**
         * Whether a rejected query gets its single repair attempt.
         */
        private boolean repairEnabled = true;
        private int maxConcurrency = 4;
    }

    @Data
    public static class Refiner {
        private boolean enabled = true;
        private int maxTokens = 300;
    }

    @Data
    public static class Jobs {
        private String baseUrl = "http://localhost:8000/api";
        private Duration timeout = Duration.ofSeconds(30);
    }
}

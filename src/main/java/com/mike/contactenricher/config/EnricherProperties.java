package com.mike.contactenricher.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "enricher")
public class EnricherProperties {

    private Server server = new Server();
    private Claim claim = new Claim();
    private Run run = new Run();
    private Sink sink = new Sink();
    private Pool pool = new Pool();

    @Data
    public static class Server {
        /**
         * Identity reported to the server registry. Blank = derived from the hostname.
         */
        private String id;

        private String name;

        private String region;

        private long heartbeatIntervalMillis = 30_000;
    }

    @Data
    public static class Claim {
        /**
         * Rows claimed (and locked) per transaction.
         */
        private int batchSize = 100;

        /**
         * Optional ISO-2 country code; only backlog rows of that country are claimed.
         */
        private String countryFilter;

        /**
         * Pause after a failed claim before the next attempt.
         */
        private long retryDelayMillis = 5_000;

        /**
         * First key of the two-key advisory lock. Keeps backlog row locks apart from
         * any other advisory lock the application takes on the same database.
         */
        private int lockNamespace = "results".hashCode();

        /**
         * Consecutive claim failures after which the run gives up.
         */
        private int maxConsecutiveFailures = 10;
    }

    @Data
    public static class Run {
        /**
         * Max rows processed by this server in one run. 0 = until the backlog is drained.
         */
        private int maxRows = 0;

        private long shutdownGraceMillis = 60_000;

        private boolean autoStart = true;

        /**
         * Close the application once the run returns. Off keeps the progress endpoint up.
         */
        private boolean exitOnCompletion = true;
    }

    @Data
    public static class Sink {
        /**
         * Retries after the first attempt, for transient (connection-class) failures only.
         */
        private int maxRetries = 3;

        private long backoffBaseMillis = 1_000;

        private double backoffMultiplier = 2.0;

        /**
         * When a batch upsert fails as a whole, write its records one by one.
         */
        private boolean singleRowFallback = true;
    }

    @Data
    public static class Pool {
        private int minInstances = 2;
        private int maxInstances = 10;

        private long acquireTimeoutMillis = 30_000;

        /**
         * Unhealthy instances replaced during a single acquire before it gives up.
         */
        private int maxReplacementAttempts = 3;

        private long healthCheckIntervalMillis = 60_000;

        private double memoryLimitMb = 500;
        private int maxOpenPages = 10;
        private int maxErrors = 5;
        private long maxLifetimeMillis = 3_600_000;

        private int healthHistorySize = 10;

        private boolean headless = true;
        private String browserType = "chromium";
        private int navigationTimeoutMillis = 30_000;

        private String userAgent =
                "Mozilla/5.0 (Windows NT 10.0; Win64; x64) " +
                        "AppleWebKit/537.36 (KHTML, like Gecko) " +
                        "Chrome/120.0.0.0 Safari/537.36";
    }
}

package com.vidnyan.cleanup.config;

import com.vidnyan.cleanup.application.service.FailurePolicy;
import com.vidnyan.cleanup.application.service.StoreSettings;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Configuration properties for the cleanup agents.
 * Can be configured via application.yml or the environment variables referenced there.
 */
@Data
@Component
@ConfigurationProperties(prefix = "cleanup")
public class CleanupProperties {

    private Store store = new Store();

    /**
     * What to do when some analyzers fail.
     */
    private FailurePolicy failurePolicy = FailurePolicy.ALL_OR_NOTHING;

    private Analyze analyze = new Analyze();

    @Data
    public static class Store {

        /**
         * Primary store URL (required). Submission ids and merged findings live here.
         */
        private String primaryUrl;

        /**
         * Credentials used when the URL carries none. Blank values are ignored.
         */
        private String username;
        private String password;

        /**
         * Isolated stores. Security and quality forks together enable forked mode.
         */
        private String securityForkUrl;
        private String qualityForkUrl;
        private String performanceForkUrl;
        private String bestPracticesForkUrl;

        private Duration connectionTimeout = Duration.ofSeconds(10);
        private int maxPoolSize = 4;

        public StoreSettings toSettings() {
            return new StoreSettings(primaryUrl, securityForkUrl, qualityForkUrl,
                    performanceForkUrl, bestPracticesForkUrl);
        }
    }

    @Data
    public static class Analyze {

        /**
         * File to analyze on startup. Empty disables the command-line runner.
         */
        private String path;

        /**
         * Optional file the report is written to as JSON.
         */
        private String reportJson;
    }
}

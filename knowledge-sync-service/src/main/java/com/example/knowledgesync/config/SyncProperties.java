package com.example.knowledgesync.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings bound from the {@code sync.*} namespace.
 * application.yml maps each required value to its environment variable
 * (ATLASSIAN_URL, DIFY_API_KEY, ...); ConfigValidator checks them before every run.
 */
@Data
@ConfigurationProperties(prefix = "sync")
public class SyncProperties {

    private Atlassian atlassian = new Atlassian();
    private Jira jira = new Jira();
    private Confluence confluence = new Confluence();
    private Dify dify = new Dify();
    private Fetch fetch = new Fetch();
    private Tracker tracker = new Tracker();
    private Validation validation = new Validation();
    private Cors cors = new Cors();

    @Data
    public static class Atlassian {
        private String url;
        private String email;
        private String apiToken;
    }

    @Data
    public static class Jira {
        private String projectKey = "PROJ";
        /** Bare numbers are days. */
        @DurationUnit(ChronoUnit.DAYS)
        private Duration lookback = Duration.ofDays(30);

        /**
         * JIRA_SINCE_DAYS is written as a JQL relative date such as -30d.
         */
        public void setLookback(Duration lookback) {
            this.lookback = lookback.abs();
        }
    }

    @Data
    public static class Confluence {
        /** Blank disables the Confluence source. */
        private String spaceKey;
        @DurationUnit(ChronoUnit.DAYS)
        private Duration lookback = Duration.ofDays(30);
        /** Path prefix of the Confluence REST API on the Atlassian site ("/wiki" on Cloud). */
        private String contextPath = "/wiki";
        private int maxContentLength = 5000;
    }

    @Data
    public static class Dify {
        private String apiUrl;
        private String apiKey;
        private String datasetId;
        private String indexingTechnique = "high_quality";
    }

    @Data
    public static class Fetch {
        /** Page size of the single request made per source. */
        private int maxResults = 100;
        private Duration timeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Tracker {
        /** jpa (portable) or postgres (native ON CONFLICT upsert). */
        private String backend = "jpa";
        /**
         * When true, a FAILED write records the remote timestamp, so an item whose remote
         * timestamp never changes again is not retried. When false the previously stored
         * timestamp is kept and the item is retried on every run until it succeeds.
         */
        private boolean advanceOnFailure = false;
    }

    @Data
    public static class Validation {
        /** Values starting with one of these are template leftovers, not real settings. */
        private List<String> placeholderPrefixes = new ArrayList<>(List.of("your-", "YOUR_", "paste-", "粘贴", "<"));

        public boolean isPlaceholder(String value) {
            return value != null && placeholderPrefixes.stream().anyMatch(value::startsWith);
        }
    }

    @Data
    public static class Cors {
        /** "*" allows any origin. */
        private List<String> allowedOrigins = new ArrayList<>(List.of("*"));
    }
}

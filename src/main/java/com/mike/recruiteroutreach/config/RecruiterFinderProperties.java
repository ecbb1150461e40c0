package com.mike.recruiteroutreach.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "recruiterfinder")
public class RecruiterFinderProperties {

    private Search search = new Search();
    private Http http = new Http();

    @Data
    public static class Search {
        /**
         * Lower bound of the random pause between two cascade queries.
         */
        private long minDelayMillis = 4000;

        /**
         * Upper bound of the random pause between two cascade queries.
         */
        private long maxDelayMillis = 8000;

        /**
         * Unique contacts collected per cascade when the caller gives no limit.
         */
        private int defaultMaxResults = 5;
    }

    @Data
    public static class Http {
        private long connectTimeoutMillis = 5000;

        /**
         * Read timeout for every outbound search/directory call.
         * A timeout counts as a backend failure.
         */
        private long readTimeoutMillis = 15000;
    }
}

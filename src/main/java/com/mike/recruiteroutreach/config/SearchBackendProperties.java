package com.mike.recruiteroutreach.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Endpoints and credentials of the recruiter search backends.
 * A backend without credentials is left out of the cascade.
 */
@ConfigurationProperties(prefix = "search")
public record SearchBackendProperties(
        DuckDuckGo duckduckgo,
        Brave brave,
        Tavily tavily,
        GoogleCse googleCse,
        SerpApi serpapi
) {

    public SearchBackendProperties {
        duckduckgo = duckduckgo == null ? new DuckDuckGo(null) : duckduckgo;
        brave = brave == null ? new Brave(null, null) : brave;
        tavily = tavily == null ? new Tavily(null, null, 10) : tavily;
        googleCse = googleCse == null ? new GoogleCse(null, null, null) : googleCse;
        serpapi = serpapi == null ? new SerpApi(null, null, null, null, null) : serpapi;
    }

    public record DuckDuckGo(String baseUrl) {
    }

    public record Brave(String apiKey, String baseUrl) {
    }

    public record Tavily(String apiKey, String baseUrl, int maxResults) {
    }

    public record GoogleCse(String apiKey, String cx, String baseUrl) {
    }

    public record SerpApi(
            String apiKey,
            String baseUrl,
            String defaultCountry,
            String defaultLanguage,
            String defaultEngine
    ) {
    }
}

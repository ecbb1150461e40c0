package com.mike.recruiteroutreach.service.search;

import com.mike.recruiteroutreach.config.SearchBackendProperties;
import com.mike.recruiteroutreach.dto.SearchHit;
import com.mike.recruiteroutreach.dto.TavilySearchResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Tavily search. Also the web search behind domain and pattern discovery,
 * because its results carry page content next to the title.
 */
@Component
@Slf4j
public class TavilySearchProvider implements SearchProvider {

    private static final String DEFAULT_BASE_URL = "https://api.tavily.com/search";
    private static final int DEFAULT_MAX_RESULTS = 10;

    private final SearchBackendProperties.Tavily props;
    private final RestClient restClient;

    public TavilySearchProvider(SearchBackendProperties properties, RestClient outboundRestClient) {
        this.props = properties.tavily();
        this.restClient = outboundRestClient;
    }

    @Override
    public String name() {
        return "tavily";
    }

    @Override
    public boolean isConfigured() {
        return !HttpSearchSupport.isBlank(props.apiKey());
    }

    @Override
    public SearchOutcome execute(String query) {
        int maxResults = props.maxResults() > 0 ? props.maxResults() : DEFAULT_MAX_RESULTS;
        Map<String, Object> payload = Map.of(
                "api_key", props.apiKey(),
                "query", query,
                "search_depth", "basic",
                "max_results", maxResults
        );

        log.info("TavilySearchProvider.execute: query='{}', maxResults={}", query, maxResults);

        return HttpSearchSupport.call(name(), () -> {
            TavilySearchResponse response = restClient.post()
                    .uri(HttpSearchSupport.isBlank(props.baseUrl()) ? DEFAULT_BASE_URL : props.baseUrl())
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(payload)
                    .retrieve()
                    .body(TavilySearchResponse.class);

            if (response == null || response.results() == null) {
                return List.of();
            }
            return response.results().stream()
                    .filter(Objects::nonNull)
                    .map(r -> new SearchHit(r.url(), r.title(), r.content()))
                    .toList();
        });
    }
}

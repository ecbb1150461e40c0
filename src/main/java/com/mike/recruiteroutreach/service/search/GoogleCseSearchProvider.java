package com.mike.recruiteroutreach.service.search;

import com.mike.recruiteroutreach.config.SearchBackendProperties;
import com.mike.recruiteroutreach.dto.GoogleCseResponse;
import com.mike.recruiteroutreach.dto.SearchHit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.List;
import java.util.Objects;

/**
 * Google Custom Search JSON API (free tier: 100 queries a day, 403/429 once spent).
 */
@Component
@Slf4j
public class GoogleCseSearchProvider implements SearchProvider {

    private static final String DEFAULT_BASE_URL = "https://www.googleapis.com/customsearch/v1";

    private final SearchBackendProperties.GoogleCse props;
    private final RestClient restClient;

    public GoogleCseSearchProvider(SearchBackendProperties properties, RestClient outboundRestClient) {
        this.props = properties.googleCse();
        this.restClient = outboundRestClient;
    }

    @Override
    public String name() {
        return "google_cse";
    }

    @Override
    public boolean isConfigured() {
        return !HttpSearchSupport.isBlank(props.apiKey()) && !HttpSearchSupport.isBlank(props.cx());
    }

    @Override
    public SearchOutcome execute(String query) {
        log.info("GoogleCseSearchProvider.execute: query='{}'", query);

        return HttpSearchSupport.call(name(), () -> {
            URI uri = UriComponentsBuilder
                    .fromUriString(HttpSearchSupport.isBlank(props.baseUrl()) ? DEFAULT_BASE_URL : props.baseUrl())
                    .queryParam("key", props.apiKey())
                    .queryParam("cx", props.cx())
                    .queryParam("q", query)
                    .queryParam("num", 10)
                    .encode()
                    .build()
                    .toUri();

            GoogleCseResponse response = restClient.get()
                    .uri(uri)
                    .retrieve()
                    .body(GoogleCseResponse.class);

            if (response == null || response.items() == null) {
                return List.of();
            }
            return response.items().stream()
                    .filter(Objects::nonNull)
                    .map(i -> new SearchHit(i.link(), i.title(), i.snippet()))
                    .toList();
        });
    }
}

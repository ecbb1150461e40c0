package com.mike.recruiteroutreach.service.search;

import com.mike.recruiteroutreach.config.SearchBackendProperties;
import com.mike.recruiteroutreach.dto.BraveSearchResponse;
import com.mike.recruiteroutreach.dto.SearchHit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.List;
import java.util.Objects;

@Component
@Slf4j
public class BraveSearchProvider implements SearchProvider {

    private static final String DEFAULT_BASE_URL = "https://api.search.brave.com/res/v1/web/search";

    private final SearchBackendProperties.Brave props;
    private final RestClient restClient;

    public BraveSearchProvider(SearchBackendProperties properties, RestClient outboundRestClient) {
        this.props = properties.brave();
        this.restClient = outboundRestClient;
    }

    @Override
    public String name() {
        return "brave";
    }

    @Override
    public boolean isConfigured() {
        return !HttpSearchSupport.isBlank(props.apiKey());
    }

    @Override
    public SearchOutcome execute(String query) {
        log.info("BraveSearchProvider.execute: query='{}'", query);

        return HttpSearchSupport.call(name(), () -> {
            URI uri = UriComponentsBuilder
                    .fromUriString(HttpSearchSupport.isBlank(props.baseUrl()) ? DEFAULT_BASE_URL : props.baseUrl())
                    .queryParam("q", query)
                    .queryParam("count", 10)
                    .encode()
                    .build()
                    .toUri();

            BraveSearchResponse response = restClient.get()
                    .uri(uri)
                    .header("X-Subscription-Token", props.apiKey())
                    .retrieve()
                    .body(BraveSearchResponse.class);

            if (response == null || response.web() == null || response.web().results() == null) {
                return List.of();
            }
            return response.web().results().stream()
                    .filter(Objects::nonNull)
                    .map(r -> new SearchHit(r.url(), r.title(), r.description()))
                    .toList();
        });
    }
}

package com.mike.recruiteroutreach.service.search;

import com.mike.recruiteroutreach.config.SearchBackendProperties;
import com.mike.recruiteroutreach.dto.SearchHit;
import com.mike.recruiteroutreach.dto.SerpApiSearchResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

@Component
@Slf4j
public class SerpApiSearchProvider implements SearchProvider {

    private static final String DEFAULT_BASE_URL = "https://serpapi.com/search";
    private static final int RESULTS_PER_PAGE = 10;

    private final SearchBackendProperties.SerpApi props;
    private final RestClient restClient;

    public SerpApiSearchProvider(SearchBackendProperties properties, RestClient outboundRestClient) {
        this.props = properties.serpapi();
        this.restClient = outboundRestClient;
    }

    @Override
    public String name() {
        return "serpapi";
    }

    @Override
    public boolean isConfigured() {
        return !HttpSearchSupport.isBlank(props.apiKey());
    }

    @Override
    public SearchOutcome execute(String query) {
        log.info("SerpApiSearchProvider.execute: querying SerpAPI. query='{}', resultsPerPage={}", query, RESULTS_PER_PAGE);

        AtomicReference<String> apiError = new AtomicReference<>();
        SearchOutcome outcome = HttpSearchSupport.call(name(), () -> {
            URI uri = UriComponentsBuilder
                    .fromUriString(HttpSearchSupport.isBlank(props.baseUrl()) ? DEFAULT_BASE_URL : props.baseUrl())
                    .queryParam("engine", orDefault(props.defaultEngine(), "google"))
                    .queryParam("hl", orDefault(props.defaultLanguage(), "en"))
                    .queryParam("gl", orDefault(props.defaultCountry(), "us"))
                    .queryParam("num", RESULTS_PER_PAGE)
                    .queryParam("q", query)
                    .queryParam("api_key", props.apiKey())
                    .encode()
                    .build()
                    .toUri();

            SerpApiSearchResponse response = restClient.get()
                    .uri(uri)
                    .retrieve()
                    .body(SerpApiSearchResponse.class);

            if (response != null && !HttpSearchSupport.isBlank(response.error())) {
                apiError.set(response.error());
                return List.of();
            }
            if (response == null || response.results() == null) {
                log.warn("SerpApiSearchProvider.execute: empty response or no organic_results");
                return List.of();
            }

            List<SearchHit> hits = response.results().stream()
                    .filter(Objects::nonNull)
                    .filter(r -> !HttpSearchSupport.isBlank(r.link()))
                    .map(r -> new SearchHit(r.link().trim(), r.title(), r.snippet()))
                    .toList();

            log.info("SerpApiSearchProvider.execute: got {} organic results from SerpAPI", hits.size());
            return hits;
        });

        if (apiError.get() != null) {
            log.warn("SerpApiSearchProvider.execute: SerpAPI rejected the request: {}", apiError.get());
            return SearchOutcome.failed(SearchFailure.Reason.AUTH, name() + " error: " + apiError.get());
        }
        return outcome;
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}

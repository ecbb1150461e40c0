package com.mike.recruiteroutreach.service.email;

import com.mike.recruiteroutreach.config.DirectoryProperties;
import com.mike.recruiteroutreach.dto.DirectoryRecord;
import com.mike.recruiteroutreach.dto.HunterDomainSearchResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.Optional;

/**
 * Hunter.io /domain-search. Pattern keys use the same placeholder syntax as
 * {@link com.mike.recruiteroutreach.model.EmailPattern}.
 */
@Component
@Slf4j
public class HunterDirectoryLookup implements DirectoryLookup {

    private static final String DEFAULT_BASE_URL = "https://api.hunter.io/v2/domain-search";

    private final DirectoryProperties.Hunter props;
    private final RestClient restClient;

    public HunterDirectoryLookup(DirectoryProperties properties, RestClient outboundRestClient) {
        this.props = properties.hunter();
        this.restClient = outboundRestClient;
    }

    @Override
    public boolean isConfigured() {
        return props.apiKey() != null && !props.apiKey().isBlank();
    }

    @Override
    public Optional<DirectoryRecord> byCompany(String company) {
        return fetch("company", company);
    }

    @Override
    public Optional<DirectoryRecord> byDomain(String domain) {
        return fetch("domain", domain);
    }

    private Optional<DirectoryRecord> fetch(String param, String value) {
        try {
            URI uri = UriComponentsBuilder
                    .fromUriString(props.baseUrl() == null || props.baseUrl().isBlank() ? DEFAULT_BASE_URL : props.baseUrl())
                    .queryParam(param, value)
                    .queryParam("api_key", props.apiKey())
                    .encode()
                    .build()
                    .toUri();

            HunterDomainSearchResponse response = restClient.get()
                    .uri(uri)
                    .retrieve()
                    .body(HunterDomainSearchResponse.class);

            if (response == null || response.data() == null) {
                log.info("HunterDirectoryLookup: no data for {}='{}'", param, value);
                return Optional.empty();
            }
            return Optional.of(new DirectoryRecord(response.data().domain(), response.data().pattern()));
        } catch (RestClientException | IllegalArgumentException e) {
            log.warn("HunterDirectoryLookup: lookup failed for {}='{}': {}", param, value, e.getMessage());
            return Optional.empty();
        }
    }
}

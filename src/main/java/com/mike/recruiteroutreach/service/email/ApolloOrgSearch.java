package com.mike.recruiteroutreach.service.email;

import com.mike.recruiteroutreach.config.DirectoryProperties;
import com.mike.recruiteroutreach.dto.ApolloOrganizationSearchResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.Map;
import java.util.Optional;

/**
 * Apollo.io organization search (free plan). Returns the primary domain only,
 * no naming pattern.
 */
@Component
@Slf4j
public class ApolloOrgSearch implements OrgSearch {

    private static final String DEFAULT_BASE_URL = "https://api.apollo.io/v1/organizations/search";

    private final DirectoryProperties.Apollo props;
    private final RestClient restClient;

    public ApolloOrgSearch(DirectoryProperties properties, RestClient outboundRestClient) {
        this.props = properties.apollo();
        this.restClient = outboundRestClient;
    }

    @Override
    public boolean isConfigured() {
        return props.apiKey() != null && !props.apiKey().isBlank();
    }

    @Override
    public Optional<String> primaryDomain(String company) {
        Map<String, Object> payload = Map.of(
                "q_organization_name", company,
                "page", 1,
                "per_page", 1
        );

        try {
            ApolloOrganizationSearchResponse response = restClient.post()
                    .uri(props.baseUrl() == null || props.baseUrl().isBlank() ? DEFAULT_BASE_URL : props.baseUrl())
                    .contentType(MediaType.APPLICATION_JSON)
                    .header("Cache-Control", "no-cache")
                    .header("X-Api-Key", props.apiKey())
                    .body(payload)
                    .retrieve()
                    .body(ApolloOrganizationSearchResponse.class);

            if (response == null || response.organizations() == null || response.organizations().isEmpty()) {
                log.info("ApolloOrgSearch: no organization found for company='{}'", company);
                return Optional.empty();
            }
            String domain = response.organizations().get(0).primaryDomain();
            return domain == null || domain.isBlank() ? Optional.empty() : Optional.of(domain.trim().toLowerCase());
        } catch (RestClientException | IllegalArgumentException e) {
            log.warn("ApolloOrgSearch: lookup failed for company='{}': {}", company, e.getMessage());
            return Optional.empty();
        }
    }
}

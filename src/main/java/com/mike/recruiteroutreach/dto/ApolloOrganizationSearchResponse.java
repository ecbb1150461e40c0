package com.mike.recruiteroutreach.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ApolloOrganizationSearchResponse(
        List<Organization> organizations
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Organization(
            String name,
            @JsonProperty("primary_domain")
            String primaryDomain
    ) {
    }
}

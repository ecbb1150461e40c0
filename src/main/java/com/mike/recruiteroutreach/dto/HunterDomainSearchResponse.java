package com.mike.recruiteroutreach.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record HunterDomainSearchResponse(
        Data data
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Data(String domain, String pattern, String organization) {
    }
}

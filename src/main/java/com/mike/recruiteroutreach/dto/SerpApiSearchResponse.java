package com.mike.recruiteroutreach.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * The slice of a SerpAPI response the recruiter search reads. SerpAPI reports
 * a bad key or an exhausted plan through {@code error} on a 200 body.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SerpApiSearchResponse(
        String error,
        @JsonProperty("organic_results")
        List<Result> results
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Result(
            Integer position,
            String link,
            String title,
            String snippet
    ) {
    }
}

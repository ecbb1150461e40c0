package com.mike.recruiteroutreach.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record BraveSearchResponse(
        Web web
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Web(List<Result> results) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Result(String url, String title, String description) {
    }
}

package com.mike.recruiteroutreach.dto;

/**
 * One organic search result, normalized across backends.
 */
public record SearchHit(
        String url,
        String title,
        String snippet
) {
}

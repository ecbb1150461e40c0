package com.mike.recruiteroutreach.model;

/**
 * Name and optional role title parsed out of a search result heading.
 */
public record ParsedHeading(String name, String title) {
}

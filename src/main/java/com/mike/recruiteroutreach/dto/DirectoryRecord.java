package com.mike.recruiteroutreach.dto;

/**
 * Answer of a company directory lookup. Either field may be null.
 */
public record DirectoryRecord(
        String domain,
        String pattern
) {
}

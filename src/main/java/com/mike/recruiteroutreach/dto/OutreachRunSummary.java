package com.mike.recruiteroutreach.dto;

import java.util.List;

/**
 * Result of one send or bounce-poll run for a job.
 *
 * @param affected sends performed (or previewed in dry-run), or bounces found
 */
public record OutreachRunSummary(
        Long jobPostingId,
        int affected,
        boolean dryRun,
        List<ContactView> contacts
) {
}

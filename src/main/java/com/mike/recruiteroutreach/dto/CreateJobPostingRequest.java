package com.mike.recruiteroutreach.dto;

import com.mike.recruiteroutreach.model.JobFamily;

public record CreateJobPostingRequest(
        String url,
        String company,
        String jobTitle,
        JobFamily jobFamily,
        String location,
        String emailSubject,
        String emailBody
) {
}

package com.mike.recruiteroutreach.service.delivery;

import java.nio.file.Path;

/**
 * Job-level message template, personalised per contact at send time.
 */
public record OutreachDraft(
        String subject,
        String body,
        String fromAddress,
        String fromName,
        Path attachment
) {

    public boolean isComplete() {
        return subject != null && !subject.isBlank() && body != null && !body.isBlank();
    }
}

package com.mike.recruiteroutreach.service.delivery;

import java.nio.file.Path;

/**
 * @param attachment optional file attached as-is, may be null
 */
public record OutreachMessage(
        String to,
        String subject,
        String body,
        String fromAddress,
        String fromName,
        Path attachment
) {
}

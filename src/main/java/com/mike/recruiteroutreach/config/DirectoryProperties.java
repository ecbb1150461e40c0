package com.mike.recruiteroutreach.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Company directory services used by domain/pattern discovery.
 */
@ConfigurationProperties(prefix = "directory")
public record DirectoryProperties(
        Hunter hunter,
        Apollo apollo
) {

    public DirectoryProperties {
        hunter = hunter == null ? new Hunter(null, null) : hunter;
        apollo = apollo == null ? new Apollo(null, null) : apollo;
    }

    public record Hunter(String apiKey, String baseUrl) {
    }

    public record Apollo(String apiKey, String baseUrl) {
    }
}

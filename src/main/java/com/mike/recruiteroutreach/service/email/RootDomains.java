package com.mike.recruiteroutreach.service.email;

import org.springframework.web.util.UriComponentsBuilder;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

public final class RootDomains {

    /**
     * Job boards and applicant tracking systems. They show up in careers searches
     * but are never the company's own mail domain.
     */
    private static final Set<String> ATS_DOMAINS = Set.of(
            "greenhouse.io", "lever.co", "workday.com", "myworkdayjobs.com",
            "linkedin.com", "indeed.com", "glassdoor.com", "ziprecruiter.com",
            "smartrecruiters.com", "icims.com", "taleo.net", "ashbyhq.com"
    );

    private RootDomains() {
    }

    /**
     * https://careers.acme.com/jobs -> acme.com. Keeps the last two labels only,
     * so two-level public suffixes (co.uk) come out wrong.
     */
    public static Optional<String> extract(String url) {
        if (url == null || url.isBlank()) {
            return Optional.empty();
        }
        String host;
        try {
            // lenient: search results may carry spaces or unescaped characters in the path
            host = UriComponentsBuilder.fromUriString(url.trim()).build().getHost();
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
        if (host == null || host.isBlank()) {
            return Optional.empty();
        }

        host = host.toLowerCase(Locale.ROOT);
        if (host.startsWith("www.")) {
            host = host.substring(4);
        }
        String[] labels = host.split("\\.");
        if (labels.length > 2) {
            host = labels[labels.length - 2] + "." + labels[labels.length - 1];
        }
        return host.isBlank() ? Optional.empty() : Optional.of(host);
    }

    public static boolean isAtsDomain(String domain) {
        if (domain == null) {
            return false;
        }
        String d = domain.toLowerCase(Locale.ROOT);
        return ATS_DOMAINS.stream().anyMatch(ats -> d.equals(ats) || d.endsWith("." + ats));
    }
}

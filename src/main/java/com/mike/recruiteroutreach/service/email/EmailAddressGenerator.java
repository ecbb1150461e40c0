package com.mike.recruiteroutreach.service.email;

import com.mike.recruiteroutreach.model.EmailPattern;
import com.mike.recruiteroutreach.model.PersonName;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

@Component
public class EmailAddressGenerator {

    /**
     * One address when the pattern is known, otherwise every canonical candidate
     * in priority order, comma-joined. Empty when the name has no usable first
     * and last token.
     */
    public Optional<String> generate(String fullName, String domain, EmailPattern pattern) {
        if (domain == null || domain.isBlank()) {
            return Optional.empty();
        }
        String d = domain.trim().toLowerCase(Locale.ROOT);

        return NameParser.parse(fullName).map(name -> pattern != null
                ? address(pattern, name, d)
                : String.join(",", allCandidates(name, d)));
    }

    private static Set<String> allCandidates(PersonName name, String domain) {
        // distinct even for degenerate names where two templates collapse
        Set<String> candidates = new LinkedHashSet<>();
        Arrays.stream(EmailPattern.values())
                .map(p -> address(p, name, domain))
                .forEach(candidates::add);
        return candidates;
    }

    private static String address(EmailPattern pattern, PersonName name, String domain) {
        return pattern.localPart(name) + "@" + domain;
    }
}

package com.mike.recruiteroutreach.service.recruiter;

import com.mike.recruiteroutreach.dto.SearchHit;
import com.mike.recruiteroutreach.model.Contact;
import com.mike.recruiteroutreach.model.ParsedHeading;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses profile search headings such as
 * "Jane Doe - Technical Recruiter at Acme | LinkedIn" into name and title.
 */
@Component
public class ContactNormalizer {

    private static final Pattern PLATFORM_SUFFIX =
            Pattern.compile("\\s*[|–\\-]\\s*LinkedIn\\s*$", Pattern.CASE_INSENSITIVE);

    private static final Pattern NAME_AND_ROLE =
            Pattern.compile("^(.+?)\\s*[-–|•]\\s*(.+)$");

    private static final Pattern DIGIT = Pattern.compile("\\d");

    private static final int MIN_NAME_LENGTH = 2;
    private static final int MAX_NAME_LENGTH = 60;

    public Optional<ParsedHeading> parseHeading(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }

        String heading = PLATFORM_SUFFIX.matcher(text).replaceFirst("").trim();
        Matcher m = NAME_AND_ROLE.matcher(heading);
        if (!m.matches()) {
            return Optional.empty();
        }

        String name = m.group(1).trim();
        String role = m.group(2).trim();

        if (name.length() < MIN_NAME_LENGTH || name.length() > MAX_NAME_LENGTH) {
            return Optional.empty();
        }
        if (DIGIT.matcher(name).find()) {
            return Optional.empty();
        }
        return Optional.of(new ParsedHeading(name, role.isEmpty() ? null : role));
    }

    /**
     * Builds a contact from a profile search hit, or empty when the heading
     * does not yield a usable name.
     */
    public Optional<Contact> toContact(SearchHit hit, String source, Instant foundAt) {
        return parseHeading(hit.title())
                .map(heading -> Contact.builder()
                        .name(heading.name())
                        .title(heading.title())
                        .profileUrl(ProfileUrls.normalize(hit.url()))
                        .source(source)
                        .foundAt(foundAt)
                        .build());
    }
}

package com.mike.recruiteroutreach.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * The six canonical local-part templates, declared in combinatorics priority order.
 * Template strings use the {first}/{last}/{f}/{l} placeholders that directory
 * services (Hunter) report.
 */
public enum EmailPattern {
    FIRST_DOT_LAST("{first}.{last}"),
    INITIAL_LAST("{f}{last}"),
    FIRST_INITIAL("{first}{l}"),
    FIRST("{first}"),
    INITIAL_DOT_LAST("{f}.{last}"),
    FIRST_LAST("{first}{last}");

    private final String template;

    EmailPattern(String template) {
        this.template = template;
    }

    public String template() {
        return template;
    }

    public String localPart(PersonName name) {
        return template
                .replace("{first}", name.first())
                .replace("{last}", name.last())
                .replace("{f}", name.firstInitial())
                .replace("{l}", name.lastInitial());
    }

    public static Optional<EmailPattern> fromTemplate(String template) {
        if (template == null || template.isBlank()) {
            return Optional.empty();
        }
        String t = template.trim();
        return Arrays.stream(values())
                .filter(p -> p.template.equals(t))
                .findFirst();
    }
}

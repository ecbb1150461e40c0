package com.mike.recruiteroutreach.service.email;

import com.mike.recruiteroutreach.model.PersonName;

import java.text.Normalizer;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Best-effort split of a display name into address-ready first/last tokens.
 * <ul>
 *   <li>"Julius Harris, SHRM" -> julius / harris</li>
 *   <li>"Marcus P White" -> marcus / white (middle initial skipped)</li>
 *   <li>"Héléne O'Brien" -> helene / obrien</li>
 *   <li>"J Smith" -> j / smith</li>
 *   <li>"Madonna" -> empty</li>
 * </ul>
 */
public final class NameParser {

    private static final Pattern CREDENTIAL_SUFFIX =
            Pattern.compile(",\\s*[A-Z][\\w\\-.]+(?:\\s+[A-Z][\\w\\-.]+)*$");

    private static final Pattern NON_ASCII_LETTER = Pattern.compile("[^a-z]");

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private NameParser() {
    }

    public static Optional<PersonName> parse(String fullName) {
        if (fullName == null || fullName.isBlank()) {
            return Optional.empty();
        }

        String name = CREDENTIAL_SUFFIX.matcher(fullName.trim()).replaceFirst("").trim();
        String[] words = WHITESPACE.split(name);
        if (words.length < 2) {
            return Optional.empty();
        }

        String first = normalizeToken(words[0]);
        String last = "";
        for (int i = 1; i < words.length; i++) {
            String candidate = normalizeToken(words[i]);
            if (candidate.length() > 1) {
                last = candidate;
                break;
            }
        }

        if (first.isEmpty() || last.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new PersonName(first, last));
    }

    /**
     * Lowercase, accents decomposed to their base letter, everything but a-z dropped.
     */
    public static String normalizeToken(String token) {
        if (token == null) {
            return "";
        }
        String decomposed = Normalizer.normalize(token.toLowerCase(Locale.ROOT), Normalizer.Form.NFKD);
        return NON_ASCII_LETTER.matcher(decomposed).replaceAll("");
    }
}

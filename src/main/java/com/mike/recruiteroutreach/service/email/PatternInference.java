package com.mike.recruiteroutreach.service.email;

import com.mike.recruiteroutreach.model.EmailPattern;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Structural vote over mined local-parts. The names behind the addresses are
 * unknown, so only the shape counts:
 * <ul>
 *   <li>dot or hyphen, single-letter first token -> {f}.{last}</li>
 *   <li>dot or hyphen otherwise -> {first}.{last}</li>
 *   <li>no separator, up to 5 chars -> {f}{last}</li>
 *   <li>no separator, longer -> {first}{last}</li>
 * </ul>
 * A local-part that does not split into exactly two tokens (john.r.smith) casts no vote.
 * Ties go to the earlier canonical pattern, so the result only depends on the
 * multiset of local-parts.
 */
public final class PatternInference {

    private static final int SHORT_LOCAL_PART_MAX = 5;

    private PatternInference() {
    }

    public static Optional<EmailPattern> infer(Collection<String> localParts) {
        if (localParts == null || localParts.isEmpty()) {
            return Optional.empty();
        }

        Map<EmailPattern, Integer> votes = new EnumMap<>(EmailPattern.class);
        for (String raw : localParts) {
            vote(raw).ifPresent(p -> votes.merge(p, 1, Integer::sum));
        }

        EmailPattern best = null;
        int bestVotes = 0;
        for (EmailPattern p : EmailPattern.values()) {
            int v = votes.getOrDefault(p, 0);
            if (v > bestVotes) {
                best = p;
                bestVotes = v;
            }
        }
        return Optional.ofNullable(best);
    }

    static Optional<EmailPattern> vote(String rawLocalPart) {
        if (rawLocalPart == null || rawLocalPart.isBlank()) {
            return Optional.empty();
        }
        String local = rawLocalPart.trim().toLowerCase(Locale.ROOT);

        if (local.contains(".") || local.contains("-")) {
            String[] tokens = local.split("[.\\-]");
            if (tokens.length != 2 || tokens[0].isEmpty() || tokens[1].isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(tokens[0].length() == 1 ? EmailPattern.INITIAL_DOT_LAST : EmailPattern.FIRST_DOT_LAST);
        }
        return Optional.of(local.length() <= SHORT_LOCAL_PART_MAX ? EmailPattern.INITIAL_LAST : EmailPattern.FIRST_LAST);
    }
}

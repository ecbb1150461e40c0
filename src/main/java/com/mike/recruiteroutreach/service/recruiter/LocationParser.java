package com.mike.recruiteroutreach.service.recruiter;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Pulls the city out of a free-form job location ("Austin, TX, USA" -> "Austin").
 */
public final class LocationParser {

    private static final Set<String> STATES_AND_COUNTRIES = Set.of(
            "usa", "us", "united states", "uk", "united kingdom", "canada", "india",
            "china", "germany", "france", "japan", "australia", "singapore",
            "alabama", "alaska", "arizona", "arkansas", "california", "colorado",
            "connecticut", "delaware", "florida", "georgia", "hawaii", "idaho",
            "illinois", "indiana", "iowa", "kansas", "kentucky", "louisiana",
            "maine", "maryland", "massachusetts", "michigan", "minnesota",
            "mississippi", "missouri", "montana", "nebraska", "nevada",
            "new hampshire", "new jersey", "new mexico", "new york", "north carolina",
            "north dakota", "ohio", "oklahoma", "oregon", "pennsylvania",
            "rhode island", "south carolina", "south dakota", "tennessee", "texas",
            "utah", "vermont", "virginia", "washington", "west virginia",
            "wisconsin", "wyoming",
            "al", "ak", "az", "ar", "ca", "co", "ct", "de", "fl", "ga", "hi",
            "id", "il", "in", "ia", "ks", "ky", "la", "me", "md", "ma", "mi",
            "mn", "ms", "mo", "mt", "ne", "nv", "nh", "nj", "nm", "ny", "nc",
            "nd", "oh", "ok", "or", "pa", "ri", "sc", "sd", "tn", "tx", "ut",
            "vt", "va", "wa", "wv", "wi", "wy", "d.c.", "dc"
    );

    private LocationParser() {
    }

    public static Optional<String> extractCity(String location) {
        if (location == null || location.isBlank()) {
            return Optional.empty();
        }

        List<String> parts = Arrays.stream(location.split(","))
                .map(String::trim)
                .toList();

        Optional<String> city = parts.stream()
                .filter(p -> p.length() > 1)
                .filter(p -> !STATES_AND_COUNTRIES.contains(p.toLowerCase(Locale.ROOT)))
                .findFirst();
        if (city.isPresent()) {
            return city;
        }
        String first = parts.get(0);
        return first.isEmpty() ? Optional.empty() : Optional.of(first);
    }
}

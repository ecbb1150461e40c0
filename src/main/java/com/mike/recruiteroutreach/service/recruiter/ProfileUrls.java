package com.mike.recruiteroutreach.service.recruiter;

import java.util.Locale;

public final class ProfileUrls {

    private static final String PROFILE_MARKER = "linkedin.com/in/";

    private ProfileUrls() {
    }

    /**
     * Lowercased, trailing slashes stripped. Doubles as the dedup key.
     */
    public static String normalize(String url) {
        if (url == null) {
            return "";
        }
        String u = url.trim().toLowerCase(Locale.ROOT);
        int end = u.length();
        while (end > 0 && u.charAt(end - 1) == '/') {
            end--;
        }
        return u.substring(0, end);
    }

    public static boolean isProfileUrl(String url) {
        return url != null && url.toLowerCase(Locale.ROOT).contains(PROFILE_MARKER);
    }
}

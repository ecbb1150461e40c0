package com.mike.recruiteroutreach.service.search;

/**
 * One web search backend. Implementations never throw for backend trouble,
 * they report it as a failed {@link SearchOutcome}.
 */
public interface SearchProvider {

    /**
     * Short tag stored as the contact source, e.g. "duckduckgo".
     */
    String name();

    /**
     * Whether the credentials this backend needs are present.
     */
    boolean isConfigured();

    SearchOutcome execute(String query);
}

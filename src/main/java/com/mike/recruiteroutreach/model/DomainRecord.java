package com.mike.recruiteroutreach.model;

/**
 * Email domain of a company plus the naming pattern found for it.
 * Recomputed per company on every run, never persisted on its own.
 *
 * @param pattern null when no pattern was found (combinatorics fallback)
 */
public record DomainRecord(
        String domain,
        DiscoveryTier domainTier,
        EmailPattern pattern,
        DiscoveryTier patternTier
) {

    public static DomainRecord withoutPattern(String domain, DiscoveryTier domainTier) {
        return new DomainRecord(domain, domainTier, null, DiscoveryTier.COMBINATORICS);
    }

    public DomainRecord withPattern(EmailPattern pattern, DiscoveryTier tier) {
        return new DomainRecord(domain, domainTier, pattern, tier);
    }

    public boolean hasPattern() {
        return pattern != null;
    }
}

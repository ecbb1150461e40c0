package com.mike.recruiteroutreach.service.email;

import com.mike.recruiteroutreach.dto.DirectoryRecord;
import com.mike.recruiteroutreach.dto.SearchHit;
import com.mike.recruiteroutreach.model.DiscoveryTier;
import com.mike.recruiteroutreach.model.DomainRecord;
import com.mike.recruiteroutreach.model.EmailPattern;
import com.mike.recruiteroutreach.service.search.SearchOutcome;
import com.mike.recruiteroutreach.service.search.SearchProvider;
import com.mike.recruiteroutreach.service.search.TavilySearchProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds a company's mail domain and naming pattern, tier by tier, stopping at
 * the first tier that answers. Every failure is soft: a tier that errors
 * simply yields nothing.
 * <p>
 * Domain: web-search vote, then directory, then organization search.<br>
 * Pattern: regex-mined addresses from web search, then directory, then none
 * (caller generates all candidates).
 */
@Slf4j
@Service
public class DomainPatternResolver {

    private final SearchProvider webSearch;
    private final DirectoryLookup directoryLookup;
    private final OrgSearch orgSearch;

    public DomainPatternResolver(TavilySearchProvider webSearch, DirectoryLookup directoryLookup, OrgSearch orgSearch) {
        this.webSearch = webSearch;
        this.directoryLookup = directoryLookup;
        this.orgSearch = orgSearch;
    }

    public Optional<DomainRecord> resolve(String company) {
        Optional<DomainRecord> domain = discoverDomain(company);
        if (domain.isEmpty()) {
            log.info("DomainPatternResolver: could not determine domain for company='{}', emails will not be generated", company);
            return Optional.empty();
        }

        DomainRecord record = domain.get();
        return Optional.of(discoverPattern(record.domain(), company)
                .map(found -> record.withPattern(found.pattern(), found.patternTier()))
                .orElse(record));
    }

    public Optional<DomainRecord> discoverDomain(String company) {
        if (company == null || company.isBlank()) {
            throw new IllegalArgumentException("company is empty - cannot discover email domain");
        }

        if (webSearch.isConfigured()) {
            Optional<String> voted = domainViaSearch(company);
            if (voted.isPresent()) {
                log.info("DomainPatternResolver: domain={} for company='{}' (tier=WEB_SEARCH)", voted.get(), company);
                return Optional.of(DomainRecord.withoutPattern(voted.get(), DiscoveryTier.WEB_SEARCH));
            }
        }

        if (directoryLookup.isConfigured()) {
            Optional<String> fromDirectory = directoryLookup.byCompany(company)
                    .map(DirectoryRecord::domain)
                    .filter(d -> !d.isBlank())
                    .map(d -> d.trim().toLowerCase(Locale.ROOT));
            if (fromDirectory.isPresent()) {
                log.info("DomainPatternResolver: domain={} for company='{}' (tier=DIRECTORY)", fromDirectory.get(), company);
                return Optional.of(DomainRecord.withoutPattern(fromDirectory.get(), DiscoveryTier.DIRECTORY));
            }
        }

        if (orgSearch.isConfigured()) {
            Optional<String> fromOrg = orgSearch.primaryDomain(company);
            if (fromOrg.isPresent()) {
                log.info("DomainPatternResolver: domain={} for company='{}' (tier=ORG_SEARCH)", fromOrg.get(), company);
                return Optional.of(DomainRecord.withoutPattern(fromOrg.get(), DiscoveryTier.ORG_SEARCH));
            }
        }

        return Optional.empty();
    }

    /**
     * @return record carrying the pattern and the tier that found it, or empty
     * when the combinatorics fallback applies
     */
    public Optional<DomainRecord> discoverPattern(String domain, String company) {
        if (webSearch.isConfigured()) {
            Optional<EmailPattern> mined = patternViaSearch(domain);
            if (mined.isPresent()) {
                log.info("DomainPatternResolver: pattern={} for @{} (tier=WEB_SEARCH)", mined.get().template(), domain);
                return Optional.of(new DomainRecord(domain, null, mined.get(), DiscoveryTier.WEB_SEARCH));
            }
        }

        if (directoryLookup.isConfigured()) {
            Optional<EmailPattern> fromDirectory = directoryLookup.byDomain(domain)
                    .map(DirectoryRecord::pattern)
                    .flatMap(EmailPattern::fromTemplate);
            if (fromDirectory.isPresent()) {
                log.info("DomainPatternResolver: pattern={} for @{} (tier=DIRECTORY)", fromDirectory.get().template(), domain);
                return Optional.of(new DomainRecord(domain, null, fromDirectory.get(), DiscoveryTier.DIRECTORY));
            }
        }

        log.info("DomainPatternResolver: no pattern for @{} (company='{}'), falling back to combinatorics", domain, company);
        return Optional.empty();
    }

    private Optional<String> domainViaSearch(String company) {
        SearchOutcome outcome = webSearch.execute(company + " careers jobs email contact");
        if (!outcome.isSuccess()) {
            log.warn("DomainPatternResolver: domain search failed for company='{}': {}", company, outcome.failure());
            return Optional.empty();
        }
        return voteForDomain(outcome.hits());
    }

    /**
     * Most frequent non-ATS root domain across the result URLs; ties go to the
     * domain seen first.
     */
    static Optional<String> voteForDomain(List<SearchHit> hits) {
        Map<String, Integer> votes = new LinkedHashMap<>();
        for (SearchHit hit : hits) {
            RootDomains.extract(hit.url())
                    .filter(d -> !RootDomains.isAtsDomain(d))
                    .ifPresent(d -> votes.merge(d, 1, Integer::sum));
        }

        String best = null;
        int bestVotes = 0;
        for (Map.Entry<String, Integer> entry : votes.entrySet()) {
            if (entry.getValue() > bestVotes) {
                best = entry.getKey();
                bestVotes = entry.getValue();
            }
        }
        return Optional.ofNullable(best);
    }

    private Optional<EmailPattern> patternViaSearch(String domain) {
        SearchOutcome outcome = webSearch.execute("\"@" + domain + "\" email contact");
        if (!outcome.isSuccess()) {
            log.warn("DomainPatternResolver: pattern search failed for @{}: {}", domain, outcome.failure());
            return Optional.empty();
        }

        List<String> localParts = mineLocalParts(outcome.hits(), domain);
        log.info("DomainPatternResolver: mined {} address(es) at @{}", localParts.size(), domain);
        log.debug("DomainPatternResolver: local parts={}", localParts);
        return PatternInference.infer(localParts);
    }

    static List<String> mineLocalParts(List<SearchHit> hits, String domain) {
        Pattern addressAtDomain = Pattern.compile(
                "\\b([a-z][a-z0-9]*(?:[.\\-][a-z][a-z0-9]*)*)@" + Pattern.quote(domain) + "\\b",
                Pattern.CASE_INSENSITIVE);

        List<String> found = new ArrayList<>();
        for (SearchHit hit : hits) {
            for (String field : new String[]{hit.title(), hit.snippet(), hit.url()}) {
                if (field == null) {
                    continue;
                }
                Matcher m = addressAtDomain.matcher(field);
                while (m.find()) {
                    found.add(m.group(1));
                }
            }
        }
        return found;
    }
}

package com.mike.recruiteroutreach.service.recruiter;

import com.mike.recruiteroutreach.config.RecruiterFinderProperties;
import com.mike.recruiteroutreach.dto.SearchHit;
import com.mike.recruiteroutreach.model.Contact;
import com.mike.recruiteroutreach.model.JobFamily;
import com.mike.recruiteroutreach.service.Sleeper;
import com.mike.recruiteroutreach.service.search.SearchOutcome;
import com.mike.recruiteroutreach.service.search.SearchProvider;
import com.mike.recruiteroutreach.service.search.SearchProviderRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Runs the recruiter query cascade over the ordered search backends.
 * <p>
 * Queries go out strictly one after another. A single backend cursor is shared
 * by all queries of a call: the first failure of a backend moves the cursor to
 * the next one for good, so a rate-limited backend is never hit again in the
 * same call.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SearchCascadeEngine {

    private final SearchProviderRegistry providerRegistry;
    private final RecruiterQueryBuilder queryBuilder;
    private final ContactNormalizer contactNormalizer;
    private final RecruiterFinderProperties properties;
    private final Sleeper sleeper;
    private final Clock clock;

    public List<Contact> executeQueryCascade(String company, JobFamily jobFamily, String locationHint, int maxResults) {
        if (company == null || company.isBlank()) {
            throw new IllegalArgumentException("company is empty - cannot search for recruiters");
        }
        if (maxResults <= 0) {
            throw new IllegalArgumentException("maxResults must be positive, got " + maxResults);
        }

        String companyName = company.trim();
        List<String> queries = queryBuilder.buildQueries(companyName, jobFamily, locationHint);
        List<SearchProvider> backends = providerRegistry.availableBackends();

        log.info("SearchCascadeEngine: company='{}', jobFamily={}, location='{}', maxResults={}, queries={}, backends={}",
                companyName, jobFamily, locationHint, maxResults, queries.size(),
                backends.stream().map(SearchProvider::name).toList());

        int backendIndex = 0;
        Map<String, Contact> unique = new LinkedHashMap<>();

        for (int i = 0; i < queries.size(); i++) {
            if (unique.size() >= maxResults) {
                break;
            }
            if (backendIndex >= backends.size()) {
                log.warn("SearchCascadeEngine: all search backends exhausted, stopping after {} of {} queries",
                        i, queries.size());
                break;
            }

            if (i > 0 && !pauseBetweenQueries()) {
                break;
            }

            String query = queries.get(i);
            log.info("SearchCascadeEngine: query {}/{}: {}", i + 1, queries.size(), query);

            List<SearchHit> hits = List.of();
            String usedBackend = null;
            while (backendIndex < backends.size()) {
                SearchProvider backend = backends.get(backendIndex);
                SearchOutcome outcome = backend.execute(query);
                if (outcome.isSuccess()) {
                    hits = outcome.hits();
                    usedBackend = backend.name();
                    log.info("SearchCascadeEngine: [{}] returned {} result(s)", backend.name(), hits.size());
                    break;
                }
                log.warn("SearchCascadeEngine: backend {} failed: {}", backend.name(), outcome.failure());
                backendIndex++;
                if (backendIndex < backends.size()) {
                    log.info("SearchCascadeEngine: switching to backend {}", backends.get(backendIndex).name());
                }
            }

            if (usedBackend == null) {
                continue;
            }

            int added = collect(hits, usedBackend, unique);
            log.info("SearchCascadeEngine: {} new unique contact(s), total={}", added, unique.size());
        }

        List<Contact> result = new ArrayList<>(unique.values());
        if (result.size() > maxResults) {
            result = result.subList(0, maxResults);
        }

        log.info("SearchCascadeEngine: returning {} contact(s) for company='{}'", result.size(), companyName);
        return List.copyOf(result);
    }

    private int collect(List<SearchHit> hits, String source, Map<String, Contact> unique) {
        Instant foundAt = clock.instant().truncatedTo(ChronoUnit.MILLIS);
        int added = 0;
        for (SearchHit hit : hits) {
            if (hit == null || !ProfileUrls.isProfileUrl(hit.url())) {
                continue;
            }
            String key = ProfileUrls.normalize(hit.url());
            if (unique.containsKey(key)) {
                continue;
            }
            Optional<Contact> contact = contactNormalizer.toContact(hit, source, foundAt);
            if (contact.isEmpty()) {
                log.debug("SearchCascadeEngine: unparseable heading '{}' for url={}", hit.title(), hit.url());
                continue;
            }
            unique.put(key, contact.get());
            added++;
        }
        return added;
    }

    /**
     * @return false when the thread was interrupted and the cascade should stop
     */
    private boolean pauseBetweenQueries() {
        long min = Math.max(0, properties.getSearch().getMinDelayMillis());
        long max = Math.max(min, properties.getSearch().getMaxDelayMillis());
        long delay = max > min ? ThreadLocalRandom.current().nextLong(min, max + 1) : min;

        log.info("SearchCascadeEngine: waiting {} ms before next query", delay);
        try {
            sleeper.sleep(Duration.ofMillis(delay));
            return true;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            log.warn("SearchCascadeEngine: interrupted during delay, stopping cascade");
            return false;
        }
    }
}

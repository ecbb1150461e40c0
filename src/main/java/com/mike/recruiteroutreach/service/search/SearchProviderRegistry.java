package com.mike.recruiteroutreach.service.search;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Fixed backend priority: the keyless DuckDuckGo first, then the API backends
 * that have credentials configured.
 */
@Component
@Slf4j
public class SearchProviderRegistry {

    private final List<SearchProvider> ordered;

    @Autowired
    public SearchProviderRegistry(DuckDuckGoSearchProvider duckDuckGo,
                                  BraveSearchProvider brave,
                                  TavilySearchProvider tavily,
                                  GoogleCseSearchProvider googleCse,
                                  SerpApiSearchProvider serpApi) {
        this(List.of(duckDuckGo, brave, tavily, googleCse, serpApi));
    }

    SearchProviderRegistry(List<SearchProvider> ordered) {
        this.ordered = List.copyOf(ordered);
    }

    public List<SearchProvider> availableBackends() {
        List<SearchProvider> available = ordered.stream()
                .filter(SearchProvider::isConfigured)
                .toList();
        log.debug("SearchProviderRegistry: available backends={}",
                available.stream().map(SearchProvider::name).toList());
        return available;
    }
}

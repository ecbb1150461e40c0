package com.mike.recruiteroutreach.service.email;

import com.mike.recruiteroutreach.dto.DirectoryRecord;
import com.mike.recruiteroutreach.dto.SearchHit;
import com.mike.recruiteroutreach.model.DiscoveryTier;
import com.mike.recruiteroutreach.model.DomainRecord;
import com.mike.recruiteroutreach.model.EmailPattern;
import com.mike.recruiteroutreach.service.search.SearchFailure;
import com.mike.recruiteroutreach.service.search.SearchOutcome;
import com.mike.recruiteroutreach.service.search.TavilySearchProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DomainPatternResolverTest {

    private static final String DOMAIN_QUERY = "Acme careers jobs email contact";
    private static final String PATTERN_QUERY = "\"@acme.com\" email contact";

    private TavilySearchProvider webSearch;
    private DirectoryLookup directory;
    private OrgSearch orgSearch;
    private DomainPatternResolver resolver;

    @BeforeEach
    void setUp() {
        webSearch = mock(TavilySearchProvider.class);
        directory = mock(DirectoryLookup.class);
        orgSearch = mock(OrgSearch.class);

        when(webSearch.isConfigured()).thenReturn(true);
        when(webSearch.execute(anyString())).thenReturn(SearchOutcome.success(List.of()));
        when(directory.isConfigured()).thenReturn(true);
        when(directory.byCompany(anyString())).thenReturn(Optional.empty());
        when(directory.byDomain(anyString())).thenReturn(Optional.empty());
        when(orgSearch.isConfigured()).thenReturn(true);
        when(orgSearch.primaryDomain(anyString())).thenReturn(Optional.empty());

        resolver = new DomainPatternResolver(webSearch, directory, orgSearch);
    }

    private static SearchHit page(String url) {
        return new SearchHit(url, "title", "");
    }

    @Nested
    @DisplayName("discoverDomain")
    class DiscoverDomain {

        @Test
        @DisplayName("most frequent non-ATS root domain wins")
        void votes_on_root_domains_excluding_ats() {
            //Arrange
            when(webSearch.execute(DOMAIN_QUERY)).thenReturn(SearchOutcome.success(List.of(
                    page("https://boards.greenhouse.io/acme/jobs/1"),
                    page("https://boards.greenhouse.io/acme/jobs/2"),
                    page("https://boards.greenhouse.io/acme/jobs/3"),
                    page("https://careers.acme.com/open-roles"),
                    page("https://www.acme.com/about"),
                    page("https://www.linkedin.com/company/acme"))));
            //Act
            Optional<DomainRecord> result = resolver.discoverDomain("Acme");
            //Assert
            assertThat(result).isPresent();
            assertThat(result.get().domain()).isEqualTo("acme.com");
            assertThat(result.get().domainTier()).isEqualTo(DiscoveryTier.WEB_SEARCH);
            verify(directory, never()).byCompany(anyString());
        }

        @Test
        @DisplayName("tied vote -> domain seen first")
        void tie_goes_to_first_seen() {
            assertThat(DomainPatternResolver.voteForDomain(List.of(
                    page("https://acme.io/jobs"),
                    page("https://acme.com/jobs"),
                    page("https://www.acme.com/"),
                    page("https://acme.io/team"))))
                    .contains("acme.io");
        }

        @Test
        @DisplayName("failed web search falls through to the directory")
        void directory_after_failed_search() {
            //Arrange
            when(webSearch.execute(DOMAIN_QUERY))
                    .thenReturn(SearchOutcome.failed(SearchFailure.Reason.RATE_LIMITED, "432"));
            when(directory.byCompany("Acme")).thenReturn(Optional.of(new DirectoryRecord("Acme.com", null)));
            //Act
            Optional<DomainRecord> result = resolver.discoverDomain("Acme");
            //Assert
            assertThat(result).map(DomainRecord::domain).contains("acme.com");
            assertThat(result).map(DomainRecord::domainTier).contains(DiscoveryTier.DIRECTORY);
        }

        @Test
        @DisplayName("org search is the last tier")
        void org_search_last() {
            //Arrange
            when(webSearch.isConfigured()).thenReturn(false);
            when(orgSearch.primaryDomain("Acme")).thenReturn(Optional.of("acme.com"));
            //Act
            Optional<DomainRecord> result = resolver.discoverDomain("Acme");
            //Assert
            assertThat(result).map(DomainRecord::domainTier).contains(DiscoveryTier.ORG_SEARCH);
            verify(webSearch, never()).execute(anyString());
        }

        @Test
        @DisplayName("every tier empty -> empty, no exception")
        void nothing_found() {
            assertThat(resolver.discoverDomain("Acme")).isEmpty();
        }

        @Test
        @DisplayName("blank company -> IllegalArgumentException")
        void blank_company() {
            assertThatThrownBy(() -> resolver.discoverDomain(" "))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("discoverPattern")
    class DiscoverPattern {

        @Test
        @DisplayName("mined addresses vote for the pattern")
        void mines_addresses_from_results() {
            //Arrange
            when(webSearch.execute(PATTERN_QUERY)).thenReturn(SearchOutcome.success(List.of(
                    new SearchHit("https://acme.com/press", "Press contact: J.Doe@acme.com", ""),
                    new SearchHit("https://acme.com/team", "Team", "reach a.smith@acme.com or info@other.com"))));
            //Act
            Optional<DomainRecord> result = resolver.discoverPattern("acme.com", "Acme");
            //Assert
            assertThat(result).map(DomainRecord::pattern).contains(EmailPattern.INITIAL_DOT_LAST);
            assertThat(result).map(DomainRecord::patternTier).contains(DiscoveryTier.WEB_SEARCH);
        }

        @Test
        @DisplayName("directory template used when search mines nothing")
        void directory_pattern() {
            //Arrange
            when(directory.byDomain("acme.com")).thenReturn(Optional.of(new DirectoryRecord("acme.com", "{first}")));
            //Act
            Optional<DomainRecord> result = resolver.discoverPattern("acme.com", "Acme");
            //Assert
            assertThat(result).map(DomainRecord::pattern).contains(EmailPattern.FIRST);
            assertThat(result).map(DomainRecord::patternTier).contains(DiscoveryTier.DIRECTORY);
        }

        @Test
        @DisplayName("non-canonical directory template -> combinatorics")
        void unknown_template_is_ignored() {
            //Arrange
            when(directory.byDomain("acme.com")).thenReturn(Optional.of(new DirectoryRecord("acme.com", "{first}_{last}")));
            //Act + Assert
            assertThat(resolver.discoverPattern("acme.com", "Acme")).isEmpty();
        }
    }

    @Nested
    @DisplayName("resolve")
    class Resolve {

        @Test
        @DisplayName("domain without pattern -> combinatorics tier")
        void domain_only() {
            //Arrange
            when(webSearch.execute(DOMAIN_QUERY)).thenReturn(SearchOutcome.success(List.of(page("https://acme.com/careers"))));
            //Act
            Optional<DomainRecord> result = resolver.resolve("Acme");
            //Assert
            assertThat(result).isPresent();
            assertThat(result.get().hasPattern()).isFalse();
            assertThat(result.get().patternTier()).isEqualTo(DiscoveryTier.COMBINATORICS);
        }

        @Test
        @DisplayName("domain and mined pattern")
        void domain_and_pattern() {
            //Arrange
            when(webSearch.execute(DOMAIN_QUERY)).thenReturn(SearchOutcome.success(List.of(page("https://acme.com/careers"))));
            when(webSearch.execute(PATTERN_QUERY)).thenReturn(SearchOutcome.success(List.of(
                    new SearchHit("https://acme.com/a", "jane.doe@acme.com", "john.smith@acme.com"))));
            //Act
            DomainRecord result = resolver.resolve("Acme").orElseThrow();
            //Assert
            assertThat(result.domain()).isEqualTo("acme.com");
            assertThat(result.domainTier()).isEqualTo(DiscoveryTier.WEB_SEARCH);
            assertThat(result.pattern()).isEqualTo(EmailPattern.FIRST_DOT_LAST);
        }

        @Test
        @DisplayName("no domain -> empty")
        void no_domain() {
            assertThat(resolver.resolve("Acme")).isEmpty();
        }
    }
}

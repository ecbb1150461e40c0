package com.mike.recruiteroutreach.service.recruiter;

import com.mike.recruiteroutreach.model.JobFamily;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class RecruiterQueryBuilderTest {

    private final RecruiterQueryBuilder builder = new RecruiterQueryBuilder();

    @Nested
    @DisplayName("LocationParser.extractCity")
    class ExtractCity {

        @Test
        @DisplayName("Austin, TX, USA -> Austin")
        void city_state_country() {
            assertThat(LocationParser.extractCity("Austin, TX, USA")).contains("Austin");
        }

        @Test
        @DisplayName("leading state and country are skipped")
        void skips_state_before_city() {
            assertThat(LocationParser.extractCity("USA, Seattle")).contains("Seattle");
        }

        @Test
        @DisplayName("only a country -> falls back to the first part")
        void only_country_falls_back() {
            assertThat(LocationParser.extractCity("United States")).contains("United States");
        }

        @Test
        @DisplayName("null / blank -> empty")
        void blank_is_empty() {
            assertThat(LocationParser.extractCity(null)).isEqualTo(Optional.empty());
            assertThat(LocationParser.extractCity(" ")).isEqualTo(Optional.empty());
        }
    }

    @Nested
    @DisplayName("buildQueries")
    class BuildQueries {

        @Test
        @DisplayName("city query precedes the unqualified one for each term")
        void austin_software_engineering() {
            //Act
            List<String> queries = builder.buildQueries("Acme", JobFamily.SOFTWARE_ENGINEERING, "Austin, TX, USA");
            //Assert
            assertThat(queries).containsExactly(
                    "site:linkedin.com/in \"Acme\" \"technical recruiter\" \"Austin\"",
                    "site:linkedin.com/in \"Acme\" \"technical recruiter\"",
                    "site:linkedin.com/in \"Acme\" \"engineering recruiter\" \"Austin\"",
                    "site:linkedin.com/in \"Acme\" \"engineering recruiter\"");
        }

        @Test
        @DisplayName("no location -> one query per term")
        void without_location() {
            //Act
            List<String> queries = builder.buildQueries("Acme", JobFamily.MARKETING, null);
            //Assert
            assertThat(queries).containsExactly(
                    "site:linkedin.com/in \"Acme\" \"marketing recruiter\"",
                    "site:linkedin.com/in \"Acme\" \"talent acquisition\"");
        }

        @Test
        @DisplayName("unknown job family -> generic recruiter terms")
        void unknown_family_uses_fallback_terms() {
            //Act
            List<String> queries = builder.buildQueries("Acme", null, "");
            //Assert
            assertThat(queries).containsExactly(
                    "site:linkedin.com/in \"Acme\" \"recruiter\"",
                    "site:linkedin.com/in \"Acme\" \"talent acquisition\"");
        }
    }
}

package com.mike.recruiteroutreach.service.recruiter;

import com.mike.recruiteroutreach.dto.SearchHit;
import com.mike.recruiteroutreach.model.Contact;
import com.mike.recruiteroutreach.model.ParsedHeading;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ContactNormalizerTest {

    private ContactNormalizer normalizer;

    @BeforeEach
    void setUp() {
        normalizer = new ContactNormalizer();
    }

    @Nested
    @DisplayName("parseHeading")
    class ParseHeading {

        @Test
        @DisplayName("name - role | LinkedIn -> name and role")
        void parses_name_and_role_with_platform_suffix() {
            //Arrange
            String heading = "Jane Doe - Technical Recruiter at Acme | LinkedIn";
            //Act
            Optional<ParsedHeading> result = normalizer.parseHeading(heading);
            //Assert
            assertTrue(result.isPresent());
            assertEquals("Jane Doe", result.get().name());
            assertEquals("Technical Recruiter at Acme", result.get().title());
        }

        @Test
        @DisplayName("en dash and '- LinkedIn' suffix")
        void parses_en_dash_separator() {
            //Arrange
            String heading = "Carlos Núñez – Talent Acquisition Partner - LinkedIn";
            //Act
            Optional<ParsedHeading> result = normalizer.parseHeading(heading);
            //Assert
            assertTrue(result.isPresent());
            assertEquals("Carlos Núñez", result.get().name());
            assertEquals("Talent Acquisition Partner", result.get().title());
        }

        @Test
        @DisplayName("no separator -> empty")
        void heading_without_separator_is_rejected() {
            //Arrange
            String heading = "Jane Doe | LinkedIn";
            //Act
            Optional<ParsedHeading> result = normalizer.parseHeading(heading);
            //Assert
            assertTrue(result.isEmpty());
        }

        @Test
        @DisplayName("digits in name -> empty")
        void name_with_digits_is_rejected() {
            //Arrange
            String heading = "Top 10 Recruiters - Acme Careers";
            //Act
            Optional<ParsedHeading> result = normalizer.parseHeading(heading);
            //Assert
            assertTrue(result.isEmpty());
        }

        @Test
        @DisplayName("name longer than 60 chars -> empty")
        void overlong_name_is_rejected() {
            //Arrange
            String heading = "A".repeat(61) + " - Recruiter";
            //Act
            Optional<ParsedHeading> result = normalizer.parseHeading(heading);
            //Assert
            assertTrue(result.isEmpty());
        }

        @Test
        @DisplayName("null / blank -> empty")
        void null_and_blank_are_rejected() {
            assertTrue(normalizer.parseHeading(null).isEmpty());
            assertTrue(normalizer.parseHeading("   ").isEmpty());
        }
    }

    @Nested
    @DisplayName("toContact")
    class ToContact {

        @Test
        @DisplayName("profile url is lowercased and trailing slash stripped")
        void builds_contact_with_normalized_url() {
            //Arrange
            Instant foundAt = Instant.parse("2026-03-01T10:00:00Z");
            SearchHit hit = new SearchHit("https://www.LinkedIn.com/in/JaneDoe/",
                    "Jane Doe - Recruiter | LinkedIn", "snippet");
            //Act
            Optional<Contact> contact = normalizer.toContact(hit, "brave", foundAt);
            //Assert
            assertTrue(contact.isPresent());
            assertEquals("https://www.linkedin.com/in/janedoe", contact.get().profileUrl());
            assertEquals("Jane Doe", contact.get().name());
            assertEquals("Recruiter", contact.get().title());
            assertEquals("brave", contact.get().source());
            assertEquals(foundAt, contact.get().foundAt());
            assertNull(contact.get().email());
            assertTrue(contact.get().triedAddresses().isEmpty());
        }
    }
}

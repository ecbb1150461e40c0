package com.mike.recruiteroutreach.service;

import com.mike.recruiteroutreach.entity.JobPosting;
import com.mike.recruiteroutreach.model.BounceStatus;
import com.mike.recruiteroutreach.model.Contact;
import com.mike.recruiteroutreach.model.JobFamily;
import com.mike.recruiteroutreach.repository.JobPostingRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.context.annotation.Import;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@Import(ContactStore.class)
class ContactStoreTest {

    @Autowired
    private ContactStore store;

    @Autowired
    private JobPostingRepository jobPostingRepository;

    @Autowired
    private TestEntityManager entityManager;

    private Long jobId;

    @BeforeEach
    void setUp() {
        JobPosting job = jobPostingRepository.save(JobPosting.builder()
                .company("Acme")
                .jobTitle("Backend Engineer")
                .jobFamily(JobFamily.SOFTWARE_ENGINEERING)
                .location("Austin, TX, USA")
                .build());
        jobId = job.getId();
    }

    @Test
    void persist_then_load_preserves_every_field() {
        Contact contact = Contact.builder()
                .name("Jane Doe")
                .title("Technical Recruiter")
                .profileUrl("https://www.linkedin.com/in/janedoe")
                .email("jane.doe@acme.com,jdoe@acme.com,j.doe@acme.com")
                .source("brave")
                .foundAt(Instant.parse("2026-03-01T10:00:00.123Z"))
                .emailSentAt(Instant.parse("2026-03-01T11:15:30.456Z"))
                .emailSentTo("jdoe@acme.com")
                .triedAddresses(List.of("jane.doe@acme.com", "jdoe@acme.com"))
                .bounceStatus(BounceStatus.TENTATIVE_DELIVERED)
                .build();

        Contact saved = store.save(jobId, contact);
        entityManager.flush();
        entityManager.clear();

        List<Contact> loaded = store.load(jobId);

        assertThat(loaded).hasSize(1);
        assertThat(loaded.get(0)).isEqualTo(contact.withId(saved.id()));
    }

    @Test
    void save_with_id_overwrites_the_row() {
        Contact saved = store.save(jobId, Contact.builder().name("Jane Doe").email("a@x.com,b@x.com").build());

        store.save(jobId, saved.recordSend("a@x.com", Instant.parse("2026-03-01T12:00:00Z")));
        entityManager.flush();
        entityManager.clear();

        List<Contact> loaded = store.load(jobId);
        assertThat(loaded).hasSize(1);
        assertThat(loaded.get(0).triedAddresses()).containsExactly("a@x.com");
        assertThat(loaded.get(0).bounceStatus()).isEqualTo(BounceStatus.PENDING);
    }

    @Test
    void append_skips_known_profiles_and_keeps_order() {
        store.appendDiscovered(jobId, List.of(
                Contact.builder().name("Jane Doe").profileUrl("https://www.linkedin.com/in/janedoe").build(),
                Contact.builder().name("John Smith").profileUrl("https://www.linkedin.com/in/johnsmith").build()));

        List<Contact> added = store.appendDiscovered(jobId, List.of(
                Contact.builder().name("Jane Doe").profileUrl("https://www.linkedin.com/in/JaneDoe/").build(),
                Contact.builder().name("Kim Lee").profileUrl("https://www.linkedin.com/in/kimlee").build()));
        entityManager.flush();
        entityManager.clear();

        assertThat(added).extracting(Contact::name).containsExactly("Kim Lee");
        assertThat(store.load(jobId)).extracting(Contact::name).containsExactly("Jane Doe", "John Smith", "Kim Lee");
    }

    @Test
    void unknown_job_is_rejected() {
        assertThatThrownBy(() -> store.load(9_999L)).isInstanceOf(IllegalArgumentException.class);
    }
}

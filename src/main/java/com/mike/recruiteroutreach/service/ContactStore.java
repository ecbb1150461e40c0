package com.mike.recruiteroutreach.service;

import com.mike.recruiteroutreach.entity.JobPosting;
import com.mike.recruiteroutreach.entity.RecruiterContact;
import com.mike.recruiteroutreach.model.Contact;
import com.mike.recruiteroutreach.repository.JobPostingRepository;
import com.mike.recruiteroutreach.repository.RecruiterContactRepository;
import com.mike.recruiteroutreach.service.recruiter.ProfileUrls;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Durable contact list per job posting. Converts between immutable
 * {@link Contact} snapshots and JPA rows; every field round-trips unchanged.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ContactStore {

    private final JobPostingRepository jobPostingRepository;
    private final RecruiterContactRepository contactRepository;

    @Transactional(readOnly = true)
    public List<Contact> load(Long jobPostingId) {
        requireJob(jobPostingId);
        return contactRepository.findByJobPostingIdOrderByPositionAsc(jobPostingId).stream()
                .map(ContactStore::toContact)
                .toList();
    }

    /**
     * Inserts a contact without id at the end of the job's list, otherwise
     * overwrites the stored row.
     */
    @Transactional
    public Contact save(Long jobPostingId, Contact contact) {
        JobPosting job = requireJob(jobPostingId);

        RecruiterContact entity;
        if (contact.id() == null) {
            entity = RecruiterContact.builder()
                    .jobPosting(job)
                    .position((int) contactRepository.countByJobPostingId(jobPostingId))
                    .build();
        } else {
            entity = contactRepository.findByIdAndJobPostingId(contact.id(), jobPostingId)
                    .orElseThrow(() -> new IllegalArgumentException(
                            "contact id=" + contact.id() + " does not belong to job posting id=" + jobPostingId));
        }

        copyInto(contact, entity);
        return toContact(contactRepository.save(entity));
    }

    /**
     * Appends newly discovered contacts, skipping profile URLs the job already has.
     *
     * @return the stored copies of the contacts actually added
     */
    @Transactional
    public List<Contact> appendDiscovered(Long jobPostingId, List<Contact> discovered) {
        requireJob(jobPostingId);

        Set<String> known = new HashSet<>();
        for (RecruiterContact existing : contactRepository.findByJobPostingIdOrderByPositionAsc(jobPostingId)) {
            if (existing.getProfileUrl() != null) {
                known.add(ProfileUrls.normalize(existing.getProfileUrl()));
            }
        }

        List<Contact> added = new ArrayList<>();
        for (Contact contact : discovered) {
            if (contact.profileUrl() != null && !known.add(ProfileUrls.normalize(contact.profileUrl()))) {
                log.debug("ContactStore: skipping known profile url={}", contact.profileUrl());
                continue;
            }
            added.add(save(jobPostingId, contact.withId(null)));
        }

        log.info("ContactStore: jobPostingId={}, discovered={}, added={}", jobPostingId, discovered.size(), added.size());
        return added;
    }

    private JobPosting requireJob(Long jobPostingId) {
        if (jobPostingId == null) {
            throw new IllegalArgumentException("job posting id is required");
        }
        return jobPostingRepository.findById(jobPostingId)
                .orElseThrow(() -> new IllegalArgumentException("unknown job posting id=" + jobPostingId));
    }

    private static void copyInto(Contact contact, RecruiterContact entity) {
        entity.setName(contact.name());
        entity.setTitle(contact.title());
        entity.setProfileUrl(contact.profileUrl());
        entity.setEmail(contact.email());
        entity.setSource(contact.source());
        entity.setFoundAt(contact.foundAt());
        entity.setEmailSentAt(contact.emailSentAt());
        entity.setEmailSentTo(contact.emailSentTo());
        entity.getTriedAddresses().clear();
        entity.getTriedAddresses().addAll(contact.triedAddresses());
        entity.setBounceStatus(contact.bounceStatus());
    }

    static Contact toContact(RecruiterContact entity) {
        return Contact.builder()
                .id(entity.getId())
                .name(entity.getName())
                .title(entity.getTitle())
                .profileUrl(entity.getProfileUrl())
                .email(entity.getEmail())
                .source(entity.getSource())
                .foundAt(entity.getFoundAt())
                .emailSentAt(entity.getEmailSentAt())
                .emailSentTo(entity.getEmailSentTo())
                .triedAddresses(new ArrayList<>(entity.getTriedAddresses()))
                .bounceStatus(entity.getBounceStatus())
                .build();
    }
}

package com.mike.recruiteroutreach.service;

import com.mike.recruiteroutreach.config.OutreachProperties;
import com.mike.recruiteroutreach.config.RecruiterFinderProperties;
import com.mike.recruiteroutreach.dto.ContactView;
import com.mike.recruiteroutreach.dto.CreateJobPostingRequest;
import com.mike.recruiteroutreach.dto.OutreachRunSummary;
import com.mike.recruiteroutreach.entity.JobPosting;
import com.mike.recruiteroutreach.model.Contact;
import com.mike.recruiteroutreach.model.DomainRecord;
import com.mike.recruiteroutreach.model.JobFamily;
import com.mike.recruiteroutreach.repository.JobPostingRepository;
import com.mike.recruiteroutreach.repository.RecruiterContactRepository;
import com.mike.recruiteroutreach.service.delivery.BounceCheckResult;
import com.mike.recruiteroutreach.service.delivery.BounceDetector;
import com.mike.recruiteroutreach.service.delivery.DeliveryStateMachine;
import com.mike.recruiteroutreach.service.delivery.OutreachDraft;
import com.mike.recruiteroutreach.service.delivery.SendBatchResult;
import com.mike.recruiteroutreach.service.email.DomainPatternResolver;
import com.mike.recruiteroutreach.service.email.EmailAddressGenerator;
import com.mike.recruiteroutreach.service.recruiter.SearchCascadeEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Entry point of the pipeline: recruiter discovery, email generation, batched
 * sending and bounce reconciliation, both on plain contact lists and on the
 * contacts stored for a job posting.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OutreachService {

    private final SearchCascadeEngine searchCascadeEngine;
    private final DomainPatternResolver domainPatternResolver;
    private final EmailAddressGenerator emailAddressGenerator;
    private final DeliveryStateMachine deliveryStateMachine;
    private final BounceDetector bounceDetector;
    private final ContactStore contactStore;
    private final JobPostingRepository jobPostingRepository;
    private final RecruiterContactRepository contactRepository;
    private final RecruiterFinderProperties finderProperties;
    private final OutreachProperties outreachProperties;
    private final Sleeper sleeper;
    private final Clock clock;

    public List<Contact> findRecruiters(String company, JobFamily jobFamily, String locationHint, int maxResults) {
        return searchCascadeEngine.executeQueryCascade(company, jobFamily, locationHint, maxResults);
    }

    /**
     * Fills in the email field of every contact whose name can be parsed.
     * Without a resolvable domain the contacts come back unchanged.
     */
    public List<Contact> findEmails(String company, List<Contact> contacts) {
        Optional<DomainRecord> resolved = domainPatternResolver.resolve(company);
        if (resolved.isEmpty()) {
            return List.copyOf(contacts);
        }

        DomainRecord record = resolved.get();
        log.info("OutreachService: company='{}', domain={} ({}), pattern={} ({})",
                company, record.domain(), record.domainTier(),
                record.hasPattern() ? record.pattern().template() : "none", record.patternTier());

        List<Contact> result = new ArrayList<>(contacts.size());
        int generated = 0;
        for (Contact contact : contacts) {
            Optional<String> email = emailAddressGenerator.generate(contact.name(), record.domain(), record.pattern());
            if (email.isPresent()) {
                result.add(contact.withEmail(email.get()));
                generated++;
            } else {
                log.info("OutreachService: cannot parse name '{}', no email generated", contact.name());
                result.add(contact);
            }
        }
        log.info("OutreachService: generated emails for {}/{} contact(s)", generated, contacts.size());
        return result;
    }

    public SendBatchResult sendBatch(List<Contact> contacts, int maxSend, OutreachDraft draft,
                                     boolean dryRun, UnaryOperator<Contact> persist) {
        return deliveryStateMachine.sendBatch(contacts, maxSend, draft, dryRun, persist);
    }

    public BounceCheckResult checkBounces(List<Contact> contacts, Duration lookback) {
        return bounceDetector.checkBounces(contacts, lookback);
    }

    /**
     * Waits for bounce notifications to arrive, then polls once. An interrupt
     * during the wait skips the poll and returns the contacts unchanged.
     */
    public BounceCheckResult awaitAndCheckBounces(List<Contact> contacts, Duration wait, Duration lookback) {
        log.info("OutreachService: waiting {}s before bounce check", wait.toSeconds());
        try {
            sleeper.sleep(wait);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            log.warn("OutreachService: interrupted while waiting for bounces, skipping check");
            return new BounceCheckResult(List.copyOf(contacts), 0, 0);
        }
        return checkBounces(contacts, lookback);
    }

    public JobPosting createJob(CreateJobPostingRequest request) {
        if (request == null || request.company() == null || request.company().isBlank()) {
            throw new IllegalArgumentException("company is required");
        }
        JobPosting job = JobPosting.builder()
                .url(request.url())
                .company(request.company().trim())
                .jobTitle(request.jobTitle())
                .jobFamily(request.jobFamily())
                .location(request.location())
                .emailSubject(request.emailSubject())
                .emailBody(request.emailBody())
                .build();
        JobPosting saved = jobPostingRepository.save(job);
        log.info("OutreachService: created job posting id={}, company='{}'", saved.getId(), saved.getCompany());
        return saved;
    }

    public List<ContactView> listContacts(Long jobPostingId) {
        return contactStore.load(jobPostingId).stream().map(this::toView).toList();
    }

    /**
     * Runs the cascade for the job, generates addresses for the new contacts
     * and appends them to the stored list.
     */
    public List<ContactView> discoverForJob(Long jobPostingId, Integer maxResults) {
        JobPosting job = requireJob(jobPostingId);
        int limit = maxResults != null ? maxResults : finderProperties.getSearch().getDefaultMaxResults();

        List<Contact> found = findRecruiters(job.getCompany(), job.getJobFamily(), job.getLocation(), limit);
        if (found.isEmpty()) {
            log.info("OutreachService: no recruiters found for jobPostingId={}", jobPostingId);
            return listContacts(jobPostingId);
        }

        List<Contact> withEmails = findEmails(job.getCompany(), found);
        contactStore.appendDiscovered(jobPostingId, withEmails);
        return listContacts(jobPostingId);
    }

    public OutreachRunSummary sendForJob(Long jobPostingId, Integer maxSend, boolean dryRun) {
        JobPosting job = requireJob(jobPostingId);
        if (!outreachProperties.isEnabled() && !dryRun) {
            log.info("OutreachService: outreach disabled, skipping send for jobPostingId={}", jobPostingId);
            return new OutreachRunSummary(jobPostingId, 0, false, listContacts(jobPostingId));
        }

        int limit = maxSend != null ? maxSend : outreachProperties.getMaxSendPerRun();
        OutreachDraft draft = new OutreachDraft(
                job.getEmailSubject(),
                job.getEmailBody(),
                outreachProperties.getFromAddress(),
                outreachProperties.getFromName(),
                resumeAttachment());

        SendBatchResult result = sendBatch(contactStore.load(jobPostingId), limit, draft, dryRun,
                contact -> contactStore.save(jobPostingId, contact));

        return new OutreachRunSummary(jobPostingId, result.sentCount(), dryRun,
                result.contacts().stream().map(this::toView).toList());
    }

    public OutreachRunSummary checkBouncesForJob(Long jobPostingId) {
        return checkBouncesForJob(jobPostingId, false);
    }

    /**
     * @param waitFirst wait {@code outreach.bounce-wait-seconds} for notifications
     *                  to arrive before polling
     */
    public OutreachRunSummary checkBouncesForJob(Long jobPostingId, boolean waitFirst) {
        requireJob(jobPostingId);
        List<Contact> contacts = contactStore.load(jobPostingId);

        BounceCheckResult result = waitFirst
                ? awaitAndCheckBounces(contacts, bounceWait(), lookback())
                : checkBounces(contacts, lookback());
        List<Contact> stored = persistChanged(jobPostingId, contacts, result.contacts());

        return new OutreachRunSummary(jobPostingId, result.bounceCount(), false,
                stored.stream().map(this::toView).toList());
    }

    /**
     * Job ids with at least one send inside the current bounce lookback window.
     */
    public List<Long> jobsWithRecentSends() {
        return contactRepository.findJobPostingIdsWithSendsSince(clock.instant().minus(lookback()));
    }

    public Duration lookback() {
        return Duration.ofMinutes(outreachProperties.getBounceLookbackMinutes());
    }

    public Duration bounceWait() {
        return Duration.ofSeconds(outreachProperties.getBounceWaitSeconds());
    }

    private List<Contact> persistChanged(Long jobPostingId, List<Contact> before, List<Contact> after) {
        List<Contact> stored = new ArrayList<>(after.size());
        for (int i = 0; i < after.size(); i++) {
            Contact updated = after.get(i);
            stored.add(updated.equals(before.get(i)) ? updated : contactStore.save(jobPostingId, updated));
        }
        return stored;
    }

    private Path resumeAttachment() {
        String resumePath = outreachProperties.getResumePath();
        if (resumePath == null || resumePath.isBlank()) {
            return null;
        }
        Path path = Path.of(resumePath);
        if (!Files.isRegularFile(path)) {
            log.warn("OutreachService: resume not found at {}, sending without attachment", path);
            return null;
        }
        return path;
    }

    private JobPosting requireJob(Long jobPostingId) {
        return jobPostingRepository.findById(jobPostingId)
                .orElseThrow(() -> new IllegalArgumentException("unknown job posting id=" + jobPostingId));
    }

    private ContactView toView(Contact c) {
        return new ContactView(
                c.id(),
                c.name(),
                c.title(),
                c.profileUrl(),
                c.email(),
                c.source(),
                c.foundAt(),
                c.emailSentAt(),
                c.emailSentTo(),
                c.triedAddresses(),
                c.bounceStatus(),
                deliveryStateMachine.state(c),
                deliveryStateMachine.nextAddress(c).orElse(null));
    }
}

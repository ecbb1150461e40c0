package com.mike.recruiteroutreach.bootstrap;

import com.mike.recruiteroutreach.config.OutreachProperties;
import com.mike.recruiteroutreach.dto.OutreachRunSummary;
import com.mike.recruiteroutreach.service.OutreachService;
import com.mike.recruiteroutreach.service.delivery.MailboxAuthException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodic bounce poll over every job with sends inside the lookback window.
 * Off unless {@code outreach.bounce-cron.enabled=true}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BounceCheckCronJob {

    private final OutreachService outreachService;
    private final OutreachProperties outreachProperties;

    private final AtomicBoolean running = new AtomicBoolean(false);

    @Scheduled(fixedDelayString = "${outreach.bounce-cron.interval-millis:900000}")
    public void runBounceCheck() {
        if (!outreachProperties.getBounceCron().isEnabled()) {
            log.debug("BounceCheckCronJob: disabled, skipping");
            return;
        }

        if (!running.compareAndSet(false, true)) {
            log.info("BounceCheckCronJob: already running, skipping");
            return;
        }

        try {
            List<Long> jobIds = outreachService.jobsWithRecentSends();
            if (jobIds.isEmpty()) {
                log.info("BounceCheckCronJob: no recent sends to check");
                return;
            }

            log.info("BounceCheckCronJob: checking {} job(s)", jobIds.size());
            int bounced = 0;
            int errors = 0;

            for (Long jobId : jobIds) {
                try {
                    OutreachRunSummary summary = outreachService.checkBouncesForJob(jobId);
                    bounced += summary.affected();
                } catch (MailboxAuthException e) {
                    log.error("BounceCheckCronJob: mailbox login failed, stopping run: {}", e.getMessage());
                    return;
                } catch (Exception e) {
                    errors++;
                    log.warn("BounceCheckCronJob: error while checking jobPostingId={}: {}", jobId, e.getMessage());
                }
            }

            log.info("BounceCheckCronJob: finished, jobs={}, bounced={}, errors={}", jobIds.size(), bounced, errors);
        } finally {
            running.set(false);
        }
    }
}

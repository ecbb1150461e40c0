package com.mike.recruiteroutreach.service.delivery;

import com.mike.recruiteroutreach.config.OutreachProperties;
import com.mike.recruiteroutreach.model.BounceStatus;
import com.mike.recruiteroutreach.model.Contact;
import com.mike.recruiteroutreach.model.DeliveryState;
import com.mike.recruiteroutreach.service.Sleeper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Per-contact send/retry lifecycle.
 * <pre>
 * NEVER_SENT -> SENT_PENDING -> DELIVERED
 *                            -> BOUNCED -> (next untried address) SENT_PENDING
 *                                       -> EXHAUSTED
 * </pre>
 * Callers must serialize batches against the same contact set; state is
 * read-modify-write.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DeliveryStateMachine {

    private final Mailbox mailbox;
    private final MessageComposer messageComposer;
    private final OutreachProperties outreachProperties;
    private final Sleeper sleeper;
    private final Clock clock;

    public DeliveryState state(Contact contact) {
        if (contact.candidateAddresses().isEmpty()) {
            return DeliveryState.NO_ADDRESS;
        }
        if (!contact.wasSent()) {
            return DeliveryState.NEVER_SENT;
        }
        return switch (contact.bounceStatus()) {
            case PENDING -> DeliveryState.SENT_PENDING;
            case TENTATIVE_DELIVERED -> DeliveryState.DELIVERED;
            case BOUNCED -> contact.untriedAddresses().isEmpty() ? DeliveryState.EXHAUSTED : DeliveryState.BOUNCED;
        };
    }

    public boolean isEligible(Contact contact) {
        if (contact.untriedAddresses().isEmpty()) {
            return false;
        }
        return !contact.wasSent() || contact.bounceStatus() == BounceStatus.BOUNCED;
    }

    /**
     * First candidate, in generation order, that was never sent to.
     */
    public Optional<String> nextAddress(Contact contact) {
        return contact.untriedAddresses().stream().findFirst();
    }

    /**
     * Sends to up to {@code maxSend} eligible contacts in list order. Each
     * completed send is handed to {@code persist} before the next one starts,
     * so a failure leaves every earlier send recorded.
     *
     * @param persist stores one updated contact and returns the stored copy
     * @throws DeliveryException    on the first failed send; remaining contacts are not attempted
     * @throws MailboxAuthException when the mail transport rejects the credentials
     */
    public SendBatchResult sendBatch(List<Contact> contacts, int maxSend, OutreachDraft draft,
                                     boolean dryRun, UnaryOperator<Contact> persist) {
        if (maxSend <= 0) {
            throw new IllegalArgumentException("maxSend must be positive, got " + maxSend);
        }
        if (draft == null || !draft.isComplete()) {
            throw new IllegalArgumentException("email subject and body are required before sending");
        }

        List<Contact> result = new ArrayList<>(contacts);
        List<Integer> selected = new ArrayList<>();
        for (int i = 0; i < result.size() && selected.size() < maxSend; i++) {
            if (isEligible(result.get(i))) {
                selected.add(i);
            }
        }

        log.info("DeliveryStateMachine: {} eligible of {} contact(s), sending {} (maxSend={}, dryRun={})",
                result.stream().filter(this::isEligible).count(), result.size(), selected.size(), maxSend, dryRun);

        long delayMs = outreachProperties.getDelayBetweenEmailsMillis();
        int sent = 0;

        for (int n = 0; n < selected.size(); n++) {
            int index = selected.get(n);
            Contact contact = result.get(index);
            String address = nextAddress(contact).orElseThrow();
            String label = attemptLabel(contact);

            if (dryRun) {
                log.info("DeliveryStateMachine: [DRY RUN {}/{}] {} <{}>{} greeting='{}'{}",
                        n + 1, selected.size(), contact.name(), address, label,
                        messageComposer.greeting(contact.name()),
                        draft.attachment() != null ? " attachment=" + draft.attachment().getFileName() : "");
                sent++;
                continue;
            }

            try {
                mailbox.send(messageComposer.compose(draft, contact, address));
            } catch (DeliveryException e) {
                log.warn("DeliveryStateMachine: send to {} <{}> failed, aborting batch after {} send(s): {}",
                        contact.name(), address, sent, e.getMessage());
                throw e;
            }

            Instant now = clock.instant().truncatedTo(ChronoUnit.MILLIS);
            Contact stored = persist.apply(contact.recordSend(address, now));
            result.set(index, stored);
            sent++;

            log.info("DeliveryStateMachine: sent [{}/{}] {} <{}>{}", n + 1, selected.size(), contact.name(), address, label);

            boolean isLast = n == selected.size() - 1;
            if (delayMs > 0 && !isLast) {
                try {
                    sleeper.sleep(Duration.ofMillis(delayMs));
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    log.warn("DeliveryStateMachine: interrupted during delay, stopping batch after {} send(s)", sent);
                    break;
                }
            }
        }

        return new SendBatchResult(List.copyOf(result), sent);
    }

    private static String attemptLabel(Contact contact) {
        if (contact.triedAddresses().isEmpty()) {
            return "";
        }
        return " [retry " + (contact.triedAddresses().size() + 1) + "/" + contact.candidateAddresses().size() + "]";
    }
}

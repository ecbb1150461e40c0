package com.mike.recruiteroutreach.service.delivery;

import com.mike.recruiteroutreach.model.BounceStatus;
import com.mike.recruiteroutreach.model.Contact;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reconciles pending sends against the bounce notifications of one lookback
 * window. A send inside the window with no matching bounce is only
 * tentatively delivered; sends older than the window are never judged.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BounceDetector {

    private static final Pattern ANGLE_ADDRESS = Pattern.compile("<([^<>\\s]+@[^<>\\s]+)>");
    private static final Pattern BARE_ADDRESS = Pattern.compile("[A-Za-z0-9._%+\\-]+@[A-Za-z0-9.\\-]+\\.[A-Za-z]{2,}");

    private final Mailbox mailbox;
    private final Clock clock;

    public BounceCheckResult checkBounces(List<Contact> contacts, Duration lookback) {
        if (lookback == null || lookback.isNegative() || lookback.isZero()) {
            throw new IllegalArgumentException("lookback window must be positive, got " + lookback);
        }

        Instant cutoff = clock.instant().minus(lookback);
        Set<String> bounced = new LinkedHashSet<>();
        for (FailureNotification notification : mailbox.listFailureNotifications(cutoff)) {
            bounced.addAll(failedRecipients(notification));
        }
        log.info("BounceDetector: {} bounced address(es) since {}", bounced.size(), cutoff);
        log.debug("BounceDetector: bounced={}", bounced);

        List<Contact> result = new ArrayList<>(contacts.size());
        int changed = 0;
        for (Contact contact : contacts) {
            Contact updated = reconcile(contact, bounced, cutoff);
            if (updated != contact) {
                changed++;
                log.info("BounceDetector: {} <{}> -> {}", contact.name(), contact.emailSentTo(), updated.bounceStatus());
            }
            result.add(updated);
        }

        int bounceCount = (int) result.stream()
                .filter(c -> c.bounceStatus() == BounceStatus.BOUNCED)
                .count();

        log.info("BounceDetector: reconciled {} contact(s), changed={}, bounced total={}",
                contacts.size(), changed, bounceCount);
        return new BounceCheckResult(List.copyOf(result), bounceCount, changed);
    }

    private static Contact reconcile(Contact contact, Set<String> bounced, Instant cutoff) {
        String sentTo = contact.emailSentTo();
        if (sentTo == null || sentTo.isBlank() || contact.emailSentAt() == null) {
            return contact;
        }
        if (contact.emailSentAt().isBefore(cutoff)) {
            return contact;
        }

        if (bounced.contains(sentTo.trim().toLowerCase(Locale.ROOT))) {
            return contact.bounceStatus() == BounceStatus.BOUNCED
                    ? contact
                    : contact.withBounceStatus(BounceStatus.BOUNCED);
        }
        if (contact.bounceStatus() == BounceStatus.PENDING) {
            return contact.withBounceStatus(BounceStatus.TENTATIVE_DELIVERED);
        }
        return contact;
    }

    /**
     * Prefers the structured X-Failed-Recipients header (may list several
     * addresses); falls back to the address in the notification's To header.
     */
    static Set<String> failedRecipients(FailureNotification notification) {
        Set<String> addresses = new LinkedHashSet<>();

        String failed = notification.header("X-Failed-Recipients");
        if (failed != null && !failed.isBlank()) {
            for (String part : failed.split(",")) {
                String address = part.trim().toLowerCase(Locale.ROOT);
                if (!address.isEmpty()) {
                    addresses.add(address);
                }
            }
            return addresses;
        }

        String to = notification.header("To");
        if (to == null || to.isBlank()) {
            return addresses;
        }
        Matcher angle = ANGLE_ADDRESS.matcher(to);
        if (angle.find()) {
            addresses.add(angle.group(1).trim().toLowerCase(Locale.ROOT));
            return addresses;
        }
        Matcher bare = BARE_ADDRESS.matcher(to);
        if (bare.find()) {
            addresses.add(bare.group().toLowerCase(Locale.ROOT));
        }
        return addresses;
    }
}

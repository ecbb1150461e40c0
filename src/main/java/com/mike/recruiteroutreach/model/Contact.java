package com.mike.recruiteroutreach.model;

import lombok.Builder;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Immutable snapshot of a recruiter contact. Discovery, email generation and
 * delivery never mutate a contact, they return an enriched copy.
 *
 * @param email          single address, or comma-joined candidates in generation order
 * @param triedAddresses addresses already sent to, in the order first attempted (append-only)
 */
@Builder(toBuilder = true)
public record Contact(
        Long id,
        String name,
        String title,
        String profileUrl,
        String email,
        String source,
        Instant foundAt,
        Instant emailSentAt,
        String emailSentTo,
        List<String> triedAddresses,
        BounceStatus bounceStatus
) {

    public Contact {
        Objects.requireNonNull(name, "name");
        triedAddresses = triedAddresses == null ? List.of() : List.copyOf(triedAddresses);
        bounceStatus = bounceStatus == null ? BounceStatus.PENDING : bounceStatus;
    }

    public boolean hasEmail() {
        return email != null && !email.isBlank();
    }

    public List<String> candidateAddresses() {
        if (!hasEmail()) {
            return List.of();
        }
        return Arrays.stream(email.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    public List<String> untriedAddresses() {
        return candidateAddresses().stream()
                .filter(a -> !triedAddresses.contains(a))
                .toList();
    }

    public boolean wasSent() {
        return emailSentAt != null;
    }

    public Contact withId(Long newId) {
        return toBuilder().id(newId).build();
    }

    public Contact withEmail(String newEmail) {
        return toBuilder().email(newEmail).build();
    }

    public Contact withBounceStatus(BounceStatus status) {
        return toBuilder().bounceStatus(status).build();
    }

    /**
     * Copy with one more attempt recorded: address appended to the tried list,
     * sent timestamp set and the bounce verdict reset to pending.
     */
    public Contact recordSend(String address, Instant sentAt) {
        List<String> tried = new ArrayList<>(triedAddresses);
        tried.add(address);
        return toBuilder()
                .emailSentAt(sentAt)
                .emailSentTo(address)
                .triedAddresses(tried)
                .bounceStatus(BounceStatus.PENDING)
                .build();
    }
}

package com.mike.recruiteroutreach.service.delivery;

import java.time.Instant;
import java.util.List;

/**
 * Outgoing mail plus read access to the inbox that collects delivery-failure
 * notifications.
 */
public interface Mailbox {

    /**
     * @throws DeliveryException     when the transport rejects the message
     * @throws MailboxAuthException  when credentials are missing or rejected
     */
    void send(OutreachMessage message);

    /**
     * Delivery-failure notifications (mailer-daemon / postmaster) received at or after {@code since}.
     */
    List<FailureNotification> listFailureNotifications(Instant since);
}

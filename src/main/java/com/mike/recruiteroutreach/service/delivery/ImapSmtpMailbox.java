package com.mike.recruiteroutreach.service.delivery;

import com.mike.recruiteroutreach.config.OutreachProperties;
import jakarta.mail.AuthenticationFailedException;
import jakarta.mail.Folder;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.Store;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.search.AndTerm;
import jakarta.mail.search.ComparisonTerm;
import jakarta.mail.search.FromStringTerm;
import jakarta.mail.search.OrTerm;
import jakarta.mail.search.ReceivedDateTerm;
import jakarta.mail.search.SearchTerm;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.FileSystemResource;
import org.springframework.mail.MailAuthenticationException;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;

import java.io.UnsupportedEncodingException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * SMTP for sending (Spring's {@link JavaMailSender}), IMAP for reading bounce
 * notifications back from the sender's inbox.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ImapSmtpMailbox implements Mailbox {

    private static final String[] NOTIFICATION_HEADERS = {"X-Failed-Recipients", "To", "From", "Subject"};

    private final JavaMailSender mailSender;
    private final OutreachProperties outreachProperties;

    @Override
    public void send(OutreachMessage message) {
        try {
            MimeMessage mime = mailSender.createMimeMessage();
            boolean multipart = message.attachment() != null;

            MimeMessageHelper helper = new MimeMessageHelper(mime, multipart, "UTF-8");
            if (message.fromName() != null && !message.fromName().isBlank()) {
                helper.setFrom(message.fromAddress(), message.fromName());
            } else {
                helper.setFrom(message.fromAddress());
            }
            helper.setTo(message.to());
            helper.setSubject(message.subject());
            helper.setText(message.body(), false);

            if (multipart) {
                helper.addAttachment(message.attachment().getFileName().toString(),
                        new FileSystemResource(message.attachment()));
            }

            mailSender.send(mime);
            log.info("ImapSmtpMailbox: sent to={}", message.to());
        } catch (MailAuthenticationException e) {
            throw new MailboxAuthException(
                    "SMTP authentication failed - check spring.mail.username / spring.mail.password (app password may be expired)", e);
        } catch (MailException e) {
            throw new DeliveryException("Failed to send email to " + message.to() + ": " + e.getMessage(), e);
        } catch (MessagingException | UnsupportedEncodingException e) {
            throw new DeliveryException("Could not build email to " + message.to() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public List<FailureNotification> listFailureNotifications(Instant since) {
        OutreachProperties.Imap imap = outreachProperties.getImap();
        if (isBlank(imap.getHost()) || isBlank(imap.getUsername()) || isBlank(imap.getPassword())) {
            throw new MailboxAuthException(
                    "IMAP credentials missing - set outreach.imap.host, outreach.imap.username and outreach.imap.password");
        }

        Properties props = new Properties();
        props.put("mail.store.protocol", "imaps");
        props.put("mail.imaps.connectiontimeout", "15000");
        props.put("mail.imaps.timeout", "15000");
        Session session = Session.getInstance(props);

        Store store = null;
        Folder folder = null;
        try {
            store = session.getStore("imaps");
            store.connect(imap.getHost(), imap.getPort(), imap.getUsername(), imap.getPassword());

            folder = store.getFolder(imap.getFolder());
            folder.open(Folder.READ_ONLY);

            // IMAP date search has day granularity, exact cut happens below
            SearchTerm term = new AndTerm(
                    new ReceivedDateTerm(ComparisonTerm.GE, Date.from(since)),
                    new OrTerm(new FromStringTerm("mailer-daemon"), new FromStringTerm("postmaster")));

            Message[] messages = folder.search(term);
            List<FailureNotification> notifications = new ArrayList<>();
            for (Message message : messages) {
                Date received = message.getReceivedDate();
                if (received == null || received.toInstant().isBefore(since)) {
                    continue;
                }
                notifications.add(new FailureNotification(readHeaders(message), received.toInstant()));
            }

            log.info("ImapSmtpMailbox: {} failure notification(s) since {} in folder={}",
                    notifications.size(), since, imap.getFolder());
            return notifications;
        } catch (AuthenticationFailedException e) {
            throw new MailboxAuthException(
                    "IMAP login rejected for " + imap.getUsername() + " - check outreach.imap.password (app password may be expired)", e);
        } catch (MessagingException e) {
            throw new DeliveryException("Could not read bounce mailbox: " + e.getMessage(), e);
        } finally {
            close(folder, store);
        }
    }

    private static Map<String, String> readHeaders(Message message) throws MessagingException {
        Map<String, String> headers = new HashMap<>();
        for (String name : NOTIFICATION_HEADERS) {
            String[] values = message.getHeader(name);
            if (values != null && values.length > 0) {
                headers.put(name, String.join(",", values));
            }
        }
        return headers;
    }

    private static void close(Folder folder, Store store) {
        try {
            if (folder != null && folder.isOpen()) {
                folder.close(false);
            }
            if (store != null && store.isConnected()) {
                store.close();
            }
        } catch (MessagingException e) {
            log.warn("ImapSmtpMailbox: error while closing IMAP connection: {}", e.getMessage());
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}

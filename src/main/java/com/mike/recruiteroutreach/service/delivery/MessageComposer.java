package com.mike.recruiteroutreach.service.delivery;

import com.mike.recruiteroutreach.model.Contact;
import com.mike.recruiteroutreach.service.email.NameParser;
import org.springframework.stereotype.Component;

import java.util.Locale;

@Component
public class MessageComposer {

    static final String GENERIC_GREETING = "Hi there,";
    static final String SIGN_OFF = "Best,";

    public OutreachMessage compose(OutreachDraft draft, Contact contact, String address) {
        String body = personalize(draft.body(), contact.name(), draft.fromName());
        return new OutreachMessage(address, draft.subject(), body, draft.fromAddress(), draft.fromName(), draft.attachment());
    }

    /**
     * Replaces the first "Hi there," with the recipient's first name and signs
     * the first "Best," with the sender name. Unparseable names keep the
     * generic greeting.
     */
    public String personalize(String body, String recipientName, String senderName) {
        if (body == null) {
            return "";
        }
        String result = body;

        String greeting = greeting(recipientName);
        if (!GENERIC_GREETING.equals(greeting)) {
            result = replaceFirst(result, GENERIC_GREETING, greeting);
        }
        if (senderName != null && !senderName.isBlank()) {
            result = replaceFirst(result, SIGN_OFF, SIGN_OFF + "\n" + senderName.trim());
        }
        return result;
    }

    public String greeting(String recipientName) {
        return NameParser.parse(recipientName)
                .map(name -> "Hi " + capitalize(name.first()) + ",")
                .orElse(GENERIC_GREETING);
    }

    private static String capitalize(String token) {
        return token.substring(0, 1).toUpperCase(Locale.ROOT) + token.substring(1);
    }

    private static String replaceFirst(String text, String target, String replacement) {
        int idx = text.indexOf(target);
        if (idx < 0) {
            return text;
        }
        return text.substring(0, idx) + replacement + text.substring(idx + target.length());
    }
}

package com.mike.recruiteroutreach.service.delivery;

import com.mike.recruiteroutreach.model.Contact;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;

class MessageComposerTest {

    private final MessageComposer composer = new MessageComposer();

    @Test
    void replaces_greeting_and_signs_once() {
        //Arrange
        String body = "Hi there,\nI applied.\nBest,\n\nPS: Hi there, again. Best, me";
        //Act
        String result = composer.personalize(body, "José Núñez", "Alex");
        //Assert
        assertEquals("Hi Jose,\nI applied.\nBest,\nAlex\n\nPS: Hi there, again. Best, me", result);
    }

    @Test
    void keeps_generic_greeting_when_name_is_unparseable() {
        assertEquals("Hi there,\nBest,", composer.personalize("Hi there,\nBest,", "Madonna", null));
    }

    @Test
    void compose_carries_draft_fields() {
        //Arrange
        OutreachDraft draft = new OutreachDraft("Subject", "Hi there,", "me@example.com", "Alex", Path.of("cv.pdf"));
        Contact contact = Contact.builder().name("Jane Doe").build();
        //Act
        OutreachMessage message = composer.compose(draft, contact, "jane@acme.com");
        //Assert
        assertEquals("jane@acme.com", message.to());
        assertEquals("Hi Jane,", message.body());
        assertEquals("me@example.com", message.fromAddress());
        assertEquals(Path.of("cv.pdf"), message.attachment());
    }
}

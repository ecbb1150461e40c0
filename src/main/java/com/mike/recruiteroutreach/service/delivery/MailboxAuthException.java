package com.mike.recruiteroutreach.service.delivery;

public class MailboxAuthException extends RuntimeException {

    public MailboxAuthException(String message) {
        super(message);
    }

    public MailboxAuthException(String message, Throwable cause) {
        super(message, cause);
    }
}

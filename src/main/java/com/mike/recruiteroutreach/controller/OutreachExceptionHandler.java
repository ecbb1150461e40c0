package com.mike.recruiteroutreach.controller;

import com.mike.recruiteroutreach.service.delivery.DeliveryException;
import com.mike.recruiteroutreach.service.delivery.MailboxAuthException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@Slf4j
@RestControllerAdvice
public class OutreachExceptionHandler {

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleInvalid(IllegalArgumentException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(Map.of("error", "invalid_request", "message", ex.getMessage()));
    }

    @ExceptionHandler(DeliveryException.class)
    public ResponseEntity<Map<String, String>> handleDelivery(DeliveryException ex) {
        log.error("OutreachExceptionHandler: delivery failed: {}", ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                .body(Map.of("error", "delivery_failed", "message", ex.getMessage()));
    }

    @ExceptionHandler(MailboxAuthException.class)
    public ResponseEntity<Map<String, String>> handleMailboxAuth(MailboxAuthException ex) {
        log.error("OutreachExceptionHandler: mailbox authentication failed: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                .body(Map.of("error", "mailbox_auth", "message", ex.getMessage()));
    }
}

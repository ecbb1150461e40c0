package com.mike.recruiteroutreach.service.delivery;

import com.mike.recruiteroutreach.model.Contact;

import java.util.List;

/**
 * @param contacts  every input contact, updated where a send happened
 * @param sentCount sends performed, or previewed in dry-run
 */
public record SendBatchResult(List<Contact> contacts, int sentCount) {
}

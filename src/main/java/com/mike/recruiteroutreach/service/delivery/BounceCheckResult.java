package com.mike.recruiteroutreach.service.delivery;

import com.mike.recruiteroutreach.model.Contact;

import java.util.List;

/**
 * @param bounceCount  contacts whose current status is bounced, after reconciliation
 * @param changedCount contacts whose status changed in this poll
 */
public record BounceCheckResult(List<Contact> contacts, int bounceCount, int changedCount) {
}

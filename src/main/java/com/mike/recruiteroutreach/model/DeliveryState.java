package com.mike.recruiteroutreach.model;

public enum DeliveryState {
    /** no email address could be generated */
    NO_ADDRESS,
    NEVER_SENT,
    SENT_PENDING,
    DELIVERED,
    /** last attempt bounced, another candidate is still untried */
    BOUNCED,
    EXHAUSTED
}

package com.mike.recruiteroutreach.model;

/**
 * Bounce verdict of the most recent send.
 * <p>
 * TENTATIVE_DELIVERED only means that no failure notification arrived inside
 * the lookback window. It is not a delivery receipt.
 */
public enum BounceStatus {
    PENDING,
    BOUNCED,
    TENTATIVE_DELIVERED
}

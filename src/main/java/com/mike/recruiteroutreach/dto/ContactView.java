package com.mike.recruiteroutreach.dto;

import com.mike.recruiteroutreach.model.BounceStatus;
import com.mike.recruiteroutreach.model.DeliveryState;

import java.time.Instant;
import java.util.List;

public record ContactView(
        Long id,
        String name,
        String title,
        String profileUrl,
        String email,
        String source,
        Instant foundAt,
        Instant emailSentAt,
        String emailSentTo,
        List<String> triedAddresses,
        BounceStatus bounceStatus,
        DeliveryState deliveryState,
        String nextAddress
) {
}

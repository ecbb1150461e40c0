package com.mike.recruiteroutreach.entity;

import com.mike.recruiteroutreach.model.BounceStatus;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "recruiter_contacts",
        uniqueConstraints = @UniqueConstraint(columnNames = {"job_posting_id", "profile_url"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RecruiterContact {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "job_posting_id", nullable = false)
    private JobPosting jobPosting;

    // insertion order within the job, contacts are always loaded in this order
    @Column(nullable = false)
    private int position;

    @Column(nullable = false)
    private String name;

    private String title;

    @Column(name = "profile_url", length = 1024)
    private String profileUrl;

    // single address or comma-joined candidates
    @Column(length = 2000)
    private String email;

    private String source;

    private Instant foundAt;

    private Instant emailSentAt;

    private String emailSentTo;

    @ElementCollection
    @CollectionTable(name = "recruiter_contact_tried_addresses", joinColumns = @JoinColumn(name = "contact_id"))
    @OrderColumn(name = "attempt_index")
    @Column(name = "address", nullable = false)
    @Builder.Default
    private List<String> triedAddresses = new ArrayList<>();

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private BounceStatus bounceStatus;
}

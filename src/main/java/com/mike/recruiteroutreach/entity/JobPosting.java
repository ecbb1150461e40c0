package com.mike.recruiteroutreach.entity;

import com.mike.recruiteroutreach.model.JobFamily;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

@Entity
@Table(name = "job_postings")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class JobPosting {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(length = 2048)
    private String url;

    @Column(nullable = false)
    private String company;

    private String jobTitle;

    @Enumerated(EnumType.STRING)
    private JobFamily jobFamily;

    private String location;

    private String emailSubject;

    @Column(length = 10000)
    private String emailBody;

    @Column(nullable = false)
    private Instant createdAt;

    @PrePersist
    void prePersist() {
        if (createdAt == null) createdAt = Instant.now().truncatedTo(ChronoUnit.MILLIS);
    }
}

package com.mike.recruiteroutreach.repository;

import com.mike.recruiteroutreach.entity.RecruiterContact;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface RecruiterContactRepository extends JpaRepository<RecruiterContact, Long> {

    List<RecruiterContact> findByJobPostingIdOrderByPositionAsc(Long jobPostingId);

    Optional<RecruiterContact> findByIdAndJobPostingId(Long id, Long jobPostingId);

    long countByJobPostingId(Long jobPostingId);

    @Query("select distinct c.jobPosting.id from RecruiterContact c where c.emailSentAt >= :since")
    List<Long> findJobPostingIdsWithSendsSince(@Param("since") Instant since);
}

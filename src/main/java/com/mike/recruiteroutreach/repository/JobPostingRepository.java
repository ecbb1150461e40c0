package com.mike.recruiteroutreach.repository;

import com.mike.recruiteroutreach.entity.JobPosting;
import org.springframework.data.jpa.repository.JpaRepository;

public interface JobPostingRepository extends JpaRepository<JobPosting, Long> {
}

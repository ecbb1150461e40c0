package com.mike.recruiteroutreach.controller;

import com.mike.recruiteroutreach.dto.ContactView;
import com.mike.recruiteroutreach.dto.CreateJobPostingRequest;
import com.mike.recruiteroutreach.dto.OutreachRunSummary;
import com.mike.recruiteroutreach.entity.JobPosting;
import com.mike.recruiteroutreach.service.OutreachService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/jobs")
@RequiredArgsConstructor
public class OutreachController {

    private final OutreachService outreachService;

    @PostMapping
    public ResponseEntity<Map<String, Object>> createJob(@RequestBody CreateJobPostingRequest request) {
        JobPosting job = outreachService.createJob(request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(Map.of("id", job.getId(), "company", job.getCompany()));
    }

    @GetMapping("/{id}/recruiters")
    public List<ContactView> recruiters(@PathVariable Long id) {
        return outreachService.listContacts(id);
    }

    @PostMapping("/{id}/recruiters")
    public List<ContactView> discoverRecruiters(@PathVariable Long id,
                                                @RequestParam(required = false) Integer maxResults) {
        return outreachService.discoverForJob(id, maxResults);
    }

    @PostMapping("/{id}/outreach/send")
    public OutreachRunSummary send(@PathVariable Long id,
                                   @RequestParam(required = false) Integer maxSend,
                                   @RequestParam(defaultValue = "false") boolean dryRun) {
        return outreachService.sendForJob(id, maxSend, dryRun);
    }

    @PostMapping("/{id}/outreach/bounces")
    public OutreachRunSummary checkBounces(@PathVariable Long id,
                                           @RequestParam(defaultValue = "false") boolean wait) {
        return outreachService.checkBouncesForJob(id, wait);
    }
}

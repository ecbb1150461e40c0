package com.mike.recruiteroutreach.service.email;

import com.mike.recruiteroutreach.dto.DirectoryRecord;

import java.util.Optional;

/**
 * Company email directory (domain and naming pattern on record).
 */
public interface DirectoryLookup {

    boolean isConfigured();

    Optional<DirectoryRecord> byCompany(String company);

    Optional<DirectoryRecord> byDomain(String domain);
}

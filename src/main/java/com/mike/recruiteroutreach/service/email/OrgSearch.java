package com.mike.recruiteroutreach.service.email;

import java.util.Optional;

/**
 * Organization search returning the primary web domain of a company.
 */
public interface OrgSearch {

    boolean isConfigured();

    Optional<String> primaryDomain(String company);
}

package com.mike.recruiteroutreach.model;

public enum DiscoveryTier {
    WEB_SEARCH,
    DIRECTORY,
    ORG_SEARCH,
    COMBINATORICS
}

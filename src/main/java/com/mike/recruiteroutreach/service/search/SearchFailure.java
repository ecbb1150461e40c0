package com.mike.recruiteroutreach.service.search;

/**
 * Why a backend call failed. For failover every reason means the same thing:
 * the backend is dead for the rest of the cascade.
 */
public record SearchFailure(Reason reason, String message) {

    public enum Reason {
        TIMEOUT,
        NETWORK,
        RATE_LIMITED,
        AUTH,
        BLOCKED,
        MALFORMED,
        HTTP_ERROR
    }

    @Override
    public String toString() {
        return reason + ": " + message;
    }
}

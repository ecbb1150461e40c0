package com.mike.recruiteroutreach.model;

/**
 * Lowercase ASCII-only first/last name tokens ready for address generation.
 */
public record PersonName(String first, String last) {

    public String firstInitial() {
        return first.substring(0, 1);
    }

    public String lastInitial() {
        return last.substring(0, 1);
    }
}

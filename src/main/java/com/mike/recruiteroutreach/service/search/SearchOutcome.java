package com.mike.recruiteroutreach.service.search;

import com.mike.recruiteroutreach.dto.SearchHit;

import java.util.List;

public record SearchOutcome(List<SearchHit> hits, SearchFailure failure) {

    public SearchOutcome {
        hits = hits == null ? List.of() : List.copyOf(hits);
    }

    public static SearchOutcome success(List<SearchHit> hits) {
        return new SearchOutcome(hits, null);
    }

    public static SearchOutcome failed(SearchFailure.Reason reason, String message) {
        return new SearchOutcome(List.of(), new SearchFailure(reason, message));
    }

    public boolean isSuccess() {
        return failure == null;
    }
}

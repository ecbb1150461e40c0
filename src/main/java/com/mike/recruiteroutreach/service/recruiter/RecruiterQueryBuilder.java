package com.mike.recruiteroutreach.service.recruiter;

import com.mike.recruiteroutreach.model.JobFamily;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Builds the ordered query list of one cascade: for each of the two role terms
 * a city-qualified query (when a city is known) followed by the unqualified one.
 */
@Component
public class RecruiterQueryBuilder {

    public List<String> buildQueries(String company, JobFamily jobFamily, String locationHint) {
        List<String> terms = JobFamily.searchTermsFor(jobFamily);
        Optional<String> city = LocationParser.extractCity(locationHint);

        List<String> queries = new ArrayList<>();
        for (String term : terms.subList(0, Math.min(2, terms.size()))) {
            city.ifPresent(c -> queries.add(query(company, term) + " \"" + c + "\""));
            queries.add(query(company, term));
        }
        return queries;
    }

    private static String query(String company, String term) {
        return "site:linkedin.com/in \"" + company + "\" \"" + term + "\"";
    }
}

package com.mike.recruiteroutreach.service.email;

import com.mike.recruiteroutreach.model.EmailPattern;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class PatternInferenceTest {

    @Test
    @DisplayName("j.doe, a.smith -> {f}.{last}")
    void initial_dot_last() {
        assertThat(PatternInference.infer(List.of("j.doe", "a.smith")))
                .contains(EmailPattern.INITIAL_DOT_LAST);
    }

    @Test
    @DisplayName("dotted full first names -> {first}.{last}")
    void first_dot_last() {
        assertThat(PatternInference.infer(List.of("jane.doe", "alex-smith", "jdoe")))
                .contains(EmailPattern.FIRST_DOT_LAST);
    }

    @Test
    @DisplayName("short and long undotted local parts")
    void undotted_shapes() {
        assertThat(PatternInference.infer(List.of("jdoe", "asmith"))).isPresent();
        assertThat(PatternInference.vote("jdoe")).contains(EmailPattern.INITIAL_LAST);
        assertThat(PatternInference.vote("janedoe")).contains(EmailPattern.FIRST_LAST);
    }

    @Test
    @DisplayName("three-token local part casts no vote")
    void three_tokens_do_not_vote() {
        assertThat(PatternInference.vote("john.r.smith")).isEmpty();
        assertThat(PatternInference.infer(List.of("john.r.smith", "jdoe")))
                .contains(EmailPattern.INITIAL_LAST);
    }

    @Test
    @DisplayName("tie goes to the earlier canonical pattern")
    void tie_break_by_priority() {
        // one vote each for FIRST_DOT_LAST and INITIAL_DOT_LAST
        assertThat(PatternInference.infer(List.of("j.doe", "jane.doe")))
                .contains(EmailPattern.FIRST_DOT_LAST);
    }

    @Test
    @DisplayName("result does not depend on arrival order")
    void order_independent() {
        List<String> parts = new ArrayList<>(List.of("j.doe", "jane.doe", "jdoe", "a.smith", "janedoe", "bob"));
        Optional<EmailPattern> expected = PatternInference.infer(parts);

        for (int i = 0; i < 10; i++) {
            Collections.shuffle(parts);
            assertThat(PatternInference.infer(parts)).isEqualTo(expected);
        }
    }

    @Test
    @DisplayName("nothing usable -> empty")
    void nothing_to_vote_on() {
        assertThat(PatternInference.infer(List.of())).isEmpty();
        assertThat(PatternInference.infer(List.of(".doe", "jane."))).isEmpty();
    }
}

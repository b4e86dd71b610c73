package com.phillippitts.dictavault.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MatchTest {

    @Test
    void exactMatchIsNotApproximate() {
        Match m = Match.of("Email", "bob@example.com", 14, 29);

        assertThat(m.approximate()).isFalse();
        assertThat(m.length()).isEqualTo(15);
        assertThat(m.fitsWithin(29)).isTrue();
        assertThat(m.fitsWithin(28)).isFalse();
    }

    @Test
    void rejectsEmptyOrNegativeSpans() {
        assertThatThrownBy(() -> Match.of("SSN", "x", -1, 2)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Match.of("SSN", "x", 3, 3)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Match.of("SSN", "x", 5, 2)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsNullCategory() {
        assertThatThrownBy(() -> Match.of(null, "x", 0, 1)).isInstanceOf(NullPointerException.class);
    }
}

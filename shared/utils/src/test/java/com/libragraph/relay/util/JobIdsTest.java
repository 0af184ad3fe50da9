package com.libragraph.relay.util;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

class JobIdsTest {

    @Test
    void newIdIsWellFormed() {
        String id = JobIds.newId();
        assertThat(id).hasSize(JobIds.LENGTH);
        assertThat(JobIds.isWellFormed(id)).isTrue();
    }

    @Test
    void consecutiveIdsDiffer() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 1000; i++) {
            ids.add(JobIds.newId());
        }
        // 32 bits of randomness; a collision in 1000 draws is vanishingly rare
        assertThat(ids).hasSizeGreaterThan(995);
    }

    @Test
    void rejectsWrongShapes() {
        assertThat(JobIds.isWellFormed(null)).isFalse();
        assertThat(JobIds.isWellFormed("")).isFalse();
        assertThat(JobIds.isWellFormed("abc")).isFalse();
        assertThat(JobIds.isWellFormed("ABCDEF12")).isFalse();
        assertThat(JobIds.isWellFormed("../../et")).isFalse();
    }

    @Test
    void requireWellFormedReportsTheBadId() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> JobIds.requireWellFormed("nope"))
                .withMessageContaining("'nope'");
        assertThatNullPointerException()
                .isThrownBy(() -> JobIds.requireWellFormed(null));
    }
}

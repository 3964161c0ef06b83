package com.visionai.gateway.core.id;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Random;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class EventIdGeneratorTest {

    @Test
    void shouldFollowEventMillisRandomFormat() {
        EventIdGenerator ids = new EventIdGenerator(() -> 1_700_000_000_123L, new Random(7));

        String id = ids.next();

        assertThat(id).matches("event_1700000000123_[0-9a-z]{9}");
    }

    @Test
    void shouldProduceDistinctIdsWithinTheSameMillisecond() {
        EventIdGenerator ids = new EventIdGenerator(() -> 42L, new Random(1));
        Set<String> seen = new HashSet<>();

        for (int i = 0; i < 1000; i++) {
            seen.add(ids.next());
        }

        assertThat(seen).hasSize(1000);
    }

    @Test
    void defaultGeneratorShouldNotRepeatAcrossThousandCalls() {
        EventIdGenerator ids = new EventIdGenerator();
        Set<String> seen = new HashSet<>();

        for (int i = 0; i < 1000; i++) {
            seen.add(ids.next());
        }

        assertThat(seen).hasSize(1000);
    }
}

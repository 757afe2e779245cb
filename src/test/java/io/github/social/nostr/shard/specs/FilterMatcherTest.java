package io.github.social.nostr.shard.specs;

import static io.github.social.nostr.shard.specs.EventFixtures.ALICE;
import static io.github.social.nostr.shard.specs.EventFixtures.BOB;
import static io.github.social.nostr.shard.specs.EventFixtures.event;
import static io.github.social.nostr.shard.specs.EventFixtures.hex;
import static io.github.social.nostr.shard.specs.EventFixtures.tag;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;

import org.junit.jupiter.api.Test;

class FilterMatcherTest {
    private final EventData note = event(hex(1), ALICE, 1, 100, tag("e", hex(7).toUpperCase()), tag("t", "java"));

    @Test
    void emptyFilterMatchesEverything() {
        assertTrue(FilterMatcher.matches(ReqFilter.builder().build(), note));
    }

    @Test
    void matchesEveryPresentCondition() {
        final ReqFilter filter = ReqFilter.builder()
            .authors(ALICE)
            .kinds(1)
            .since(100)
            .until(100)
            .tag("t", "java")
            .build();

        assertTrue(FilterMatcher.matches(filter, note));
    }

    @Test
    void failsOnAnyMismatch() {
        assertFalse(FilterMatcher.matches(ReqFilter.builder().authors(BOB).build(), note));
        assertFalse(FilterMatcher.matches(ReqFilter.builder().kinds(2).build(), note));
        assertFalse(FilterMatcher.matches(ReqFilter.builder().since(101).build(), note));
        assertFalse(FilterMatcher.matches(ReqFilter.builder().until(99).build(), note));
        assertFalse(FilterMatcher.matches(ReqFilter.builder().tag("t", "Java").build(), note));
        assertFalse(FilterMatcher.matches(ReqFilter.builder().tag("p", ALICE).build(), note));
    }

    @Test
    void hexTagsCompareCaseInsensitively() {
        assertTrue(FilterMatcher.matches(ReqFilter.builder().tag("e", hex(7)).build(), note));
    }

    @Test
    void emptySetMatchesNothing() {
        assertFalse(FilterMatcher.matches(ReqFilter.builder().ids().build(), note));
    }

    @Test
    void anyFilterSuffices() {
        final ReqFilter miss = ReqFilter.builder().kinds(7).build();
        final ReqFilter hit = ReqFilter.builder().ids(hex(1)).build();

        assertTrue(FilterMatcher.matchesAny(Arrays.asList(miss, hit), note));
        assertFalse(FilterMatcher.matchesAny(Arrays.asList(miss), note));
    }

}

package com.yescount.planner.domain.heuristics;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PriceHeuristicsTest {

    @Test
    void shouldTreatFreeAsZero() {
        assertThat(PriceHeuristics.parse("Free")).isEqualTo(PriceRange.FREE);
        assertThat(PriceHeuristics.parse("FREE with RSVP, $10 at the door")).isEqualTo(PriceRange.FREE);
    }

    @Test
    void shouldReadRangeAsMinAndMax() {
        PriceRange range = PriceHeuristics.parse("$10-$25");

        assertThat(range.min()).isEqualByComparingTo("10");
        assertThat(range.max()).isEqualByComparingTo("25");
    }

    @Test
    void shouldReadSinglePriceAsBothBounds() {
        PriceRange range = PriceHeuristics.parse("$15");

        assertThat(range.min()).isEqualByComparingTo("15");
        assertThat(range.max()).isEqualByComparingTo("15");
    }

    @Test
    void shouldKeepDecimals() {
        PriceRange range = PriceHeuristics.parse("Tickets $12.50 to $40");

        assertThat(range.min()).isEqualByComparingTo("12.50");
        assertThat(range.max()).isEqualByComparingTo("40");
    }

    @Test
    void shouldBeUnknownWithoutNumbers() {
        assertThat(PriceHeuristics.parse("TBA")).isEqualTo(PriceRange.UNKNOWN);
        assertThat(PriceHeuristics.parse(null)).isEqualTo(PriceRange.UNKNOWN);
    }

    @Test
    void shouldFindPriceSnippetInsideCardText() {
        assertThat(PriceHeuristics.findPriceText("Doors 7pm on March 14. Tickets $20 - $35 online"))
                .isEqualTo("$20 - $35");
        assertThat(PriceHeuristics.findPriceText("Free entry on 3/14")).isEqualTo("free");
        assertThat(PriceHeuristics.findPriceText("Freedom Tower tours on 3/14")).isNull();
    }
}

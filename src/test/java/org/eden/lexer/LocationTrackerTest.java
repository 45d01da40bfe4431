package org.eden.lexer;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link LocationTracker}.
 */
@Tag("unit")
class LocationTrackerTest {

    @Test
    void startsAtFirstLineColumnZero() {
        assertThat(new LocationTracker().position()).isEqualTo(new SourceLocation(1, 0));
    }

    @Test
    void newlineResetsColumn() {
        LocationTracker tracker = new LocationTracker();

        tracker.advance("ab\ncd");

        assertThat(tracker.position()).isEqualTo(new SourceLocation(2, 2));
    }

    @Test
    void carriageReturnIsZeroWidth() {
        LocationTracker tracker = new LocationTracker();

        tracker.advance("a\r\r");

        assertThat(tracker.position()).isEqualTo(new SourceLocation(1, 1));
    }

    @Test
    void supplementaryCharacterCountsOnce() {
        LocationTracker tracker = new LocationTracker();

        tracker.advance("\uD83D\uDE00x");

        assertThat(tracker.position()).isEqualTo(new SourceLocation(1, 2));
    }
}

package com.seasonalesd.core.detection;

import com.seasonalesd.core.model.Window;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link WindowPlanner}.
 */
class WindowPlannerTest {

    @Test
    @DisplayName("Should use a single window when the period covers the series")
    void shouldUseSingleWindow() {
        assertThat(WindowPlanner.plan(30, 30)).containsExactly(new Window(0, 30));
    }

    @Test
    @DisplayName("Should split an exact multiple into disjoint windows")
    void shouldSplitExactMultiple() {
        assertThat(WindowPlanner.plan(60, 20))
                .containsExactly(new Window(0, 20), new Window(20, 40), new Window(40, 60));
    }

    @Test
    @DisplayName("Should back-align the last window so it overlaps its predecessor")
    void shouldBackAlignLastWindow() {
        assertThat(WindowPlanner.plan(50, 20))
                .containsExactly(new Window(0, 20), new Window(20, 40), new Window(30, 50));
    }

    @Test
    @DisplayName("Should clamp a period longer than the series")
    void shouldClampLongPeriod() {
        assertThat(WindowPlanner.plan(30, 100)).containsExactly(new Window(0, 30));
    }

    @Test
    @DisplayName("Every window has the same length")
    void shouldKeepWindowLengthConstant() {
        assertThat(WindowPlanner.plan(1_001, 144))
                .allSatisfy(w -> assertThat(w.length()).isEqualTo(144))
                .last()
                .isEqualTo(new Window(1_001 - 144, 1_001));
    }

    @Test
    @DisplayName("Should reject a non-positive period")
    void shouldRejectNonPositivePeriod() {
        assertThatThrownBy(() -> WindowPlanner.plan(30, 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("longtermPeriod");
    }
}

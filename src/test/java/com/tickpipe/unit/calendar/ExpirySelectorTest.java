package com.tickpipe.unit.calendar;

import static org.assertj.core.api.Assertions.assertThat;

import com.tickpipe.calendar.ExpirySelector;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ExpirySelector")
class ExpirySelectorTest {

    private static final LocalDate TODAY = LocalDate.of(2025, 3, 10);

    private final ExpirySelector expirySelector = new ExpirySelector();

    private final List<LocalDate> listed = List.of(
            LocalDate.of(2025, 3, 6),
            LocalDate.of(2025, 3, 13),
            LocalDate.of(2025, 3, 20),
            LocalDate.of(2025, 3, 27),
            LocalDate.of(2025, 4, 3),
            LocalDate.of(2025, 4, 24),
            LocalDate.of(2025, 5, 29));

    @Test
    @DisplayName("keeps the two nearest weeklies and the current and next monthly")
    void weeklyAndMonthly() {
        assertThat(expirySelector.select(listed, TODAY, 2, 2))
                .containsExactly(
                        LocalDate.of(2025, 3, 13),
                        LocalDate.of(2025, 3, 20),
                        LocalDate.of(2025, 3, 27),
                        LocalDate.of(2025, 4, 24));
    }

    @Test
    @DisplayName("never selects an expiry before today")
    void skipsExpired() {
        assertThat(expirySelector.select(listed, TODAY, 10, 0)).doesNotContain(LocalDate.of(2025, 3, 6));
    }

    @Test
    @DisplayName("collapses a weekly that is also the monthly")
    void overlapCountedOnce() {
        LocalDate lastWeek = LocalDate.of(2025, 3, 24);
        assertThat(expirySelector.select(listed, lastWeek, 1, 1)).containsExactly(LocalDate.of(2025, 3, 27));
    }

    @Test
    @DisplayName("treats today's expiry as upcoming")
    void todayIsUpcoming() {
        assertThat(expirySelector.select(listed, LocalDate.of(2025, 3, 13), 1, 0))
                .containsExactly(LocalDate.of(2025, 3, 13));
    }

    @Test
    @DisplayName("returns nothing when nothing is listed")
    void emptyListing() {
        assertThat(expirySelector.select(List.of(), TODAY, 2, 2)).isEmpty();
    }
}

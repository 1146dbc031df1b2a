package com.tickpipe.calendar;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;
import org.springframework.stereotype.Component;

/**
 * Picks the expiries to stream from the expiries actually listed for an underlying.
 *
 * <p>Works from listed dates rather than a Thursday calendar so exchange holiday shifts and
 * changes of expiry weekday need no special handling. The selection is:
 * <ul>
 *   <li>the first {@code weeklyCount} expiries on or after {@code today} (current and next week)</li>
 *   <li>for each of {@code monthlyCount} calendar months starting with the current one, the last
 *       listed expiry in that month (the monthly contract)</li>
 * </ul>
 * Overlaps collapse, e.g. a current-week expiry that is also the monthly one is counted once.
 */
@Component
public class ExpirySelector {

    public SortedSet<LocalDate> select(Collection<LocalDate> listedExpiries, LocalDate today, int weeklyCount, int monthlyCount) {
        List<LocalDate> upcoming = listedExpiries.stream()
                .filter(Objects::nonNull)
                .filter(expiry -> !expiry.isBefore(today))
                .distinct()
                .sorted()
                .toList();

        SortedSet<LocalDate> selected = new TreeSet<>(upcoming.subList(0, Math.min(weeklyCount, upcoming.size())));

        YearMonth currentMonth = YearMonth.from(today);
        for (int i = 0; i < monthlyCount; i++) {
            YearMonth month = currentMonth.plusMonths(i);
            upcoming.stream()
                    .filter(expiry -> YearMonth.from(expiry).equals(month))
                    .reduce((first, second) -> second)
                    .ifPresent(selected::add);
        }
        return selected;
    }
}

package com.tickpipe.unit.broker;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.tickpipe.broker.InstrumentPartitioner;
import com.tickpipe.broker.UniverseFilter;
import com.tickpipe.calendar.ExpirySelector;
import com.tickpipe.domain.enums.InstrumentKind;
import com.tickpipe.domain.model.Instrument;
import com.tickpipe.domain.model.SubscriptionSet;
import com.tickpipe.exception.CapacityExceededException;
import com.tickpipe.exception.ErrorCode;
import com.tickpipe.support.TestTicks;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.stream.LongStream;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("InstrumentPartitioner")
class InstrumentPartitionerTest {

    private static final LocalDate TODAY = LocalDate.of(2025, 3, 10);
    private static final LocalDate WEEKLY = LocalDate.of(2025, 3, 13);
    private static final LocalDate MONTHLY = LocalDate.of(2025, 3, 27);
    private static final LocalDate FAR = LocalDate.of(2025, 6, 26);

    private final InstrumentPartitioner partitioner = new InstrumentPartitioner(new ExpirySelector());

    private static List<Instrument> instruments(long... tokens) {
        return LongStream.of(tokens).mapToObj(TestTicks::instrument).toList();
    }

    private static List<Long> allTokens(List<SubscriptionSet> sets) {
        return sets.stream().flatMap(s -> s.tokens().stream()).toList();
    }

    @Nested
    @DisplayName("Distribution")
    class Distribution {

        @Test
        @DisplayName("spreads instruments round-robin so set sizes differ by at most one")
        void roundRobin() {
            List<SubscriptionSet> sets = partitioner.distribute(instruments(1, 2, 3, 4, 5, 6, 7, 8, 9, 10), 3, 3000);

            assertThat(sets).extracting(SubscriptionSet::size).containsExactly(4, 3, 3);
            assertThat(sets).extracting(SubscriptionSet::getConnectionIndex).containsExactly(0, 1, 2);
            assertThat(sets.get(0).tokens()).containsExactly(1L, 4L, 7L, 10L);
            assertThat(sets.get(1).tokens()).containsExactly(2L, 5L, 8L);
        }

        @Test
        @DisplayName("covers every instrument exactly once")
        void unionIsInput() {
            List<Instrument> input = instruments(LongStream.rangeClosed(1, 250).toArray());

            List<SubscriptionSet> sets = partitioner.distribute(input, 3, 100);

            assertThat(allTokens(sets))
                    .hasSize(250)
                    .doesNotHaveDuplicates()
                    .containsExactlyInAnyOrderElementsOf(input.stream().map(Instrument::getToken).toList());
            assertThat(sets).allSatisfy(set -> assertThat(set.size()).isLessThanOrEqualTo(100));
        }

        @Test
        @DisplayName("produces the same sets whatever the input order")
        void deterministic() {
            List<Instrument> ordered = instruments(LongStream.rangeClosed(1, 40).toArray());
            List<Instrument> shuffled = new ArrayList<>(ordered);
            Collections.shuffle(shuffled, new Random(7));

            assertThat(partitioner.distribute(shuffled, 3, 3000)).isEqualTo(partitioner.distribute(ordered, 3, 3000));
        }

        @Test
        @DisplayName("omits connections that would be empty")
        void fewerInstrumentsThanConnections() {
            List<SubscriptionSet> sets = partitioner.distribute(instruments(11, 12), 3, 3000);

            assertThat(sets).hasSize(2);
            assertThat(partitioner.distribute(List.of(), 3, 3000)).isEmpty();
        }

        @Test
        @DisplayName("never uses more than three connections")
        void clampsToBrokerLimit() {
            List<SubscriptionSet> sets = partitioner.distribute(instruments(1, 2, 3, 4, 5, 6, 7, 8), 8, 3000);

            assertThat(sets).hasSize(3);
        }

        @Test
        @DisplayName("drops duplicate tokens")
        void deduplicates() {
            List<SubscriptionSet> sets = partitioner.distribute(instruments(5, 5, 6, 6, 7), 3, 3000);

            assertThat(allTokens(sets)).containsExactly(5L, 6L, 7L);
        }

        @Test
        @DisplayName("rejects a selection larger than connections times per-connection limit")
        void capacityExceeded() {
            assertThatThrownBy(() -> partitioner.distribute(instruments(1, 2, 3, 4, 5, 6, 7), 3, 2))
                    .isInstanceOf(CapacityExceededException.class)
                    .satisfies(e -> assertThat(((CapacityExceededException) e).getErrorCode())
                            .isEqualTo(ErrorCode.CAPACITY_EXCEEDED));
        }

        @Test
        @DisplayName("accepts a selection that exactly fills capacity")
        void exactlyAtCapacity() {
            List<SubscriptionSet> sets = partitioner.distribute(instruments(1, 2, 3, 4, 5, 6), 3, 2);

            assertThat(sets).extracting(SubscriptionSet::size).containsExactly(2, 2, 2);
        }
    }

    @Nested
    @DisplayName("Selection")
    class Selection {

        private final Instrument spot = Instrument.builder()
                .token(256265L)
                .tradingSymbol("NIFTY 50")
                .name("NIFTY 50")
                .underlying("NIFTY")
                .kind(InstrumentKind.SPOT)
                .exchange("NSE")
                .segment("INDICES")
                .build();

        private final List<Instrument> universe = List.of(
                spot,
                TestTicks.option(1001, "NIFTY", WEEKLY, 21500, InstrumentKind.CALL),
                TestTicks.option(1002, "NIFTY", WEEKLY, 22000, InstrumentKind.CALL),
                TestTicks.option(1003, "NIFTY", WEEKLY, 22400, InstrumentKind.PUT),
                TestTicks.option(1004, "NIFTY", WEEKLY, 22500, InstrumentKind.PUT),
                TestTicks.option(1005, "NIFTY", MONTHLY, 22000, InstrumentKind.PUT),
                TestTicks.option(1006, "NIFTY", FAR, 22000, InstrumentKind.CALL),
                TestTicks.option(2001, "BANKNIFTY", WEEKLY, 48000, InstrumentKind.CALL));

        private UniverseFilter.UniverseFilterBuilder niftyOptions() {
            return UniverseFilter.builder()
                    .underlying("NIFTY")
                    .kind(InstrumentKind.CALL)
                    .kind(InstrumentKind.PUT)
                    .derivativeExchange("NFO")
                    .underlyingExchange("NSE")
                    .weeklyExpiries(1)
                    .monthlyExpiries(1);
        }

        @Test
        @DisplayName("keeps only configured underlyings and selected expiries")
        void underlyingAndExpiry() {
            List<Instrument> selected = partitioner.select(universe, niftyOptions().build(), TODAY);

            assertThat(selected).extracting(Instrument::getToken).containsExactlyInAnyOrder(1001L, 1002L, 1003L, 1004L, 1005L);
        }

        @Test
        @DisplayName("applies the strike window around spot to options")
        void strikeWindow() {
            UniverseFilter filter = niftyOptions()
                    .strikeRangePct(new BigDecimal("2"))
                    .spotPrice("NIFTY", new BigDecimal("22000"))
                    .build();

            List<Instrument> selected = partitioner.select(universe, filter, TODAY);

            assertThat(selected).extracting(Instrument::getToken).containsExactlyInAnyOrder(1002L, 1003L, 1005L);
        }

        @Test
        @DisplayName("keeps every strike when spot is unknown")
        void noSpotNoStrikeFilter() {
            UniverseFilter filter = niftyOptions().strikeRangePct(new BigDecimal("2")).build();

            assertThat(partitioner.select(universe, filter, TODAY)).hasSize(5);
        }

        @Test
        @DisplayName("adds the spot instrument when the underlying is requested")
        void includesSpot() {
            List<Instrument> selected = partitioner.select(universe, niftyOptions().includeUnderlying(true).build(), TODAY);

            assertThat(selected).extracting(Instrument::getTradingSymbol).contains("NIFTY 50");
        }

        @Test
        @DisplayName("partition selects then distributes")
        void partition() {
            List<SubscriptionSet> sets =
                    partitioner.partition(universe, niftyOptions().includeUnderlying(true).build(), 3, 3000, TODAY);

            assertThat(allTokens(sets)).hasSize(6).contains(256265L);
        }
    }
}

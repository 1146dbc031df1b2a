package com.tickpipe.integration;

import static org.assertj.core.api.Assertions.assertThat;

import com.tickpipe.domain.enums.TickMode;
import com.tickpipe.domain.model.DepthLevel;
import com.tickpipe.domain.model.FlushResult;
import com.tickpipe.domain.model.Tick;
import com.tickpipe.entity.DepthRowEntity;
import com.tickpipe.entity.TickRowEntity;
import com.tickpipe.mapper.TickRowMapperImpl;
import com.tickpipe.repository.jpa.DepthRowJpaRepository;
import com.tickpipe.repository.jpa.TickRowJpaRepository;
import com.tickpipe.store.JpaTickRowWriter;
import com.tickpipe.support.TestTicks;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

@DataJpaTest
@Import({JpaTickRowWriter.class, TickRowMapperImpl.class})
@DisplayName("JpaTickRowWriter against H2")
class TickRowWriterIntegrationTest {

    private static final LocalDate DAY = TestTicks.T0.toLocalDate();

    @Autowired
    private JpaTickRowWriter writer;

    @Autowired
    private TickRowJpaRepository tickRowJpaRepository;

    @Autowired
    private DepthRowJpaRepository depthRowJpaRepository;

    private static Tick fullTick(String price, int seconds) {
        return Tick.builder()
                .instrumentToken(12345L)
                .tradingSymbol("NIFTY25MAR22000CE")
                .mode(TickMode.FULL)
                .exchangeTimestamp(TestTicks.T0.plusSeconds(seconds))
                .receivedAt(TestTicks.T0.plusSeconds(seconds))
                .lastPrice(new BigDecimal(price))
                .volume(5000L)
                .oi(120000L)
                .buyDepth(List.of(level("120.05", 75), level("120.00", 150)))
                .sellDepth(List.of(level("120.10", 50)))
                .build();
    }

    private static DepthLevel level(String price, long quantity) {
        return DepthLevel.builder().price(new BigDecimal(price)).quantity(quantity).orders(2).build();
    }

    @Test
    @DisplayName("writes one row per tick with the trade date and linked depth rows")
    void writesRowsAndDepth() {
        FlushResult result = writer.write(List.of(fullTick("120.10", 1), fullTick("121.00", 2)));

        assertThat(result.getTickRows()).isEqualTo(2);
        assertThat(result.getDepthRows()).isEqualTo(6);

        List<TickRowEntity> rows =
                tickRowJpaRepository.findByTradingSymbolAndTradeDateOrderByExchangeTimestampAscIdAsc("NIFTY25MAR22000CE", DAY);
        assertThat(rows).extracting(r -> r.getLastPrice().toPlainString()).containsExactly("120.10", "121.00");
        assertThat(rows.get(0).getTradeDate()).isEqualTo(DAY);
        assertThat(rows.get(0).getOi()).isEqualTo(120000L);

        List<DepthRowEntity> depth = depthRowJpaRepository.findByTickIdOrderBySideAscLevelAsc(rows.get(0).getId());
        assertThat(depth).extracting(DepthRowEntity::getSide).containsExactly("BUY", "BUY", "SELL");
        assertThat(depth).extracting(DepthRowEntity::getLevel).containsExactly(0, 1, 0);
    }

    @Test
    @DisplayName("keeps duplicate ticks as separate rows")
    void keepsDuplicates() {
        Tick tick = TestTicks.tick(256265L, "NIFTY 50", "22000.50", TestTicks.T0);

        writer.write(List.of(tick, tick));

        assertThat(tickRowJpaRepository.countByTradeDate(DAY)).isEqualTo(2);
        assertThat(tickRowJpaRepository.findSymbolsByTradeDate(DAY)).containsExactly("NIFTY 50");
    }
}

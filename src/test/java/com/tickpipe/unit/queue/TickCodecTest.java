package com.tickpipe.unit.queue;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.tickpipe.domain.model.DepthLevel;
import com.tickpipe.domain.model.Tick;
import com.tickpipe.exception.DecodeException;
import com.tickpipe.queue.TickCodec;
import com.tickpipe.support.TestTicks;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("TickCodec")
class TickCodecTest {

    private final TickCodec codec = new TickCodec();

    @Test
    @DisplayName("writes timestamps as ISO local date-times")
    void isoTimestamps() {
        String json = codec.encode(TestTicks.tick("NIFTY 50", "22000", 0));

        assertThat(json).contains("\"exchangeTimestamp\":\"2025-03-10T09:15:00\"");
    }

    @Test
    @DisplayName("keeps depth levels in order")
    void depthOrder() {
        Tick tick = TestTicks.tick("NIFTY 50", "22000", 0).toBuilder()
                .buyDepth(List.of(
                        DepthLevel.builder().price(new BigDecimal("21999.5")).quantity(75).orders(1).build(),
                        DepthLevel.builder().price(new BigDecimal("21999")).quantity(150).orders(2).build()))
                .build();

        Tick decoded = codec.decode(codec.encode(tick));

        assertThat(decoded.getBuyDepth()).extracting(DepthLevel::getQuantity).containsExactly(75L, 150L);
        assertThat(decoded.hasDepth()).isTrue();
    }

    @Test
    @DisplayName("ignores fields it does not know")
    void unknownFields() {
        Tick tick = codec.decode("{\"instrumentToken\":5,\"tradingSymbol\":\"X\",\"lastPrice\":1.5,\"futureField\":true}");

        assertThat(tick.getInstrumentToken()).isEqualTo(5);
    }

    @Test
    @DisplayName("rejects blank, malformed and incomplete payloads")
    void rejects() {
        assertThatThrownBy(() -> codec.decode("")).isInstanceOf(DecodeException.class);
        assertThatThrownBy(() -> codec.decode("[1,2")).isInstanceOf(DecodeException.class);
        assertThatThrownBy(() -> codec.decode("{\"instrumentToken\":5}")).isInstanceOf(DecodeException.class);
    }

    @Test
    @DisplayName("rejects a JSON null payload")
    void rejectsJsonNull() {
        assertThatThrownBy(() -> codec.decode("null"))
                .isInstanceOf(DecodeException.class)
                .hasMessageContaining("null");
    }

    @Test
    @DisplayName("rejects a symbol longer than the tick column")
    void rejectsLongSymbol() {
        String payload = codec.encode(TestTicks.tick("X".repeat(51), "100", 0));

        assertThatThrownBy(() -> codec.decode(payload)).isInstanceOf(DecodeException.class);
        assertThat(codec.decode(codec.encode(TestTicks.tick("X".repeat(50), "100", 0))).getTradingSymbol())
                .hasSize(50);
    }

    @Test
    @DisplayName("rejects prices that do not fit the price columns")
    void rejectsOversizedPrices() {
        assertThatThrownBy(() -> codec.decode(codec.encode(TestTicks.tick("X", "10000000000000", 0))))
                .isInstanceOf(DecodeException.class)
                .hasMessageContaining("lastPrice");
        assertThatThrownBy(() -> codec.decode(codec.encode(TestTicks.tick("X", "9999999999999.999", 0))))
                .isInstanceOf(DecodeException.class);

        Tick deepBid = TestTicks.tick("X", "100", 0).toBuilder()
                .sellDepth(List.of(DepthLevel.builder().price(new BigDecimal("1E+14")).quantity(1).orders(1).build()))
                .build();
        assertThatThrownBy(() -> codec.decode(codec.encode(deepBid)))
                .isInstanceOf(DecodeException.class)
                .hasMessageContaining("sellDepth");

        assertThat(codec.decode(codec.encode(TestTicks.tick("X", "9999999999999.99", 0))).getLastPrice())
                .isEqualByComparingTo("9999999999999.99");
    }
}

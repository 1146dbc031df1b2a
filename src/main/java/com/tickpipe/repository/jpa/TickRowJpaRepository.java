package com.tickpipe.repository.jpa;

import com.tickpipe.entity.TickRowEntity;
import java.time.LocalDate;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the ticks table.
 * Supports reading a symbol's day in exchange-time order for replay and verification.
 */
@Repository
public interface TickRowJpaRepository extends JpaRepository<TickRowEntity, Long> {

    List<TickRowEntity> findByTradingSymbolAndTradeDateOrderByExchangeTimestampAscIdAsc(
            String tradingSymbol, LocalDate tradeDate);

    List<TickRowEntity> findByInstrumentTokenAndTradeDateOrderByExchangeTimestampAscIdAsc(
            Long instrumentToken, LocalDate tradeDate);

    long countByTradeDate(LocalDate tradeDate);

    @Query("SELECT DISTINCT t.tradingSymbol FROM TickRowEntity t WHERE t.tradeDate = :tradeDate ORDER BY t.tradingSymbol")
    List<String> findSymbolsByTradeDate(@Param("tradeDate") LocalDate tradeDate);
}

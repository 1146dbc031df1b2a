package com.tickpipe.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the tick_depths table: one row per order-book level of a FULL-mode tick.
 * {@code level} is 0-based from the best price.
 */
@Entity
@Table(name = "tick_depths", indexes = @Index(name = "idx_tick_depths_tick", columnList = "tick_id"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DepthRowEntity {

    public static final String SIDE_BUY = "BUY";
    public static final String SIDE_SELL = "SELL";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tick_id", nullable = false)
    private Long tickId;

    @Column(length = 4, nullable = false)
    private String side;

    @Column(nullable = false)
    private Integer level;

    @Column(precision = TickRowEntity.PRICE_PRECISION, scale = TickRowEntity.PRICE_SCALE)
    private BigDecimal price;

    private Long quantity;

    private Integer orders;
}

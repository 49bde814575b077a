package com.stock.pulse.engine.model.entity.market;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Entity
@Table(name = "prices_daily",
        uniqueConstraints = @UniqueConstraint(name = "ux_prices_daily_symbol_date",
                columnNames = {"symbol", "trade_date"}),
        indexes = {
                @Index(name = "ix_prices_daily_trade_date", columnList = "trade_date")
        })
public class PriceDailyEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "symbol", nullable = false, length = 32)
    private String symbol;

    /**
     * Trading day in exchange time
     */
    @Column(name = "trade_date", nullable = false)
    private LocalDate tradeDate;

    @Column(name = "open_price", precision = 19, scale = 4)
    private BigDecimal openPrice;

    @Column(name = "high_price", precision = 19, scale = 4)
    private BigDecimal highPrice;

    @Column(name = "low_price", precision = 19, scale = 4)
    private BigDecimal lowPrice;

    @Column(name = "close_price", nullable = false, precision = 19, scale = 4)
    private BigDecimal closePrice;

    @Column(name = "last_price", precision = 19, scale = 4)
    private BigDecimal lastPrice;

    @Column(name = "prev_close", precision = 19, scale = 4)
    private BigDecimal prevClose;

    @Column(name = "vwap", precision = 19, scale = 4)
    private BigDecimal vwap;

    @Column(name = "volume")
    private Long volume;

    @Column(name = "turnover")
    private Double turnover;

    @Column(name = "total_trades")
    private Long totalTrades;

    @Column(name = "delivery_qty")
    private Long deliveryQty;

    @Column(name = "delivery_pct")
    private Double deliveryPct;

    @Column(name = "week_52_high", precision = 19, scale = 4)
    private BigDecimal week52High;

    @Column(name = "week_52_low", precision = 19, scale = 4)
    private BigDecimal week52Low;

    @Column(name = "isin", length = 16)
    private String isin;

    @Column(name = "series_code", length = 8)
    private String seriesCode;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
}

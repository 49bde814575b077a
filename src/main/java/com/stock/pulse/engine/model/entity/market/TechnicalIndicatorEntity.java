package com.stock.pulse.engine.model.entity.market;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.time.LocalDate;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Entity
@Table(name = "technical_indicators",
        uniqueConstraints = @UniqueConstraint(name = "ux_technical_indicators_symbol_date",
                columnNames = {"symbol", "trade_date"}))
public class TechnicalIndicatorEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "symbol", nullable = false, length = 32)
    private String symbol;

    @Column(name = "trade_date", nullable = false)
    private LocalDate tradeDate;

    @Column(name = "sma_20")
    private Double sma20;

    @Column(name = "sma_50")
    private Double sma50;

    @Column(name = "sma_200")
    private Double sma200;

    @Column(name = "ema_12")
    private Double ema12;

    @Column(name = "ema_26")
    private Double ema26;

    @Column(name = "rsi_14")
    private Double rsi14;

    @Column(name = "macd")
    private Double macd;

    @Column(name = "macd_signal")
    private Double macdSignal;

    @Column(name = "bollinger_upper")
    private Double bollingerUpper;

    @Column(name = "bollinger_lower")
    private Double bollingerLower;

    @Column(name = "atr_14")
    private Double atr14;

    @Column(name = "adx_14")
    private Double adx14;

    @Column(name = "obv")
    private Double obv;

    @Column(name = "support_level")
    private Double supportLevel;

    @Column(name = "resistance_level")
    private Double resistanceLevel;

    @Column(name = "volatility_30d")
    private Double volatility30d;

    @Column(name = "avg_volume_20d")
    private Double avgVolume20d;

    /**
     * True when computed locally from stored prices rather than delivered upstream
     */
    @Column(name = "computed")
    private Boolean computed;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
}

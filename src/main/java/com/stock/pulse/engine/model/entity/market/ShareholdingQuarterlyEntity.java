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
@Table(name = "shareholding_quarterly",
        uniqueConstraints = @UniqueConstraint(name = "ux_shareholding_symbol_quarter",
                columnNames = {"symbol", "quarter_end"}))
public class ShareholdingQuarterlyEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "symbol", nullable = false, length = 32)
    private String symbol;

    @Column(name = "quarter_end", nullable = false)
    private LocalDate quarterEnd;

    @Column(name = "promoter_holding")
    private Double promoterHolding;

    @Column(name = "promoter_pledging")
    private Double promoterPledging;

    @Column(name = "fii_holding")
    private Double fiiHolding;

    @Column(name = "dii_holding")
    private Double diiHolding;

    @Column(name = "mf_holding")
    private Double mfHolding;

    @Column(name = "insurance_holding")
    private Double insuranceHolding;

    @Column(name = "public_holding")
    private Double publicHolding;

    @Column(name = "promoter_holding_change")
    private Double promoterHoldingChange;

    @Column(name = "fii_holding_change")
    private Double fiiHoldingChange;

    @Column(name = "num_shareholders")
    private Long numShareholders;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
}

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
@Table(name = "fundamentals_quarterly",
        uniqueConstraints = @UniqueConstraint(name = "ux_fundamentals_symbol_period",
                columnNames = {"symbol", "period_end", "period_type"}))
public class FundamentalsQuarterlyEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "symbol", nullable = false, length = 32)
    private String symbol;

    @Column(name = "period_end", nullable = false)
    private LocalDate periodEnd;

    /**
     * QUARTERLY or ANNUAL
     */
    @Column(name = "period_type", nullable = false, length = 16)
    private String periodType;

    @Column(name = "revenue")
    private Double revenue;

    @Column(name = "revenue_growth_yoy")
    private Double revenueGrowthYoy;

    @Column(name = "operating_profit")
    private Double operatingProfit;

    @Column(name = "operating_margin")
    private Double operatingMargin;

    @Column(name = "net_profit")
    private Double netProfit;

    @Column(name = "net_profit_margin")
    private Double netProfitMargin;

    @Column(name = "profit_growth_yoy")
    private Double profitGrowthYoy;

    @Column(name = "eps")
    private Double eps;

    @Column(name = "ebitda")
    private Double ebitda;

    @Column(name = "total_assets")
    private Double totalAssets;

    @Column(name = "total_equity")
    private Double totalEquity;

    @Column(name = "total_debt")
    private Double totalDebt;

    @Column(name = "cash_and_equiv")
    private Double cashAndEquiv;

    @Column(name = "operating_cash_flow")
    private Double operatingCashFlow;

    @Column(name = "free_cash_flow")
    private Double freeCashFlow;

    @Column(name = "roe")
    private Double roe;

    @Column(name = "roce")
    private Double roce;

    @Column(name = "debt_to_equity")
    private Double debtToEquity;

    @Column(name = "interest_coverage")
    private Double interestCoverage;

    @Column(name = "current_ratio")
    private Double currentRatio;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
}

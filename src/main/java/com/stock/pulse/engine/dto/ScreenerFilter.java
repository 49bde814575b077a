package com.stock.pulse.engine.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One screener condition, e.g. {@code rsi_14 lt 30} or {@code roe between 15 40}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ScreenerFilter {

    @NotBlank
    private String metric;

    // gt, gte, lt, lte, eq, between
    @NotBlank
    private String operator;

    @NotNull
    private Double value;

    // upper bound for between
    private Double value2;

    public ScreenerFilter(String metric, String operator, Double value) {
        this(metric, operator, value, null);
    }
}

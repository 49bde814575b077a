package com.stock.pulse.engine.enums;

public enum FieldCategory {
    MASTER,
    PRICE_VOLUME,
    DERIVED,
    INCOME_STATEMENT,
    BALANCE_SHEET,
    CASH_FLOW,
    RATIOS,
    VALUATION,
    SHAREHOLDING,
    CORPORATE_ACTIONS,
    NEWS_SENTIMENT,
    TECHNICAL,
    QUALITATIVE
}

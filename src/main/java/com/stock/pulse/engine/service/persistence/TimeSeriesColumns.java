package com.stock.pulse.engine.service.persistence;

import com.stock.pulse.engine.model.entity.market.FundamentalsQuarterlyEntity;
import com.stock.pulse.engine.model.entity.market.PriceDailyEntity;
import com.stock.pulse.engine.model.entity.market.ShareholdingQuarterlyEntity;
import com.stock.pulse.engine.model.entity.market.TechnicalIndicatorEntity;

import java.util.List;

import static com.stock.pulse.engine.model.canonical.CanonicalField.*;
import static com.stock.pulse.engine.service.persistence.ColumnBinding.decimal;
import static com.stock.pulse.engine.service.persistence.ColumnBinding.dbl;
import static com.stock.pulse.engine.service.persistence.ColumnBinding.whole;

/**
 * Canonical field to column mapping for the four time-series tables.
 * Close price is bound separately since it falls back to the last traded price.
 */
final class TimeSeriesColumns {

    private TimeSeriesColumns() {
    }

    static final List<ColumnBinding<PriceDailyEntity>> PRICE = List.of(
            decimal(OPEN_PRICE, PriceDailyEntity::getOpenPrice, PriceDailyEntity::setOpenPrice),
            decimal(HIGH_PRICE, PriceDailyEntity::getHighPrice, PriceDailyEntity::setHighPrice),
            decimal(LOW_PRICE, PriceDailyEntity::getLowPrice, PriceDailyEntity::setLowPrice),
            decimal(LAST_PRICE, PriceDailyEntity::getLastPrice, PriceDailyEntity::setLastPrice),
            decimal(PREV_CLOSE, PriceDailyEntity::getPrevClose, PriceDailyEntity::setPrevClose),
            decimal(VWAP, PriceDailyEntity::getVwap, PriceDailyEntity::setVwap),
            decimal(WEEK_52_HIGH, PriceDailyEntity::getWeek52High, PriceDailyEntity::setWeek52High),
            decimal(WEEK_52_LOW, PriceDailyEntity::getWeek52Low, PriceDailyEntity::setWeek52Low),
            whole(VOLUME, PriceDailyEntity::getVolume, PriceDailyEntity::setVolume),
            dbl(TURNOVER, PriceDailyEntity::getTurnover, PriceDailyEntity::setTurnover),
            whole(TOTAL_TRADES, PriceDailyEntity::getTotalTrades, PriceDailyEntity::setTotalTrades),
            whole(DELIVERY_QTY, PriceDailyEntity::getDeliveryQty, PriceDailyEntity::setDeliveryQty),
            dbl(DELIVERY_PCT, PriceDailyEntity::getDeliveryPct, PriceDailyEntity::setDeliveryPct)
    );

    static final List<ColumnBinding<TechnicalIndicatorEntity>> TECHNICAL = List.of(
            dbl(SMA_20, TechnicalIndicatorEntity::getSma20, TechnicalIndicatorEntity::setSma20),
            dbl(SMA_50, TechnicalIndicatorEntity::getSma50, TechnicalIndicatorEntity::setSma50),
            dbl(SMA_200, TechnicalIndicatorEntity::getSma200, TechnicalIndicatorEntity::setSma200),
            dbl(EMA_12, TechnicalIndicatorEntity::getEma12, TechnicalIndicatorEntity::setEma12),
            dbl(EMA_26, TechnicalIndicatorEntity::getEma26, TechnicalIndicatorEntity::setEma26),
            dbl(RSI_14, TechnicalIndicatorEntity::getRsi14, TechnicalIndicatorEntity::setRsi14),
            dbl(MACD, TechnicalIndicatorEntity::getMacd, TechnicalIndicatorEntity::setMacd),
            dbl(MACD_SIGNAL, TechnicalIndicatorEntity::getMacdSignal, TechnicalIndicatorEntity::setMacdSignal),
            dbl(BOLLINGER_UPPER, TechnicalIndicatorEntity::getBollingerUpper, TechnicalIndicatorEntity::setBollingerUpper),
            dbl(BOLLINGER_LOWER, TechnicalIndicatorEntity::getBollingerLower, TechnicalIndicatorEntity::setBollingerLower),
            dbl(ATR_14, TechnicalIndicatorEntity::getAtr14, TechnicalIndicatorEntity::setAtr14),
            dbl(ADX_14, TechnicalIndicatorEntity::getAdx14, TechnicalIndicatorEntity::setAdx14),
            dbl(OBV, TechnicalIndicatorEntity::getObv, TechnicalIndicatorEntity::setObv),
            dbl(SUPPORT_LEVEL, TechnicalIndicatorEntity::getSupportLevel, TechnicalIndicatorEntity::setSupportLevel),
            dbl(RESISTANCE_LEVEL, TechnicalIndicatorEntity::getResistanceLevel, TechnicalIndicatorEntity::setResistanceLevel),
            dbl(VOLATILITY_30D, TechnicalIndicatorEntity::getVolatility30d, TechnicalIndicatorEntity::setVolatility30d),
            dbl(AVG_VOLUME_20D, TechnicalIndicatorEntity::getAvgVolume20d, TechnicalIndicatorEntity::setAvgVolume20d)
    );

    static final List<ColumnBinding<FundamentalsQuarterlyEntity>> FUNDAMENTALS = List.of(
            dbl(REVENUE, FundamentalsQuarterlyEntity::getRevenue, FundamentalsQuarterlyEntity::setRevenue),
            dbl(REVENUE_GROWTH_YOY, FundamentalsQuarterlyEntity::getRevenueGrowthYoy, FundamentalsQuarterlyEntity::setRevenueGrowthYoy),
            dbl(OPERATING_PROFIT, FundamentalsQuarterlyEntity::getOperatingProfit, FundamentalsQuarterlyEntity::setOperatingProfit),
            dbl(OPERATING_MARGIN, FundamentalsQuarterlyEntity::getOperatingMargin, FundamentalsQuarterlyEntity::setOperatingMargin),
            dbl(NET_PROFIT, FundamentalsQuarterlyEntity::getNetProfit, FundamentalsQuarterlyEntity::setNetProfit),
            dbl(NET_PROFIT_MARGIN, FundamentalsQuarterlyEntity::getNetProfitMargin, FundamentalsQuarterlyEntity::setNetProfitMargin),
            dbl(PROFIT_GROWTH_YOY, FundamentalsQuarterlyEntity::getProfitGrowthYoy, FundamentalsQuarterlyEntity::setProfitGrowthYoy),
            dbl(EPS, FundamentalsQuarterlyEntity::getEps, FundamentalsQuarterlyEntity::setEps),
            dbl(EBITDA, FundamentalsQuarterlyEntity::getEbitda, FundamentalsQuarterlyEntity::setEbitda),
            dbl(TOTAL_ASSETS, FundamentalsQuarterlyEntity::getTotalAssets, FundamentalsQuarterlyEntity::setTotalAssets),
            dbl(TOTAL_EQUITY, FundamentalsQuarterlyEntity::getTotalEquity, FundamentalsQuarterlyEntity::setTotalEquity),
            dbl(TOTAL_DEBT, FundamentalsQuarterlyEntity::getTotalDebt, FundamentalsQuarterlyEntity::setTotalDebt),
            dbl(CASH_AND_EQUIV, FundamentalsQuarterlyEntity::getCashAndEquiv, FundamentalsQuarterlyEntity::setCashAndEquiv),
            dbl(OPERATING_CASH_FLOW, FundamentalsQuarterlyEntity::getOperatingCashFlow, FundamentalsQuarterlyEntity::setOperatingCashFlow),
            dbl(FREE_CASH_FLOW, FundamentalsQuarterlyEntity::getFreeCashFlow, FundamentalsQuarterlyEntity::setFreeCashFlow),
            dbl(ROE, FundamentalsQuarterlyEntity::getRoe, FundamentalsQuarterlyEntity::setRoe),
            dbl(ROCE, FundamentalsQuarterlyEntity::getRoce, FundamentalsQuarterlyEntity::setRoce),
            dbl(DEBT_TO_EQUITY, FundamentalsQuarterlyEntity::getDebtToEquity, FundamentalsQuarterlyEntity::setDebtToEquity),
            dbl(INTEREST_COVERAGE, FundamentalsQuarterlyEntity::getInterestCoverage, FundamentalsQuarterlyEntity::setInterestCoverage),
            dbl(CURRENT_RATIO, FundamentalsQuarterlyEntity::getCurrentRatio, FundamentalsQuarterlyEntity::setCurrentRatio)
    );

    static final List<ColumnBinding<ShareholdingQuarterlyEntity>> SHAREHOLDING = List.of(
            dbl(PROMOTER_HOLDING, ShareholdingQuarterlyEntity::getPromoterHolding, ShareholdingQuarterlyEntity::setPromoterHolding),
            dbl(PROMOTER_PLEDGING, ShareholdingQuarterlyEntity::getPromoterPledging, ShareholdingQuarterlyEntity::setPromoterPledging),
            dbl(FII_HOLDING, ShareholdingQuarterlyEntity::getFiiHolding, ShareholdingQuarterlyEntity::setFiiHolding),
            dbl(DII_HOLDING, ShareholdingQuarterlyEntity::getDiiHolding, ShareholdingQuarterlyEntity::setDiiHolding),
            dbl(MF_HOLDING, ShareholdingQuarterlyEntity::getMfHolding, ShareholdingQuarterlyEntity::setMfHolding),
            dbl(INSURANCE_HOLDING, ShareholdingQuarterlyEntity::getInsuranceHolding, ShareholdingQuarterlyEntity::setInsuranceHolding),
            dbl(PUBLIC_HOLDING, ShareholdingQuarterlyEntity::getPublicHolding, ShareholdingQuarterlyEntity::setPublicHolding),
            dbl(PROMOTER_HOLDING_CHANGE, ShareholdingQuarterlyEntity::getPromoterHoldingChange, ShareholdingQuarterlyEntity::setPromoterHoldingChange),
            dbl(FII_HOLDING_CHANGE, ShareholdingQuarterlyEntity::getFiiHoldingChange, ShareholdingQuarterlyEntity::setFiiHoldingChange),
            whole(NUM_SHAREHOLDERS, ShareholdingQuarterlyEntity::getNumShareholders, ShareholdingQuarterlyEntity::setNumShareholders)
    );
}

package com.stock.pulse.engine.common.constants;

import java.util.List;

/**
 * Seed symbol universe: NIFTY 50, NIFTY Next 50 and a set of liquid mid/small caps.
 */
public final class DefaultUniverse {

    public static final String NIFTY_50 = "nifty_50";
    public static final String NIFTY_NEXT_50 = "nifty_next_50";
    public static final String MID_SMALL_CAPS = "mid_small_caps";

    public static final List<String> NIFTY_50_SYMBOLS = List.of(
            "RELIANCE", "TCS", "HDFCBANK", "INFY", "ICICIBANK",
            "HINDUNILVR", "SBIN", "BHARTIARTL", "KOTAKBANK", "ITC",
            "LT", "AXISBANK", "BAJFINANCE", "ASIANPAINT", "MARUTI",
            "HCLTECH", "WIPRO", "ULTRACEMCO", "TITAN", "NESTLEIND",
            "SUNPHARMA", "BAJAJFINSV", "ONGC", "NTPC", "POWERGRID",
            "M&M", "TATASTEEL", "ADANIENT", "TECHM", "JSWSTEEL",
            "TATAMOTORS", "INDUSINDBK", "COALINDIA", "HINDALCO", "GRASIM",
            "ADANIPORTS", "DRREDDY", "APOLLOHOSP", "CIPLA", "EICHERMOT",
            "BPCL", "DIVISLAB", "BRITANNIA", "HEROMOTOCO", "SBILIFE",
            "HDFCLIFE", "TATACONSUM", "BAJAJ-AUTO", "SHRIRAMFIN", "LTIM");

    public static final List<String> NIFTY_NEXT_50_SYMBOLS = List.of(
            "ADANIGREEN", "AMBUJACEM", "BANKBARODA", "BEL", "BERGEPAINT",
            "BOSCHLTD", "CANBK", "CHOLAFIN", "COLPAL", "DLF",
            "DMART", "GAIL", "GODREJCP", "HAVELLS", "ICICIGI",
            "ICICIPRULI", "IDEA", "INDHOTEL", "INDIGO", "IOC",
            "IRCTC", "JINDALSTEL", "JUBLFOOD", "LTF", "LUPIN",
            "MARICO", "MCDOWELL-N", "MOTHERSON", "MUTHOOTFIN", "NAUKRI",
            "NHPC", "OFSS", "PAGEIND", "PAYTM", "PFC",
            "PIDILITIND", "PNB", "POLYCAB", "RECLTD", "SAIL",
            "SBICARD", "SRF", "TATAELXSI", "TATAPOWER", "TORNTPHARM",
            "TRENT", "UPL", "VEDL", "VBL", "ZOMATO");

    public static final List<String> MID_SMALL_CAP_SYMBOLS = List.of(
            "AUROPHARMA", "BANDHANBNK", "CANFINHOME", "CROMPTON", "CUMMINSIND",
            "DEEPAKNTR", "ESCORTS", "EXIDEIND", "FEDERALBNK", "GLENMARK",
            "GMRINFRA", "HINDPETRO", "IBULHSGFIN", "IDFCFIRSTB", "IEX",
            "IRFC", "KALYANKJIL", "LALPATHLAB", "LICHSGFIN", "MANAPPURAM",
            "MRF", "NAM-INDIA", "NATIONALUM", "NMDC", "OBEROIRLTY",
            "PERSISTENT", "PETRONET", "PIIND", "PVRINOX", "RAMCOCEM",
            "RBLBANK", "SUNTV", "TATACOMM", "TATACHEM", "THERMAX",
            "TORNTPOWER", "TVSMOTOR", "UNIONBANK", "UBL", "VOLTAS",
            "WHIRLPOOL", "ZEEL", "ZYDUSLIFE");

    private DefaultUniverse() {
    }
}

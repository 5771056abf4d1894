package com.dataplatform.common.model;

/**
 * Semantic kind of data a caller asks for. TTLs, reconciliation strategies and
 * tolerance bands are configured per data type, never derived from it.
 */
public enum DataType {
    QUOTE(DataCategory.MARKET, true),
    INTRADAY(DataCategory.MARKET, true),
    DAILY_SERIES(DataCategory.MARKET, true),
    OPTIONS(DataCategory.MARKET, true),
    FUNDAMENTALS(DataCategory.FUNDAMENTAL, true),
    NEWS(DataCategory.SENTIMENT, false),
    ECONOMIC_SERIES(DataCategory.MACRO, false),
    FILINGS(DataCategory.REGULATORY, true),
    INSIDER_TRADING(DataCategory.REGULATORY, true),
    SECTOR_SCREEN(DataCategory.FUNDAMENTAL, false),
    REFERENCE(DataCategory.REFERENCE, false);

    private final DataCategory category;
    private final boolean entityLevel;

    DataType(DataCategory category, boolean entityLevel) {
        this.category    = category;
        this.entityLevel = entityLevel;
    }

    public DataCategory category() {
        return category;
    }

    /** True when a meaningful request names at least one entity (symbol, CIK). */
    public boolean isEntityLevel() {
        return entityLevel;
    }
}

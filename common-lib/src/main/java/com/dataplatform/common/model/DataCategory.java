package com.dataplatform.common.model;

/**
 * Broad family a {@link DataType} belongs to. Category-restricted providers never
 * serve a data type outside their category.
 */
public enum DataCategory {
    MARKET,
    FUNDAMENTAL,
    MACRO,
    SENTIMENT,
    REGULATORY,
    REFERENCE
}

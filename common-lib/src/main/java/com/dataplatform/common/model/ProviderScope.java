package com.dataplatform.common.model;

/**
 * What shape of request a provider is built for.
 */
public enum ProviderScope {
    /** Deep analysis of a bounded list of named entities. */
    INDIVIDUAL_ENTITY,
    /** Sector-wide or market-wide screens without an explicit small entity list. */
    BULK,
    /** Economy-level series not tied to any company. */
    MACRO
}

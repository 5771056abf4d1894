package com.dataplatform.common.model;

/**
 * Cost tier of a provider. Government sources are free and preferred when competent;
 * commercial sources are paid and budget-gated.
 */
public enum ProviderCategory {
    GOVERNMENT,
    COMMERCIAL
}

package com.dataplatform.common.model;

public enum AnalysisType {
    FUNDAMENTAL,
    TECHNICAL,
    ECONOMIC,
    SENTIMENT,
    INSTITUTIONAL,
    GENERAL
}

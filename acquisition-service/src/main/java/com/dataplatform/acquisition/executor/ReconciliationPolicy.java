package com.dataplatform.acquisition.executor;

import com.dataplatform.acquisition.config.AcquisitionProperties;
import com.dataplatform.common.conflict.ResolutionStrategy;
import com.dataplatform.common.model.DataType;

/**
 * Conflict strategy and tolerance band per data type, from
 * {@code acquisition.reconciliation.rules}, falling back to the configured defaults.
 */
public class ReconciliationPolicy {

    public record Rule(ResolutionStrategy strategy, double tolerancePercent) {}

    private final AcquisitionProperties.Reconciliation settings;

    public ReconciliationPolicy(AcquisitionProperties.Reconciliation settings) {
        this.settings = settings;
    }

    public Rule ruleFor(DataType dataType) {
        AcquisitionProperties.Rule configured = settings.getRules().get(dataType);
        ResolutionStrategy strategy = configured != null && configured.getStrategy() != null
            ? configured.getStrategy() : settings.getDefaultStrategy();
        double tolerance = configured != null && configured.getTolerancePercent() != null
            ? configured.getTolerancePercent() : settings.getDefaultTolerancePercent();
        return new Rule(strategy, tolerance);
    }
}

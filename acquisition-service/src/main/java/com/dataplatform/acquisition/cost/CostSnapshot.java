package com.dataplatform.acquisition.cost;

import java.time.YearMonth;

public record CostSnapshot(
    YearMonth month,
    long      requests,
    double    spend,
    double    monthlyBudget,
    boolean   withinBudget
) {}

package com.dataplatform.acquisition.controller;

import com.dataplatform.common.model.AnalysisType;
import com.dataplatform.common.model.DataRequest;
import com.dataplatform.common.model.DataType;
import com.dataplatform.common.model.DateRange;
import com.dataplatform.common.model.FilterCriteria;
import com.dataplatform.common.model.Granularity;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.time.Duration;
import java.time.LocalDate;
import java.util.List;

/**
 * Body of the fetch, validate and route endpoints.
 */
public record AcquisitionRequest(
    List<String>          entityKeys,
    @NotNull DataType     dataType,
    @Valid Filter         filter,
    @Positive Long        maxStalenessSeconds,
    @Positive Long        deadlineMillis,
    String                traceId
) {

    public record Filter(
        String       sector,
        LocalDate    from,
        LocalDate    to,
        Granularity  granularity,
        AnalysisType analysisType,
        Boolean      realTime
    ) {}

    public DataRequest toDataRequest(String headerTraceId) {
        FilterCriteria criteria = FilterCriteria.empty();
        if (filter != null) {
            criteria = criteria.withSector(filter.sector());
            if (filter.from() != null || filter.to() != null) {
                criteria = criteria.withDateRange(new DateRange(filter.from(), filter.to()));
            }
            if (filter.granularity() != null)  criteria = criteria.withGranularity(filter.granularity());
            if (filter.analysisType() != null) criteria = criteria.withAnalysisType(filter.analysisType());
            if (filter.realTime() != null)     criteria = criteria.withRealTime(filter.realTime());
        }
        String trace = traceId != null ? traceId : headerTraceId;
        return new DataRequest(entityKeys, criteria, dataType,
                               maxStalenessSeconds == null ? null : Duration.ofSeconds(maxStalenessSeconds),
                               deadlineMillis == null ? null : Duration.ofMillis(deadlineMillis),
                               trace);
    }
}

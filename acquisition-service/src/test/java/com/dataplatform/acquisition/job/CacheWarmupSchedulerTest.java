package com.dataplatform.acquisition.job;

import com.dataplatform.acquisition.config.AcquisitionProperties;
import com.dataplatform.acquisition.executor.AcquisitionResult;
import com.dataplatform.acquisition.executor.FailoverExecutor;
import com.dataplatform.common.exception.AcquisitionException;
import com.dataplatform.common.model.CacheState;
import com.dataplatform.common.model.DataRequest;
import com.dataplatform.common.model.DataType;
import com.fasterxml.jackson.databind.node.DoubleNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CacheWarmupSchedulerTest {

    private static AcquisitionProperties.WarmupRequest warm(DataType type, String sector, String... keys) {
        AcquisitionProperties.WarmupRequest w = new AcquisitionProperties.WarmupRequest();
        w.setDataType(type);
        w.setSector(sector);
        w.setEntityKeys(List.of(keys));
        return w;
    }

    private static AcquisitionResult result() {
        return new AcquisitionResult(DoubleNode.valueOf(1.0), new AcquisitionResult.Metadata(
            "p", CacheState.REFRESHED, 0.9, false, List.of(), "t", Instant.EPOCH));
    }

    @Test
    @DisplayName("a cycle counts the requests that warmed and absorbs failures")
    void cycleAbsorbsFailures() {
        FailoverExecutor executor = mock(FailoverExecutor.class);
        when(executor.acquire(any())).thenAnswer(inv -> {
            DataRequest r = inv.getArgument(0);
            return r.dataType() == DataType.QUOTE
                ? Mono.just(result())
                : Mono.error(AcquisitionException.unroutable("nobody"));
        });
        AcquisitionProperties properties = new AcquisitionProperties();
        properties.getWarmup().setRequests(List.of(
            warm(DataType.QUOTE, null, "AAPL"),
            warm(DataType.SECTOR_SCREEN, "Energy"),
            warm(DataType.QUOTE, null, "MSFT")));

        Long warmed = new CacheWarmupScheduler(executor, properties).runCycle().block();

        assertEquals(2L, warmed);
    }

    @Test
    @DisplayName("disabled warm-up never touches the executor")
    void disabled() {
        FailoverExecutor executor = mock(FailoverExecutor.class);
        AcquisitionProperties properties = new AcquisitionProperties();
        properties.getWarmup().setRequests(List.of(warm(DataType.QUOTE, null, "AAPL")));

        CacheWarmupScheduler scheduler = new CacheWarmupScheduler(executor, properties);
        scheduler.start();
        scheduler.stop();

        verify(executor, never()).acquire(any());
    }

    @Test
    void toDataRequest() {
        DataRequest r = CacheWarmupScheduler.toDataRequest(warm(DataType.SECTOR_SCREEN, "Energy"));
        assertTrue(r.entityKeys().isEmpty());
        assertEquals("Energy", r.filterCriteria().sector());
    }
}

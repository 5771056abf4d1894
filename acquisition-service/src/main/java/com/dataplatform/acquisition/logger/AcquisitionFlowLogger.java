package com.dataplatform.acquisition.logger;

import com.dataplatform.acquisition.executor.AcquisitionState;
import com.dataplatform.common.trace.TraceContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Observability component for the acquisition state machine. Pure side effects; never alters
 * the pipeline. The trace id travels on the {@code DataRequest}, so callers pass it explicitly.
 */
@Component
public class AcquisitionFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(AcquisitionFlowLogger.class);

    /** Logs a transition; the trace id is bridged into MDC only for the log call. */
    public void transition(AcquisitionState state, String traceId, String key, String detail) {
        TraceContext.withMdc(traceId, () -> {
            if (state == AcquisitionState.FAILED || state == AcquisitionState.DEGRADED) {
                log.warn("[AcquisitionFlow] state={} traceId={} key={} {}", state, traceId, key, detail);
            } else {
                log.info("[AcquisitionFlow] state={} traceId={} key={} {}", state, traceId, key, detail);
            }
        });
    }
}

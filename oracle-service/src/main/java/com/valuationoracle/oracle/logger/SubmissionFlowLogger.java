package com.valuationoracle.oracle.logger;

import com.valuationoracle.common.consensus.SubmissionReceipt;
import com.valuationoracle.common.model.Valuation;
import com.valuationoracle.common.result.OracleResult;
import com.valuationoracle.oracle.dto.SubmissionRequest;
import com.valuationoracle.oracle.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Logs each stage of a price submission. Side effects only, no business logic.
 *
 * <p>Stages:
 * <ol>
 *   <li>{@link #RECEIVED}: request accepted by the controller</li>
 *   <li>{@link #REJECTED}: failed validation, nothing recorded</li>
 *   <li>{@link #RECORDED}: stored in the ledger and counted against the oracle's quota</li>
 *   <li>{@link #PUBLISHED}: after RECORDED, a new valuation committed</li>
 *   <li>{@link #DEFERRED}: after RECORDED, quorum not met; previous valuation kept</li>
 * </ol>
 *
 * <p>Usage with {@code doOnEach} (traceId read from the Reactor Context):
 * <pre>
 *     .doOnEach(flowLogger.outcome(request))
 * </pre>
 */
@Component
public class SubmissionFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(SubmissionFlowLogger.class);

    public static final String RECEIVED  = "RECEIVED";
    public static final String REJECTED  = "REJECTED";
    public static final String RECORDED  = "RECORDED";
    public static final String PUBLISHED = "PUBLISHED";
    public static final String DEFERRED  = "DEFERRED";

    public void received(SubmissionRequest request, String caller, String traceId) {
        TraceContextUtil.withMdc(traceId, () ->
            log.info("[SubmissionFlow] stage={} subjectId={} oracleId={} caller={} price={} traceId={}",
                     RECEIVED, request.subjectId(), request.oracleId(), caller, request.price(), traceId)
        );
    }

    /**
     * Returns a {@code doOnEach} consumer that logs the terminal stages of a submission.
     * Only fires on {@code onNext}; errors are logged by the service itself.
     *
     * <p>The published valuation is taken from the receipt, never re-read from the store,
     * so a concurrent submission for the same subject cannot leak into this line.
     */
    public Consumer<Signal<OracleResult<SubmissionReceipt>>> outcome(SubmissionRequest request) {
        return signal -> {
            if (!signal.isOnNext()) return;
            OracleResult<SubmissionReceipt> result = signal.get();
            String traceId = TraceContextUtil.getTraceId(signal.getContextView());
            TraceContextUtil.withMdc(traceId, () -> logOutcome(request, result, traceId));
        };
    }

    private void logOutcome(SubmissionRequest request, OracleResult<SubmissionReceipt> result, String traceId) {
        if (!result.ok() && !result.error().isConsensusFailure()) {
            log.warn("[SubmissionFlow] stage={} subjectId={} oracleId={} reason={} code={} traceId={}",
                     REJECTED, request.subjectId(), request.oracleId(),
                     result.error(), result.errorCode(), traceId);
            return;
        }

        log.info("[SubmissionFlow] stage={} subjectId={} oracleId={} price={} traceId={}",
                 RECORDED, request.subjectId(), request.oracleId(), request.price(), traceId);

        if (result.ok()) {
            Valuation valuation = result.value().valuation();
            log.info("[SubmissionFlow] stage={} subjectId={} oracleId={} value={} sources={} traceId={}",
                     PUBLISHED, request.subjectId(), request.oracleId(),
                     valuation.value(), valuation.sourceCount(), traceId);
        } else {
            log.info("[SubmissionFlow] stage={} subjectId={} oracleId={} reason={} code={} traceId={}",
                     DEFERRED, request.subjectId(), request.oracleId(),
                     result.error(), result.errorCode(), traceId);
        }
    }
}

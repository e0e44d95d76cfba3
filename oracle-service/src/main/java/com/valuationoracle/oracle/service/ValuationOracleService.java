package com.valuationoracle.oracle.service;

import com.valuationoracle.common.ValuationOracle;
import com.valuationoracle.common.consensus.SubmissionReceipt;
import com.valuationoracle.common.model.ConfigurationSnapshot;
import com.valuationoracle.common.model.Oracle;
import com.valuationoracle.common.model.OracleActivity;
import com.valuationoracle.common.model.Submission;
import com.valuationoracle.common.model.Valuation;
import com.valuationoracle.common.result.OracleResult;
import com.valuationoracle.oracle.dto.OracleWeightResponse;
import com.valuationoracle.oracle.dto.SubmissionRequest;
import com.valuationoracle.oracle.logger.SubmissionFlowLogger;
import com.valuationoracle.oracle.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.OptionalInt;
import java.util.function.Supplier;

/**
 * Reactive facade over {@link ValuationOracle}.
 *
 * <p>Writes take locks inside the engine and block on the durable write, so they run on the
 * bounded-elastic scheduler rather than on an event-loop thread. Reads are non-blocking map
 * lookups and are served inline. Domain failures arrive as {@link OracleResult} values; only unexpected
 * exceptions travel the error channel.
 */
@Service
public class ValuationOracleService {

    private static final Logger log = LoggerFactory.getLogger(ValuationOracleService.class);

    private final ValuationOracle oracle;
    private final SubmissionFlowLogger flowLogger;

    public ValuationOracleService(ValuationOracle oracle, SubmissionFlowLogger flowLogger) {
        this.oracle     = oracle;
        this.flowLogger = flowLogger;
    }

    // ── submissions ─────────────────────────────────────────────────────────

    public Mono<OracleResult<Long>> submitDataFeed(String caller, SubmissionRequest request, String traceId) {
        flowLogger.received(request, caller, traceId);
        Mono<OracleResult<Long>> pipeline = Mono.fromCallable(() ->
                oracle.submitWithReceipt(caller, request.subjectId(), request.price(), request.oracleId()))
            .subscribeOn(Schedulers.boundedElastic())
            .doOnEach(flowLogger.outcome(request))
            .map(ValuationOracleService::acceptedPrice)
            .doOnError(e -> log.error("Submission failed unexpectedly. subjectId={} oracleId={} traceId={}",
                request.subjectId(), request.oracleId(), traceId, e));
        return TraceContextUtil.withTraceId(pipeline, traceId);
    }

    private static OracleResult<Long> acceptedPrice(OracleResult<SubmissionReceipt> result) {
        return result.ok()
            ? OracleResult.success(result.value().price())
            : OracleResult.failure(result.error());
    }

    // ── administration ──────────────────────────────────────────────────────

    public Mono<OracleResult<Boolean>> addOracle(String caller, String oracleId, int weight) {
        return admin("addOracle", caller, oracleId + " weight=" + weight,
            () -> oracle.addOracle(caller, oracleId, weight));
    }

    public Mono<OracleResult<Boolean>> removeOracle(String caller, String oracleId) {
        return admin("removeOracle", caller, oracleId,
            () -> oracle.removeOracle(caller, oracleId));
    }

    public Mono<OracleResult<Boolean>> setConsensusThreshold(String caller, long threshold) {
        return admin("setConsensusThreshold", caller, String.valueOf(threshold),
            () -> oracle.setConsensusThreshold(caller, clampToInt(threshold)));
    }

    public Mono<OracleResult<Boolean>> setMaxOracles(String caller, long maxOracles) {
        return admin("setMaxOracles", caller, String.valueOf(maxOracles),
            () -> oracle.setMaxOracles(caller, clampToInt(maxOracles)));
    }

    public Mono<OracleResult<Boolean>> setMaxSubmissionsPerOracle(String caller, long maxSubmissions) {
        return admin("setMaxSubmissionsPerOracle", caller, String.valueOf(maxSubmissions),
            () -> oracle.setMaxSubmissionsPerOracle(caller, clampToInt(maxSubmissions)));
    }

    public Mono<OracleResult<Boolean>> setStalenessWindow(String caller, long window) {
        return admin("setStalenessWindow", caller, String.valueOf(window),
            () -> oracle.setStalenessWindow(caller, window));
    }

    private Mono<OracleResult<Boolean>> admin(String operation, String caller, String target,
                                              Supplier<OracleResult<Boolean>> action) {
        return Mono.fromCallable(action::get)
            .subscribeOn(Schedulers.boundedElastic())
            .doOnNext(result -> {
                if (result.ok()) {
                    log.info("Admin operation applied. op={} target={} caller={}", operation, target, caller);
                } else {
                    log.warn("Admin operation rejected. op={} target={} caller={} reason={} code={}",
                        operation, target, caller, result.error(), result.errorCode());
                }
            })
            .doOnError(e -> log.error("Admin operation failed unexpectedly. op={} target={}", operation, target, e));
    }

    /** Out-of-range values saturate so they fail the setting's own bounds check. */
    private static int clampToInt(long value) {
        return (int) Math.max(Integer.MIN_VALUE, Math.min(Integer.MAX_VALUE, value));
    }

    // ── reads ───────────────────────────────────────────────────────────────

    public Mono<Valuation> getValuation(long subjectId) {
        return Mono.defer(() -> Mono.justOrEmpty(oracle.getValuation(subjectId)));
    }

    public Mono<Boolean> isOracleApproved(String oracleId) {
        return Mono.fromSupplier(() -> oracle.isOracleApproved(oracleId));
    }

    public Mono<OracleWeightResponse> getOracleWeight(String oracleId) {
        return Mono.defer(() -> {
            OptionalInt weight = oracle.getOracleWeight(oracleId);
            return weight.isPresent()
                ? Mono.just(new OracleWeightResponse(oracleId, weight.getAsInt()))
                : Mono.empty();
        });
    }

    public Flux<Oracle> getApprovedOracles() {
        return Flux.defer(() -> Flux.fromIterable(oracle.getApprovedOracles()));
    }

    public Mono<OracleActivity> getOracleActivity(String oracleId) {
        return Mono.defer(() -> Mono.justOrEmpty(oracle.getOracleActivity(oracleId)));
    }

    public Mono<Submission> getSubmission(long subjectId, String oracleId) {
        return Mono.defer(() -> Mono.justOrEmpty(oracle.getSubmission(subjectId, oracleId)));
    }

    public Mono<ConfigurationSnapshot> getConfiguration() {
        return Mono.fromSupplier(oracle::getConfiguration);
    }
}

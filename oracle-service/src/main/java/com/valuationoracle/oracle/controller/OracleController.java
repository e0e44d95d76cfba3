package com.valuationoracle.oracle.controller;

import com.valuationoracle.common.model.ConfigurationSnapshot;
import com.valuationoracle.common.model.Oracle;
import com.valuationoracle.common.model.OracleActivity;
import com.valuationoracle.common.model.Submission;
import com.valuationoracle.common.result.OracleError;
import com.valuationoracle.common.result.OracleResult;
import com.valuationoracle.oracle.dto.AddOracleRequest;
import com.valuationoracle.oracle.dto.ErrorResponse;
import com.valuationoracle.oracle.dto.OperationResponse;
import com.valuationoracle.oracle.dto.OracleWeightResponse;
import com.valuationoracle.oracle.dto.SettingUpdateRequest;
import com.valuationoracle.oracle.dto.SubmissionRequest;
import com.valuationoracle.oracle.error.OracleErrorStatus;
import com.valuationoracle.oracle.service.ValuationOracleService;
import com.valuationoracle.oracle.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * HTTP surface of the valuation oracle.
 *
 * <p>The caller identity arrives in {@value #CALLER_HEADER}; it is verified upstream and
 * trusted here. Write endpoints answer with {@link OperationResponse} and a status derived
 * from the error code by {@link OracleErrorStatus}.
 */
@RestController
@RequestMapping("/api/v1/oracle")
public class OracleController {

    private static final Logger log = LoggerFactory.getLogger(OracleController.class);

    public static final String CALLER_HEADER = "X-Caller-Id";

    private final ValuationOracleService oracleService;

    public OracleController(ValuationOracleService oracleService) {
        this.oracleService = oracleService;
    }

    // ── reads ───────────────────────────────────────────────────────────────

    @GetMapping("/valuations/{subjectId}")
    public Mono<ResponseEntity<?>> valuation(@PathVariable long subjectId) {
        log.info("Valuation query received. subjectId={}", subjectId);
        return oracleService.getValuation(subjectId)
            .<ResponseEntity<?>>map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.status(HttpStatus.NOT_FOUND).body(
                ErrorResponse.of(OracleError.VALUATION_NOT_FOUND, "No valuation for subject " + subjectId)))
            .doOnError(e -> log.error("Valuation endpoint error. subjectId={}", subjectId, e));
    }

    @GetMapping("/oracles")
    public Flux<Oracle> oracles() {
        log.info("Approved oracles query received");
        return oracleService.getApprovedOracles();
    }

    @GetMapping("/oracles/{oracleId}/approved")
    public Mono<ResponseEntity<Boolean>> approved(@PathVariable String oracleId) {
        return oracleService.isOracleApproved(oracleId)
            .map(ResponseEntity::ok);
    }

    @GetMapping("/oracles/{oracleId}/weight")
    public Mono<ResponseEntity<OracleWeightResponse>> weight(@PathVariable String oracleId) {
        return oracleService.getOracleWeight(oracleId)
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @GetMapping("/oracles/{oracleId}/activity")
    public Mono<ResponseEntity<OracleActivity>> activity(@PathVariable String oracleId) {
        return oracleService.getOracleActivity(oracleId)
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @GetMapping("/submissions/{subjectId}/{oracleId}")
    public Mono<ResponseEntity<Submission>> submission(@PathVariable long subjectId,
                                                      @PathVariable String oracleId) {
        return oracleService.getSubmission(subjectId, oracleId)
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @GetMapping("/config")
    public Mono<ResponseEntity<ConfigurationSnapshot>> config() {
        return oracleService.getConfiguration().map(ResponseEntity::ok);
    }

    // ── writes ──────────────────────────────────────────────────────────────

    @PostMapping("/submissions")
    public Mono<ResponseEntity<OperationResponse<Long>>> submit(
            @RequestHeader(value = CALLER_HEADER, required = false) String caller,
            @RequestHeader(value = TraceContextUtil.TRACE_ID_HEADER, required = false) String traceHeader,
            @RequestBody SubmissionRequest request) {
        String traceId = TraceContextUtil.resolve(traceHeader);
        return oracleService.submitDataFeed(caller, request, traceId)
            .map(OracleController::toResponse)
            .doOnError(e -> log.error("Submission endpoint error. subjectId={} traceId={}",
                request.subjectId(), traceId, e));
    }

    @PostMapping("/oracles")
    public Mono<ResponseEntity<OperationResponse<Boolean>>> addOracle(
            @RequestHeader(value = CALLER_HEADER, required = false) String caller,
            @RequestBody AddOracleRequest request) {
        log.info("Add oracle requested. oracleId={} weight={}", request.oracleId(), request.weight());
        return oracleService.addOracle(caller, request.oracleId(), request.weight())
            .map(OracleController::toResponse);
    }

    @DeleteMapping("/oracles/{oracleId}")
    public Mono<ResponseEntity<OperationResponse<Boolean>>> removeOracle(
            @RequestHeader(value = CALLER_HEADER, required = false) String caller,
            @PathVariable String oracleId) {
        log.info("Remove oracle requested. oracleId={}", oracleId);
        return oracleService.removeOracle(caller, oracleId)
            .map(OracleController::toResponse);
    }

    @PutMapping("/config/consensus-threshold")
    public Mono<ResponseEntity<OperationResponse<Boolean>>> consensusThreshold(
            @RequestHeader(value = CALLER_HEADER, required = false) String caller,
            @RequestBody SettingUpdateRequest request) {
        return oracleService.setConsensusThreshold(caller, request.value())
            .map(OracleController::toResponse);
    }

    @PutMapping("/config/max-oracles")
    public Mono<ResponseEntity<OperationResponse<Boolean>>> maxOracles(
            @RequestHeader(value = CALLER_HEADER, required = false) String caller,
            @RequestBody SettingUpdateRequest request) {
        return oracleService.setMaxOracles(caller, request.value())
            .map(OracleController::toResponse);
    }

    @PutMapping("/config/max-submissions")
    public Mono<ResponseEntity<OperationResponse<Boolean>>> maxSubmissions(
            @RequestHeader(value = CALLER_HEADER, required = false) String caller,
            @RequestBody SettingUpdateRequest request) {
        return oracleService.setMaxSubmissionsPerOracle(caller, request.value())
            .map(OracleController::toResponse);
    }

    @PutMapping("/config/staleness-window")
    public Mono<ResponseEntity<OperationResponse<Boolean>>> stalenessWindow(
            @RequestHeader(value = CALLER_HEADER, required = false) String caller,
            @RequestBody SettingUpdateRequest request) {
        return oracleService.setStalenessWindow(caller, request.value())
            .map(OracleController::toResponse);
    }

    @GetMapping("/health")
    public Mono<ResponseEntity<String>> health() {
        return Mono.just(ResponseEntity.ok("OK"));
    }

    private static <T> ResponseEntity<OperationResponse<T>> toResponse(OracleResult<T> result) {
        return ResponseEntity.status(OracleErrorStatus.of(result)).body(OperationResponse.from(result));
    }
}

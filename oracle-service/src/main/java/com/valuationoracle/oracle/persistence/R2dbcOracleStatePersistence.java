package com.valuationoracle.oracle.persistence;

import com.valuationoracle.common.model.ConfigurationSnapshot;
import com.valuationoracle.common.model.Oracle;
import com.valuationoracle.common.model.OracleActivity;
import com.valuationoracle.common.model.Submission;
import com.valuationoracle.common.model.Valuation;
import com.valuationoracle.common.persistence.OracleStatePersistence;
import com.valuationoracle.oracle.model.OracleActivityRecord;
import com.valuationoracle.oracle.model.ValuationRecord;
import com.valuationoracle.oracle.repository.ApprovedOracleRepository;
import com.valuationoracle.oracle.repository.OracleActivityRepository;
import com.valuationoracle.oracle.repository.OracleSettingsRepository;
import com.valuationoracle.oracle.repository.SubmissionRecordRepository;
import com.valuationoracle.oracle.repository.ValuationRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.sql.init.dependency.DependsOnDatabaseInitialization;
import org.springframework.stereotype.Component;
import org.springframework.transaction.reactive.TransactionalOperator;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link OracleStatePersistence} over Spring Data R2DBC repositories.
 *
 * <p>The domain core is synchronous, so every call blocks on its repository publisher with
 * a bounded timeout. Callers must not be on an event-loop thread; the service layer runs
 * all writes on the bounded-elastic scheduler, and loads happen once at startup.
 */
@Component
@DependsOnDatabaseInitialization
public class R2dbcOracleStatePersistence implements OracleStatePersistence {

    private static final Logger log = LoggerFactory.getLogger(R2dbcOracleStatePersistence.class);

    private static final int SETTINGS_ROW = 1;

    private final ApprovedOracleRepository   oracleRepository;
    private final OracleSettingsRepository   settingsRepository;
    private final SubmissionRecordRepository submissionRepository;
    private final OracleActivityRepository   activityRepository;
    private final ValuationRecordRepository  valuationRepository;
    private final TransactionalOperator      transactionalOperator;
    private final Duration                   timeout;

    public R2dbcOracleStatePersistence(ApprovedOracleRepository oracleRepository,
                                       OracleSettingsRepository settingsRepository,
                                       SubmissionRecordRepository submissionRepository,
                                       OracleActivityRepository activityRepository,
                                       ValuationRecordRepository valuationRepository,
                                       TransactionalOperator transactionalOperator,
                                       @Value("${oracle.persistence.timeout:5s}") Duration timeout) {
        this.oracleRepository      = oracleRepository;
        this.settingsRepository    = settingsRepository;
        this.submissionRepository  = submissionRepository;
        this.activityRepository    = activityRepository;
        this.valuationRepository   = valuationRepository;
        this.transactionalOperator = transactionalOperator;
        this.timeout               = timeout;
    }

    // ── registry ────────────────────────────────────────────────────────────

    @Override
    public List<Oracle> loadOracles() {
        List<Oracle> oracles = oracleRepository.findAllInApprovalOrder()
            .map(r -> new Oracle(r.getOracleId(), r.getWeight()))
            .collectList()
            .block(timeout);
        log.info("Loaded approved oracles. count={}", oracles.size());
        return oracles;
    }

    @Override
    public void saveOracle(Oracle oracle) {
        oracleRepository.insertOracle(oracle.oracleId(), oracle.weight()).block(timeout);
    }

    @Override
    public void deleteOracle(String oracleId) {
        oracleRepository.deleteByOracleId(oracleId).block(timeout);
    }

    @Override
    public Optional<ConfigurationSnapshot> loadSettings() {
        // adminId is never stored; the registry ignores it on restore
        return settingsRepository.findById(SETTINGS_ROW)
            .map(r -> new ConfigurationSnapshot(null, r.getMaxOracles(), r.getConsensusThreshold(),
                r.getMaxSubmissionsPerOracle(), r.getStalenessWindow()))
            .blockOptional(timeout);
    }

    @Override
    public void saveSettings(ConfigurationSnapshot settings) {
        settingsRepository.upsertSettings(SETTINGS_ROW, settings.maxOracles(), settings.consensusThreshold(),
            settings.maxSubmissionsPerOracle(), settings.stalenessWindow()).block(timeout);
    }

    // ── ledger ──────────────────────────────────────────────────────────────

    @Override
    public List<Submission> loadSubmissions() {
        List<Submission> submissions = submissionRepository.findAll()
            .map(r -> new Submission(r.getSubjectId(), r.getOracleId(), r.getPrice(), r.getSubmittedAt()))
            .collectList()
            .block(timeout);
        log.info("Loaded submissions. count={}", submissions.size());
        return submissions;
    }

    @Override
    public Map<String, OracleActivity> loadActivity() {
        return activityRepository.findAll()
            .collectMap(OracleActivityRecord::getOracleId,
                        r -> new OracleActivity(r.getSubmissionCount(), r.getLastActive()))
            .block(timeout);
    }

    @Override
    public void saveSubmission(Submission submission, OracleActivity activity) {
        transactionalOperator.transactional(
                activityRepository.upsertActivity(submission.oracleId(),
                        activity.submissionCount(), activity.lastActive())
                    .then(submissionRepository.upsertSubmission(submission.subjectId(),
                        submission.oracleId(), submission.price(), submission.timestamp())))
            .block(timeout);
    }

    // ── valuations ──────────────────────────────────────────────────────────

    @Override
    public Map<Long, Valuation> loadValuations() {
        Map<Long, Valuation> valuations = valuationRepository.findAll()
            .collectMap(ValuationRecord::getSubjectId,
                        r -> new Valuation(r.getPrice(), r.getValuedAt(), r.getSourceCount()))
            .block(timeout);
        log.info("Loaded committed valuations. count={}", valuations.size());
        return valuations;
    }

    @Override
    public void saveValuation(long subjectId, Valuation valuation) {
        valuationRepository.upsertValuation(subjectId, valuation.value(), valuation.timestamp(),
            valuation.sourceCount()).block(timeout);
    }
}

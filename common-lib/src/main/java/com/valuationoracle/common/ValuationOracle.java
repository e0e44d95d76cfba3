package com.valuationoracle.common;

import com.valuationoracle.common.clock.LogicalClock;
import com.valuationoracle.common.consensus.AggregationStrategy;
import com.valuationoracle.common.consensus.ConsensusEngine;
import com.valuationoracle.common.consensus.SubmissionReceipt;
import com.valuationoracle.common.consensus.UpperMedianAggregationStrategy;
import com.valuationoracle.common.ledger.SubmissionLedger;
import com.valuationoracle.common.model.ConfigurationSnapshot;
import com.valuationoracle.common.model.Oracle;
import com.valuationoracle.common.model.OracleActivity;
import com.valuationoracle.common.model.Submission;
import com.valuationoracle.common.model.Valuation;
import com.valuationoracle.common.persistence.OracleStatePersistence;
import com.valuationoracle.common.registry.OracleConfiguration;
import com.valuationoracle.common.registry.OracleRegistry;
import com.valuationoracle.common.result.OracleResult;
import com.valuationoracle.common.store.ValuationStore;

import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Public surface of the valuation oracle: every read and write operation available to
 * downstream collaborators, backed by one registry, ledger, engine and store.
 *
 * <p>State lives in the given {@link OracleStatePersistence}. A new instance built over the
 * same persistence resumes exactly where the previous one stopped.
 *
 * <p>Writes return {@link OracleResult}; none of them throw for domain failures.
 * Reads never block behind submissions for other subjects.
 */
public class ValuationOracle {

    private final OracleRegistry   registry;
    private final SubmissionLedger ledger;
    private final ValuationStore   store;
    private final ConsensusEngine  engine;

    public ValuationOracle(OracleConfiguration configuration, LogicalClock clock,
                           OracleStatePersistence persistence) {
        this(configuration, clock, persistence, new UpperMedianAggregationStrategy());
    }

    public ValuationOracle(OracleConfiguration configuration, LogicalClock clock,
                           OracleStatePersistence persistence, AggregationStrategy strategy) {
        this.registry = new OracleRegistry(configuration, persistence);
        this.ledger   = new SubmissionLedger(registry, persistence);
        this.store    = new ValuationStore(persistence);
        this.engine   = new ConsensusEngine(registry, ledger, store, clock, strategy);
    }

    // ── writes ──────────────────────────────────────────────────────────────

    public OracleResult<Boolean> addOracle(String caller, String oracleId, int weight) {
        return registry.addOracle(caller, oracleId, weight);
    }

    public OracleResult<Boolean> removeOracle(String caller, String oracleId) {
        return registry.removeOracle(caller, oracleId);
    }

    public OracleResult<Boolean> setConsensusThreshold(String caller, int threshold) {
        return registry.setConsensusThreshold(caller, threshold);
    }

    public OracleResult<Boolean> setMaxOracles(String caller, int maxOracles) {
        return registry.setMaxOracles(caller, maxOracles);
    }

    public OracleResult<Boolean> setMaxSubmissionsPerOracle(String caller, int maxSubmissions) {
        return registry.setMaxSubmissionsPerOracle(caller, maxSubmissions);
    }

    public OracleResult<Boolean> setStalenessWindow(String caller, long window) {
        return registry.setStalenessWindow(caller, window);
    }

    /** @return the accepted price on success; query {@link #getValuation} for the aggregate */
    public OracleResult<Long> submitDataFeed(String caller, long subjectId, long price, String oracleId) {
        return engine.submitDataFeed(caller, subjectId, price, oracleId);
    }

    /** Same as {@link #submitDataFeed}, but also returns the valuation the submission committed. */
    public OracleResult<SubmissionReceipt> submitWithReceipt(String caller, long subjectId, long price,
                                                             String oracleId) {
        return engine.submit(caller, subjectId, price, oracleId);
    }

    // ── reads ───────────────────────────────────────────────────────────────

    public Optional<Valuation> getValuation(long subjectId) {
        return store.get(subjectId);
    }

    public boolean isOracleApproved(String oracleId) {
        return registry.isApproved(oracleId);
    }

    public OptionalInt getOracleWeight(String oracleId) {
        return registry.weightOf(oracleId);
    }

    public List<Oracle> getApprovedOracles() {
        return registry.approvedOracles();
    }

    public Optional<Submission> getSubmission(long subjectId, String oracleId) {
        return ledger.submissionOf(subjectId, oracleId);
    }

    public Optional<OracleActivity> getOracleActivity(String oracleId) {
        return ledger.activityOf(oracleId);
    }

    public ConfigurationSnapshot getConfiguration() {
        return registry.configuration().snapshot();
    }
}

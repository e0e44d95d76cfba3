package com.valuationoracle.common.consensus;

import com.valuationoracle.common.clock.LogicalClock;
import com.valuationoracle.common.ledger.SubmissionLedger;
import com.valuationoracle.common.model.Submission;
import com.valuationoracle.common.model.Valuation;
import com.valuationoracle.common.registry.OracleConfiguration;
import com.valuationoracle.common.registry.OracleRegistry;
import com.valuationoracle.common.result.OracleError;
import com.valuationoracle.common.result.OracleResult;
import com.valuationoracle.common.store.ValuationStore;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Single write entry point: validates a price submission, records it, recomputes the
 * subject's consensus and commits the result.
 *
 * <h3>Validation order (first failure wins, nothing is mutated)</h3>
 * <ol>
 *   <li>caller is the oracle it submits for: {@link OracleError#NOT_ORACLE}</li>
 *   <li>subject id is positive: {@link OracleError#INVALID_SUBJECT_ID}</li>
 *   <li>price is positive: {@link OracleError#INVALID_PRICE}</li>
 *   <li>oracle is currently approved: {@link OracleError#ORACLE_NOT_APPROVED}</li>
 *   <li>logical clock reads a positive time: {@link OracleError#INVALID_TIMESTAMP}</li>
 *   <li>staleness gate: {@link OracleError#STALE_DATA}</li>
 *   <li>oracle has quota left: {@link OracleError#MAX_SUBMISSIONS_EXCEEDED}</li>
 * </ol>
 *
 * <h3>Recomputation</h3>
 * <ol>
 *   <li>Collect the latest submission of every currently approved oracle for the subject.</li>
 *   <li>Fewer than {@code consensusThreshold} of them: {@link OracleError#INSUFFICIENT_ORACLES}.</li>
 *   <li>Sum of their weights below {@code consensusThreshold}: {@link OracleError#CONSENSUS_FAILED}.</li>
 *   <li>Otherwise commit {@code {aggregate, now, n}} to the {@link ValuationStore}.</li>
 * </ol>
 * The threshold is read once per computation and used for both gates. A consensus failure
 * leaves the submission recorded and the previous valuation untouched.
 *
 * <p>On success {@link #submitDataFeed} returns the accepted price, not the new aggregate;
 * {@link #submit} additionally carries the valuation this submission committed.
 *
 * <p>Thread-safe. Each submission holds the registry's shared lock and, once the oracle is
 * known to be approved, one of a fixed set of subject lock stripes from there to commit.
 * Submissions for subjects on different stripes proceed in parallel.
 */
public class ConsensusEngine {

    static final int LOCK_STRIPES = 64;

    private final OracleRegistry      registry;
    private final SubmissionLedger    ledger;
    private final ValuationStore      store;
    private final LogicalClock        clock;
    private final AggregationStrategy strategy;

    private final ReentrantLock[] subjectLocks = new ReentrantLock[LOCK_STRIPES];

    public ConsensusEngine(OracleRegistry registry,
                           SubmissionLedger ledger,
                           ValuationStore store,
                           LogicalClock clock,
                           AggregationStrategy strategy) {
        this.registry = registry;
        this.ledger   = ledger;
        this.store    = store;
        this.clock    = clock;
        this.strategy = strategy;
        for (int i = 0; i < LOCK_STRIPES; i++) {
            subjectLocks[i] = new ReentrantLock();
        }
    }

    public OracleResult<Long> submitDataFeed(String caller, long subjectId, long price, String oracleId) {
        OracleResult<SubmissionReceipt> result = submit(caller, subjectId, price, oracleId);
        return result.ok()
            ? OracleResult.success(result.value().price())
            : OracleResult.failure(result.error());
    }

    public OracleResult<SubmissionReceipt> submit(String caller, long subjectId, long price, String oracleId) {
        if (caller == null || !caller.equals(oracleId)) return OracleResult.failure(OracleError.NOT_ORACLE);
        if (subjectId <= 0)                             return OracleResult.failure(OracleError.INVALID_SUBJECT_ID);
        if (price <= 0)                                 return OracleResult.failure(OracleError.INVALID_PRICE);

        // approval cannot change while the shared lock is held
        return registry.underReadLock(() -> {
            if (!registry.isApproved(oracleId)) {
                return OracleResult.failure(OracleError.ORACLE_NOT_APPROVED);
            }
            return withSubjectLock(subjectId, () -> acceptLocked(subjectId, price, oracleId));
        });
    }

    private OracleResult<SubmissionReceipt> acceptLocked(long subjectId, long price, String oracleId) {
        OracleConfiguration config = registry.configuration();
        long now = clock.now();
        if (now <= 0) {
            return OracleResult.failure(OracleError.INVALID_TIMESTAMP);
        }
        if (StalenessGate.isStale(now, config.stalenessWindow())) {
            return OracleResult.failure(OracleError.STALE_DATA);
        }
        if (!ledger.recordSubmission(subjectId, oracleId, price, now, config.maxSubmissionsPerOracle())) {
            return OracleResult.failure(OracleError.MAX_SUBMISSIONS_EXCEEDED);
        }

        OracleResult<Valuation> consensus = recompute(subjectId, now, config.consensusThreshold());
        if (!consensus.ok()) {
            return OracleResult.failure(consensus.error());
        }
        return OracleResult.success(new SubmissionReceipt(price, consensus.value()));
    }

    private OracleResult<Valuation> recompute(long subjectId, long now, int threshold) {
        List<ContributingPrice> contributions = new ArrayList<>();
        for (Submission submission : ledger.submissionsFor(subjectId)) {
            registry.weightOf(submission.oracleId()).ifPresent(weight ->
                contributions.add(new ContributingPrice(submission.oracleId(), submission.price(), weight)));
        }

        if (contributions.size() < threshold) {
            return OracleResult.failure(OracleError.INSUFFICIENT_ORACLES);
        }
        long totalWeight = contributions.stream().mapToLong(ContributingPrice::weight).sum();
        if (totalWeight < threshold) {
            return OracleResult.failure(OracleError.CONSENSUS_FAILED);
        }

        Valuation valuation = new Valuation(strategy.aggregate(contributions), now, contributions.size());
        store.commit(subjectId, valuation);
        return OracleResult.success(valuation);
    }

    ReentrantLock lockFor(long subjectId) {
        return subjectLocks[Math.floorMod(Long.hashCode(subjectId), LOCK_STRIPES)];
    }

    private <T> T withSubjectLock(long subjectId, Supplier<T> action) {
        ReentrantLock lock = lockFor(subjectId);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}

package com.valuationoracle.common.persistence;

import com.valuationoracle.common.model.ConfigurationSnapshot;
import com.valuationoracle.common.model.Oracle;
import com.valuationoracle.common.model.OracleActivity;
import com.valuationoracle.common.model.Submission;
import com.valuationoracle.common.model.Valuation;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable backing of the registry, ledger and valuation store.
 *
 * <p>Each component loads its state once at construction and writes every mutation through
 * before applying it in memory, so a mutation that returned has been committed here. A
 * failed write propagates as an unchecked exception and leaves the in-memory view unchanged.
 *
 * <p>Implementations must be thread-safe. Calls are blocking.
 */
public interface OracleStatePersistence {

    /** Approved oracles in approval order. */
    List<Oracle> loadOracles();

    void saveOracle(Oracle oracle);

    void deleteOracle(String oracleId);

    Optional<ConfigurationSnapshot> loadSettings();

    void saveSettings(ConfigurationSnapshot settings);

    List<Submission> loadSubmissions();

    /** oracleId → lifetime activity. */
    Map<String, OracleActivity> loadActivity();

    /**
     * Writes the latest submission of an oracle for a subject together with the oracle's
     * updated activity counter, atomically.
     */
    void saveSubmission(Submission submission, OracleActivity activity);

    /** subjectId → committed valuation. */
    Map<Long, Valuation> loadValuations();

    void saveValuation(long subjectId, Valuation valuation);
}

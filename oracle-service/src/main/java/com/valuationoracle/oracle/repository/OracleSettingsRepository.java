package com.valuationoracle.oracle.repository;

import com.valuationoracle.oracle.model.OracleSettingsRecord;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

@Repository
public interface OracleSettingsRepository extends ReactiveCrudRepository<OracleSettingsRecord, Integer> {

    /**
     * Atomic UPSERT of the single settings row.
     *
     * @param id row key, always the same value
     */
    @Modifying
    @Query("""
        MERGE INTO oracle_settings
            (id, max_oracles, consensus_threshold, max_submissions_per_oracle, staleness_window)
        KEY (id)
        VALUES
            (:id, :maxOracles, :consensusThreshold, :maxSubmissionsPerOracle, :stalenessWindow)
        """)
    Mono<Void> upsertSettings(int id, int maxOracles, int consensusThreshold,
                              int maxSubmissionsPerOracle, long stalenessWindow);
}

package com.valuationoracle.oracle.repository;

import com.valuationoracle.oracle.model.OracleActivityRecord;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

@Repository
public interface OracleActivityRepository extends ReactiveCrudRepository<OracleActivityRecord, String> {

    /**
     * Writes the counter computed by the ledger. The ledger serializes updates per oracle,
     * so the stored count only ever moves forward.
     */
    @Modifying
    @Query("""
        MERGE INTO oracle_activity
            (oracle_id, submission_count, last_active)
        KEY (oracle_id)
        VALUES
            (:oracleId, :submissionCount, :lastActive)
        """)
    Mono<Void> upsertActivity(String oracleId, int submissionCount, long lastActive);
}

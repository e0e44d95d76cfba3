package com.valuationoracle.oracle.repository;

import com.valuationoracle.oracle.model.SubmissionRecord;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

@Repository
public interface SubmissionRecordRepository extends ReactiveCrudRepository<SubmissionRecord, Long> {

    /**
     * Atomic UPSERT: inserts the (subject, oracle) slot or overwrites its price and time.
     */
    @Modifying
    @Query("""
        MERGE INTO oracle_submission
            (subject_id, oracle_id, price, submitted_at)
        KEY (subject_id, oracle_id)
        VALUES
            (:subjectId, :oracleId, :price, :submittedAt)
        """)
    Mono<Void> upsertSubmission(long subjectId, String oracleId, long price, long submittedAt);
}

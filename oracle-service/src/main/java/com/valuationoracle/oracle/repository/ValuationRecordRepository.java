package com.valuationoracle.oracle.repository;

import com.valuationoracle.oracle.model.ValuationRecord;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

@Repository
public interface ValuationRecordRepository extends ReactiveCrudRepository<ValuationRecord, Long> {

    /**
     * Atomic UPSERT: replaces the subject's committed valuation as a whole.
     */
    @Modifying
    @Query("""
        MERGE INTO valuation
            (subject_id, price, valued_at, source_count)
        KEY (subject_id)
        VALUES
            (:subjectId, :price, :valuedAt, :sourceCount)
        """)
    Mono<Void> upsertValuation(long subjectId, long price, long valuedAt, int sourceCount);
}

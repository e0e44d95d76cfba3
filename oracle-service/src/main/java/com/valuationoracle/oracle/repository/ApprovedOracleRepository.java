package com.valuationoracle.oracle.repository;

import com.valuationoracle.oracle.model.ApprovedOracleRecord;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface ApprovedOracleRepository extends ReactiveCrudRepository<ApprovedOracleRecord, Long> {

    @Query("SELECT * FROM approved_oracle ORDER BY seq")
    Flux<ApprovedOracleRecord> findAllInApprovalOrder();

    @Modifying
    @Query("INSERT INTO approved_oracle (oracle_id, weight) VALUES (:oracleId, :weight)")
    Mono<Void> insertOracle(String oracleId, int weight);

    @Modifying
    @Query("DELETE FROM approved_oracle WHERE oracle_id = :oracleId")
    Mono<Void> deleteByOracleId(String oracleId);
}

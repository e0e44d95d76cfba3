package com.valuationoracle.oracle.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

/**
 * Durable approval of one oracle. {@code seq} is assigned on insert and orders the
 * approved set by approval time.
 */
@Data
@NoArgsConstructor
@Table("approved_oracle")
public class ApprovedOracleRecord {

    @Id
    private Long seq;

    private String oracleId;

    private Integer weight;
}

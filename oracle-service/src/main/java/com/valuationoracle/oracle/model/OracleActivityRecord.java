package com.valuationoracle.oracle.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

@Data
@NoArgsConstructor
@Table("oracle_activity")
public class OracleActivityRecord {

    @Id
    private String oracleId;

    private Integer submissionCount;

    private Long lastActive;
}

package com.valuationoracle.oracle.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

/**
 * Latest submission of one oracle for one subject. Unique on (subjectId, oracleId);
 * a newer submission overwrites the row in place.
 */
@Data
@NoArgsConstructor
@Table("oracle_submission")
public class SubmissionRecord {

    @Id
    private Long id;

    private Long subjectId;

    private String oracleId;

    private Long price;

    private Long submittedAt;
}

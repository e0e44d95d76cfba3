package com.valuationoracle.oracle.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

/**
 * Committed valuation of a subject. {@code price} holds the aggregated value and
 * {@code valuedAt} the logical time of the computation.
 */
@Data
@NoArgsConstructor
@Table("valuation")
public class ValuationRecord {

    @Id
    private Long subjectId;

    private Long price;

    private Long valuedAt;

    private Integer sourceCount;
}

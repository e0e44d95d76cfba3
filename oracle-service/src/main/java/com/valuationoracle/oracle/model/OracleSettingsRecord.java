package com.valuationoracle.oracle.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

/**
 * Single-row table holding the admin-mutable settings. The admin identity is not stored;
 * it always comes from configuration.
 */
@Data
@NoArgsConstructor
@Table("oracle_settings")
public class OracleSettingsRecord {

    @Id
    private Integer id;

    private Integer maxOracles;

    private Integer consensusThreshold;

    private Integer maxSubmissionsPerOracle;

    private Long stalenessWindow;
}

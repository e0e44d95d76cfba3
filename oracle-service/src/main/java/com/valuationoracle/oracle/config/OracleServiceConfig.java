package com.valuationoracle.oracle.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.valuationoracle.common.ValuationOracle;
import com.valuationoracle.common.clock.EpochSecondsClock;
import com.valuationoracle.common.clock.LogicalClock;
import com.valuationoracle.common.consensus.AggregationStrategy;
import com.valuationoracle.common.consensus.UpperMedianAggregationStrategy;
import com.valuationoracle.common.persistence.OracleStatePersistence;
import com.valuationoracle.common.registry.OracleConfiguration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OracleServiceConfig {

    @Value("${oracle.admin-id}")
    private String adminId;

    @Value("${oracle.max-oracles:" + OracleConfiguration.DEFAULT_MAX_ORACLES + "}")
    private int maxOracles;

    @Value("${oracle.consensus-threshold:" + OracleConfiguration.DEFAULT_CONSENSUS_THRESHOLD + "}")
    private int consensusThreshold;

    @Value("${oracle.max-submissions-per-oracle:" + OracleConfiguration.DEFAULT_MAX_SUBMISSIONS_PER_ORACLE + "}")
    private int maxSubmissionsPerOracle;

    @Value("${oracle.staleness-window:" + OracleConfiguration.DEFAULT_STALENESS_WINDOW + "}")
    private long stalenessWindow;

    @Bean
    public OracleConfiguration oracleConfiguration() {
        return new OracleConfiguration(adminId, maxOracles, consensusThreshold,
            maxSubmissionsPerOracle, stalenessWindow);
    }

    @Bean
    public LogicalClock logicalClock() {
        return new EpochSecondsClock();
    }

    @Bean
    public AggregationStrategy aggregationStrategy() {
        return new UpperMedianAggregationStrategy();
    }

    /** Resumes from whatever the persistence already holds; configured settings are only defaults. */
    @Bean
    public ValuationOracle valuationOracle(OracleConfiguration configuration,
                                           LogicalClock clock,
                                           OracleStatePersistence persistence,
                                           AggregationStrategy strategy) {
        return new ValuationOracle(configuration, clock, persistence, strategy);
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
